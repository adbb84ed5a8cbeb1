package today.bonfire.oss.pools4j.service;

/**
 * Receives failures thrown by submitted tasks.
 * <p>
 * Called on the worker thread that ran the task, right after the failure was caught.
 * The task is abandoned afterwards, the submitter is never told.
 */
@FunctionalInterface
public interface PanicHandler {

  /**
   * @param poolName name of the pool the task ran on
   * @param failure  what the task threw
   */
  void handlePanic(String poolName, Throwable failure);
}
