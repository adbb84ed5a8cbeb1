package today.bonfire.oss.pools4j.service;

import lombok.extern.slf4j.Slf4j;

/**
 * Runs a task and hands anything it throws to the pool's {@link PanicHandler}
 * so a failing task never takes its worker down.
 */
@Slf4j
class PanicRecoveringTask implements Runnable {

  private final String       poolName;
  private final Runnable     task;
  private final PanicHandler panicHandler;

  PanicRecoveringTask(String poolName, Runnable task, PanicHandler panicHandler) {
    this.poolName     = poolName;
    this.task         = task;
    this.panicHandler = panicHandler;
  }

  @Override
  public void run() {
    try {
      task.run();
    } catch (Exception e) {
      try {
        panicHandler.handlePanic(poolName, e);
      } catch (Exception handlerError) {
        log.error("Panic handler failed for pool {} while handling {}", poolName, e.toString(), handlerError);
      }
    }
  }
}
