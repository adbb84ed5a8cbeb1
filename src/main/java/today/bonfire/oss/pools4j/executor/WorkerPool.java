package today.bonfire.oss.pools4j.executor;

/**
 * A bounded set of worker threads that runs submitted tasks.
 * <p>
 * At most {@link #cap()} tasks run at the same time. When the pool is full a non-blocking
 * pool rejects with {@link WorkerPoolFullException}, a blocking pool makes the submitter wait
 * for a free slot. Once {@link #release()} has been called every submission fails with
 * {@link WorkerPoolClosedException}, including submitters that were already waiting.
 */
public interface WorkerPool {

  /**
   * @throws WorkerPoolFullException   if the pool is non-blocking and at capacity
   * @throws WorkerPoolClosedException if the pool has been released
   */
  void submit(Runnable task);

  /**
   * @return number of tasks currently holding a worker slot
   */
  int running();

  /**
   * @return number of free worker slots
   */
  int free();

  int cap();

  boolean isClosed();

  /**
   * Stops accepting tasks and blocks until every accepted task has finished,
   * then frees the worker threads.
   */
  void release();
}
