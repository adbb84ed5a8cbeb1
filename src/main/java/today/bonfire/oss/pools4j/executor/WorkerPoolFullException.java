package today.bonfire.oss.pools4j.executor;

import java.util.concurrent.RejectedExecutionException;

public class WorkerPoolFullException extends RejectedExecutionException {

  public WorkerPoolFullException(String poolName, int capacity) {
    super("Worker pool " + poolName + " is at capacity " + capacity);
  }

}
