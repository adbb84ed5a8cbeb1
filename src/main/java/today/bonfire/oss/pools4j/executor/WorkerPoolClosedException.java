package today.bonfire.oss.pools4j.executor;

import java.util.concurrent.RejectedExecutionException;

public class WorkerPoolClosedException extends RejectedExecutionException {

  public WorkerPoolClosedException(String poolName) {
    super("Worker pool " + poolName + " is closed");
  }

  public WorkerPoolClosedException(String poolName, Throwable cause) {
    super("Worker pool " + poolName + " is closed", cause);
  }

}
