package today.bonfire.oss.pools4j.exceptions;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Thrown when a non-blocking pool is at capacity.
 * the task was not started, callers decide whether to reject, run inline or drop it.
 */
@Accessors(fluent = true)
public class PoolOverloadException extends RuntimeException {

  @Getter
  private final String poolName;

  public PoolOverloadException(String poolName) {
    super(Errors.POOL_OVERLOAD + poolName);
    this.poolName = poolName;
  }

  public PoolOverloadException(String poolName, Throwable cause) {
    super(Errors.POOL_OVERLOAD + poolName, cause);
    this.poolName = poolName;
  }

}
