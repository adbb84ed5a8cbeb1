package today.bonfire.oss.pools4j.exceptions;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.time.Duration;

/**
 * Thrown when a pool did not finish draining within the allowed time.
 * the drain is not cancelled, pool threads are freed once the remaining tasks complete.
 */
@Accessors(fluent = true)
public class PoolReleaseTimeoutException extends RuntimeException {

  @Getter
  private final String   poolName;
  @Getter
  private final Duration timeout;

  public PoolReleaseTimeoutException(String poolName, Duration timeout) {
    super(Errors.SHUTDOWN_TIMEOUT + "for pool " + poolName + " after " + timeout.toMillis() + "ms");
    this.poolName = poolName;
    this.timeout  = timeout;
  }

}
