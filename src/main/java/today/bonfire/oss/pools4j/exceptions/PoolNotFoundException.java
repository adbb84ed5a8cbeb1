package today.bonfire.oss.pools4j.exceptions;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Thrown when a task is submitted to a pool name that is not part of the active configuration.
 */
@Accessors(fluent = true)
public class PoolNotFoundException extends RuntimeException {

  @Getter
  private final String poolName;

  public PoolNotFoundException(String poolName) {
    super(Errors.POOL_NOT_FOUND + poolName);
    this.poolName = poolName;
  }

}
