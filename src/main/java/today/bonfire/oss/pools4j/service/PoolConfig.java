package today.bonfire.oss.pools4j.service;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import today.bonfire.oss.pools4j.common.PoolConstants;
import today.bonfire.oss.pools4j.exceptions.PoolConfigurationError;

import java.time.Duration;

/**
 * Configuration of one named pool.
 *
 * @param name        unique pool name, used to route tasks
 * @param size        maximum number of tasks running at the same time
 * @param expiry      idle workers are recycled after this duration
 * @param nonBlocking when true a full pool rejects new tasks instead of making the submitter wait
 */
public record PoolConfig(String name, int size, Duration expiry, boolean nonBlocking) {
  private static final Logger log = org.slf4j.LoggerFactory.getLogger(PoolConfig.class);

  public static PoolConfig of(String name, int size, boolean nonBlocking) {
    return new PoolConfig(name, size, PoolConstants.DEFAULT_WORKER_EXPIRY, nonBlocking);
  }

  /**
   * Returns a copy with size and expiry repaired to legal values.
   * Out of range sizes are clamped to [{@link PoolConstants#MIN_POOL_SIZE}, {@link PoolConstants#MAX_POOL_SIZE}]
   * and a missing or non-positive expiry becomes {@link PoolConstants#DEFAULT_WORKER_EXPIRY}.
   * Expiry above {@link PoolConstants#MAX_WORKER_EXPIRY} is capped.
   * Every repair is logged as a warning.
   *
   * @throws PoolConfigurationError if the name is blank, the only condition that is not repaired
   */
  public PoolConfig validate() {
    if (StringUtils.isBlank(name))
      throw new PoolConfigurationError("Pool name cannot be null or blank");

    int validSize = size;
    if (validSize < PoolConstants.MIN_POOL_SIZE) {
      log.warn("Pool {} size {} is below the minimum, using {}", name, size, PoolConstants.MIN_POOL_SIZE);
      validSize = PoolConstants.MIN_POOL_SIZE;
    } else if (validSize > PoolConstants.MAX_POOL_SIZE) {
      log.warn("Pool {} size {} is above the maximum, using {}", name, size, PoolConstants.MAX_POOL_SIZE);
      validSize = PoolConstants.MAX_POOL_SIZE;
    }

    var validExpiry = expiry;
    if (validExpiry == null || validExpiry.isNegative() || validExpiry.isZero()) {
      log.warn("Pool {} expiry {} is not positive, using {}", name, expiry, PoolConstants.DEFAULT_WORKER_EXPIRY);
      validExpiry = PoolConstants.DEFAULT_WORKER_EXPIRY;
    } else if (validExpiry.compareTo(PoolConstants.MAX_WORKER_EXPIRY) > 0) {
      log.warn("Pool {} expiry {} is above the maximum, using {}", name, expiry, PoolConstants.MAX_WORKER_EXPIRY);
      validExpiry = PoolConstants.MAX_WORKER_EXPIRY;
    }

    return new PoolConfig(name, validSize, validExpiry, nonBlocking);
  }
}
