package today.bonfire.oss.pools4j.config;

import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import today.bonfire.oss.pools4j.common.PoolConstants;
import today.bonfire.oss.pools4j.exceptions.PoolConfigurationError;
import today.bonfire.oss.pools4j.service.PoolConfig;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;

/**
 * The {@code executor} section of the application config.
 * <p>
 * Validation here is strict: out of range values are rejected so that a bad config file is
 * noticed at startup, whereas {@link PoolConfig#validate()} repairs them.
 */
public record ExecutorSettings(boolean enabled, List<PoolSettings> pools) {

  public ExecutorSettings {
    pools = pools == null ? List.of() : List.copyOf(pools);
  }

  public static ExecutorSettings disabled() {
    return new ExecutorSettings(false, List.of());
  }

  /**
   * disabled settings are always valid.
   *
   * @throws PoolConfigurationError on the first invalid pool entry
   */
  public void validate() {
    if (!enabled) return;

    if (ObjectUtils.isEmpty(pools))
      throw new PoolConfigurationError("At least one pool is required when executor is enabled");

    var names = new HashSet<String>();
    for (int i = 0; i < pools.size(); i++) {
      var pool = pools.get(i);
      if (StringUtils.isBlank(pool.name()))
        throw new PoolConfigurationError("Pool " + i + ": name is required");
      if (!names.add(pool.name()))
        throw new PoolConfigurationError("Duplicate pool name: " + pool.name());
      if (pool.size() <= 0)
        throw new PoolConfigurationError("Pool " + pool.name() + ": size must be positive");
      if (pool.size() > PoolConstants.MAX_POOL_SIZE)
        throw new PoolConfigurationError("Pool " + pool.name() + ": size must not exceed " + PoolConstants.MAX_POOL_SIZE);
      if (pool.expirySeconds() < 0)
        throw new PoolConfigurationError("Pool " + pool.name() + ": expiry must be non-negative");
      if (pool.expirySeconds() > PoolConstants.MAX_WORKER_EXPIRY.toSeconds())
        throw new PoolConfigurationError("Pool " + pool.name() + ": expiry must not exceed "
                                         + PoolConstants.MAX_WORKER_EXPIRY.toSeconds() + " seconds");
    }
  }

  public List<PoolConfig> toPoolConfigs() {
    return pools.stream()
                .map(p -> new PoolConfig(p.name(), p.size(), Duration.ofSeconds(p.expirySeconds()), p.nonBlocking()))
                .toList();
  }
}
