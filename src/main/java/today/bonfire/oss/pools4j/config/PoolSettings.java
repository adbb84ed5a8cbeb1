package today.bonfire.oss.pools4j.config;

/**
 * One entry of {@code executor.pools} in the application config.
 *
 * @param expirySeconds idle worker expiry in seconds, 0 means the default expiry
 */
public record PoolSettings(String name, int size, long expirySeconds, boolean nonBlocking) {}
