package today.bonfire.oss.pools4j.common;

import java.time.Duration;
import java.util.List;

/**
 * Pool constants
 */
public class PoolConstants {
  public static final int      MIN_POOL_SIZE         = 1;
  public static final int      MAX_POOL_SIZE         = 10000;
  public static final int      DEFAULT_POOL_SIZE     = 100;
  public static final boolean  DEFAULT_NON_BLOCKING  = true;
  public static final Duration DEFAULT_WORKER_EXPIRY = Duration.ofSeconds(10);
  public static final Duration MAX_WORKER_EXPIRY     = Duration.ofDays(1);

  /**
   * upper bound for how long reload and shutdown wait on a single pool to drain.
   * the drain itself is never interrupted.
   */
  public static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

  /**
   * pool names shared by the application. values must match the names in the executor config file.
   */
  public static class Names {
    /** request side work such as access logging and stats, non-blocking */
    public static final String HTTP       = "http";
    /** batch updates and data sync, blocking so work is not lost */
    public static final String DATABASE   = "database";
    /** cache warmup and invalidation, non-blocking */
    public static final String CACHE      = "cache";
    /** log flushing and shipping, blocking */
    public static final String LOGGER     = "logger";
    /** mail, push and file processing, non-blocking */
    public static final String BACKGROUND = "background";

    public static final List<String> ALL = List.of(HTTP, DATABASE, CACHE, LOGGER, BACKGROUND);

    private Names() {}
  }

  private PoolConstants() {}
}
