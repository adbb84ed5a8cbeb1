package today.bonfire.oss.pools4j.service;

import lombok.extern.slf4j.Slf4j;

/**
 * Used when no {@link PanicHandler} is configured. Writes one error line per failed task.
 */
@Slf4j
public final class LoggingPanicHandler implements PanicHandler {

  public static final LoggingPanicHandler INSTANCE = new LoggingPanicHandler();

  private LoggingPanicHandler() {}

  @Override
  public void handlePanic(String poolName, Throwable failure) {
    log.error("[EXECUTOR PANIC] pool={} panic={}", poolName, failure.toString(), failure);
  }
}
