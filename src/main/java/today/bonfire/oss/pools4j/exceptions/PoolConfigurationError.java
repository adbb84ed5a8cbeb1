package today.bonfire.oss.pools4j.exceptions;

public class PoolConfigurationError extends RuntimeException {

  private PoolConfigurationError() {}

  public PoolConfigurationError(String message) {
    super(Errors.CONFIGURATION_ERROR + message);
  }

  public PoolConfigurationError(String message, Throwable cause) {
    super(Errors.CONFIGURATION_ERROR + message, cause);
  }

}
