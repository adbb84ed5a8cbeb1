package today.bonfire.oss.pools4j.exceptions;

public class Errors {
  public static final String POOL_NOT_FOUND      = "ERR01_Pool not found: ";
  public static final String POOL_OVERLOAD       = "ERR02_Pool overloaded: ";
  public static final String MANAGER_CLOSED      = "ERR03_Manager is closed";
  public static final String CONFIGURATION_ERROR = "ERR11_Error in configuration ";
  public static final String SHUTDOWN_TIMEOUT    = "ERR13_Shutdown timeout exceeded ";
}
