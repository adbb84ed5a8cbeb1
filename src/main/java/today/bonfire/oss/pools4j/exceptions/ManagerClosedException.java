package today.bonfire.oss.pools4j.exceptions;

public class ManagerClosedException extends RuntimeException {

  public ManagerClosedException() {
    super(Errors.MANAGER_CLOSED);
  }

  public ManagerClosedException(Throwable cause) {
    super(Errors.MANAGER_CLOSED, cause);
  }

}
