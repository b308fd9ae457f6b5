package changefeed.jdbc;

/**
 * Unchecked wrapper for JDBC failures raised by change store operations.
 */
public class ChangeStoreException extends RuntimeException {

  public ChangeStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
