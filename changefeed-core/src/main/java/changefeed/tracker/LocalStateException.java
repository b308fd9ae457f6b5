package changefeed.tracker;

/**
 * Unchecked exception raised when the local state file cannot be read or written.
 */
public final class LocalStateException extends RuntimeException {
  public LocalStateException(String message, Throwable cause) {
    super(message, cause);
  }
}
