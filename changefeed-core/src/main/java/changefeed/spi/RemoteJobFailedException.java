package changefeed.spi;

/**
 * Signals that the remote catalog reported a failed job, or never answered it.
 * Feed clients complete their futures exceptionally with this exception.
 */
public class RemoteJobFailedException extends RuntimeException {

  public RemoteJobFailedException(String message) {
    super(message);
  }

  public RemoteJobFailedException(String message, Throwable cause) {
    super(message, cause);
  }
}
