package tech.notifyrelay.notify.error;

/**
 * The bus connection was down at publish time. The event is dropped.
 */
public class PublishFailedException extends NotifyRelayException {

    public PublishFailedException(String message) {
        super(message);
    }

    public PublishFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
