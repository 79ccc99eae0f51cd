package tech.notifyrelay.notify.error;

/**
 * An established connection dropped. Always retried by the owning component.
 */
public class DisconnectedException extends NotifyRelayException {

    public DisconnectedException(String message) {
        super(message);
    }

    public DisconnectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
