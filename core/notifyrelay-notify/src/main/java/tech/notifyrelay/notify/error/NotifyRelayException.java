package tech.notifyrelay.notify.error;

/**
 * Base class for failures of the relay's upstream, bus and session connections.
 */
public abstract class NotifyRelayException extends Exception {

    protected NotifyRelayException(String message) {
        super(message);
    }

    protected NotifyRelayException(String message, Throwable cause) {
        super(message, cause);
    }
}
