package tech.notifyrelay.notify.error;

/**
 * The transport of a single client session failed. Only that session is affected.
 */
public class SessionBrokenException extends NotifyRelayException {

    private final String sessionId;

    public SessionBrokenException(String sessionId, String message) {
        super(message);
        this.sessionId = sessionId;
    }

    public SessionBrokenException(String sessionId, String message, Throwable cause) {
        super(message, cause);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
