package tech.notifyrelay.stream.session;

import tech.notifyrelay.notify.error.SessionBrokenException;
import tech.notifyrelay.notify.model.ChangeEvent;

/**
 * The client-facing side of a session. The core only needs "deliver or detect death".
 */
public interface SessionTransport {

    /**
     * Writes one event to the client. May block while the client is slow.
     *
     * @throws SessionBrokenException if the underlying connection failed
     */
    void send(ChangeEvent event) throws SessionBrokenException;

    /**
     * Closes the underlying connection. Must be safe to call on an already closed transport.
     */
    void close();

    String describe();
}
