package tech.notifyrelay.stream.endpoint;

import com.fasterxml.jackson.core.JsonProcessingException;
import jakarta.websocket.CloseReason;
import jakarta.websocket.Session;
import org.jboss.logging.Logger;
import tech.notifyrelay.notify.error.SessionBrokenException;
import tech.notifyrelay.notify.model.ChangeEvent;
import tech.notifyrelay.stream.session.SessionTransport;

import java.io.IOException;

/**
 * Session transport over a Jakarta WebSocket session, using the blocking basic remote.
 */
public class WebSocketSessionTransport implements SessionTransport {

    private static final Logger LOG = Logger.getLogger(WebSocketSessionTransport.class);

    private final Session session;
    private final ClientMessageEncoder encoder;

    public WebSocketSessionTransport(Session session, ClientMessageEncoder encoder) {
        this.session = session;
        this.encoder = encoder;
    }

    @Override
    public void send(ChangeEvent event) throws SessionBrokenException {
        if (!session.isOpen()) {
            throw new SessionBrokenException(session.getId(), "WebSocket already closed");
        }
        String text;
        try {
            text = encoder.encode(event);
        } catch (JsonProcessingException e) {
            throw new SessionBrokenException(session.getId(), "Could not encode event for channel " + event.channel(), e);
        }
        try {
            session.getBasicRemote().sendText(text);
        } catch (IOException e) {
            throw new SessionBrokenException(session.getId(), "WebSocket send failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(new CloseReason(CloseReason.CloseCodes.GOING_AWAY, "session closed"));
        } catch (IOException e) {
            LOG.debugf("WebSocket close failed wsId=%s: %s", session.getId(), e.getMessage());
        }
    }

    @Override
    public String describe() {
        return "websocket:" + session.getId();
    }
}
