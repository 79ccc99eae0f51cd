package tech.notifyrelay.stream.endpoint;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.websocket.CloseReason;
import jakarta.websocket.OnClose;
import jakarta.websocket.OnError;
import jakarta.websocket.OnOpen;
import jakarta.websocket.Session;
import jakarta.websocket.server.ServerEndpoint;
import org.jboss.logging.Logger;
import tech.notifyrelay.notify.codec.EventCodec;
import tech.notifyrelay.stream.manager.ConnectionManager;
import tech.notifyrelay.stream.session.ClientSession;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Streaming endpoint. Clients connect to {@code /ws/stream?channels=a,b}; without the
 * parameter they receive every relayed channel.
 */
@ServerEndpoint("/ws/stream")
@ApplicationScoped
public class StreamSocket {

    private static final Logger LOG = Logger.getLogger(StreamSocket.class);

    static final String SESSION_ID = "notifyrelay.sessionId";

    // Close reason phrases are limited to 123 bytes
    private static final int MAX_REASON = 120;

    @Inject
    ConnectionManager connectionManager;

    @Inject
    EventCodec codec;

    @OnOpen
    public void onOpen(Session session) {
        List<String> requested = parseChannels(session.getRequestParameterMap().get("channels"));
        ClientSession clientSession;
        try {
            clientSession = connectionManager.accept(
                new WebSocketSessionTransport(session, new ClientMessageEncoder(codec.objectMapper())), requested);
        } catch (IllegalArgumentException | IllegalStateException e) {
            LOG.infof("Rejecting stream connection wsId=%s reason=%s", session.getId(), e.getMessage());
            CloseReason.CloseCode code = e instanceof IllegalArgumentException
                ? CloseReason.CloseCodes.CANNOT_ACCEPT
                : CloseReason.CloseCodes.TRY_AGAIN_LATER;
            closeQuietly(session, new CloseReason(code, truncate(e.getMessage())));
            return;
        }
        session.getUserProperties().put(SESSION_ID, clientSession.getId());
    }

    @OnClose
    public void onClose(Session session, CloseReason reason) {
        String sessionId = (String) session.getUserProperties().get(SESSION_ID);
        if (sessionId != null) {
            connectionManager.disconnect(sessionId, "client closed: " + reason.getCloseCode().getCode());
        }
    }

    @OnError
    public void onError(Session session, Throwable error) {
        String sessionId = (String) session.getUserProperties().get(SESSION_ID);
        LOG.warnf("Stream connection error wsId=%s sessionId=%s: %s", session.getId(), sessionId, error.getMessage());
        if (sessionId != null) {
            connectionManager.disconnect(sessionId, "transport error");
        }
    }

    /**
     * @return requested channel names, or null if the parameter is absent
     */
    static List<String> parseChannels(List<String> values) {
        if (values == null) {
            return null;
        }
        List<String> channels = new ArrayList<>();
        for (String value : values) {
            for (String part : value.split(",")) {
                String name = part.trim();
                if (!name.isEmpty()) {
                    channels.add(name);
                }
            }
        }
        return channels;
    }

    private static String truncate(String reason) {
        if (reason == null) {
            return "";
        }
        return reason.length() <= MAX_REASON ? reason : reason.substring(0, MAX_REASON);
    }

    private void closeQuietly(Session session, CloseReason reason) {
        try {
            session.close(reason);
        } catch (IOException e) {
            LOG.debugf("Closing rejected connection failed wsId=%s: %s", session.getId(), e.getMessage());
        }
    }
}
