package tech.notifyrelay.stream.endpoint;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.websocket.CloseReason;
import jakarta.websocket.Session;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import tech.notifyrelay.notify.codec.EventCodec;
import tech.notifyrelay.notify.model.ChannelSet;
import tech.notifyrelay.stream.manager.ConnectionManager;
import tech.notifyrelay.stream.support.FakeBusClient;
import tech.notifyrelay.stream.support.FakeUpstream;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class StreamSocketTest {

    private ConnectionManager manager;
    private StreamSocket socket;

    @BeforeEach
    void setUp() {
        manager = new ConnectionManager(new FakeBusClient(true), new FakeUpstream(), ChannelSet.defaults(),
            new SimpleMeterRegistry(), true, Duration.ofMillis(100), 16);
        manager.start();
        socket = new StreamSocket();
        socket.connectionManager = manager;
        socket.codec = new EventCodec();
    }

    @AfterEach
    void tearDown() {
        manager.shutdown();
    }

    private Session session(Map<String, List<String>> params) {
        Session session = mock(Session.class);
        when(session.getId()).thenReturn("ws-1");
        when(session.isOpen()).thenReturn(true);
        when(session.getRequestParameterMap()).thenReturn(params);
        when(session.getUserProperties()).thenReturn(new HashMap<>());
        return session;
    }

    @Test
    void shouldParseCommaSeparatedChannels() {
        assertNull(StreamSocket.parseChannels(null));
        assertEquals(List.of("match_change", "scoreboard_change"),
            StreamSocket.parseChannels(List.of("match_change, scoreboard_change,")));
        assertEquals(List.of(), StreamSocket.parseChannels(List.of(" ")));
    }

    @Test
    void shouldRegisterSessionOnOpenAndRemoveItOnClose() {
        Session session = session(Map.of("channels", List.of("match_change")));

        socket.onOpen(session);

        String sessionId = (String) session.getUserProperties().get(StreamSocket.SESSION_ID);
        assertNotNull(sessionId);
        assertEquals(1, manager.getSessionCount());
        assertEquals(1, manager.getSubscriberCount("match_change"));

        socket.onClose(session, new CloseReason(CloseReason.CloseCodes.NORMAL_CLOSURE, "bye"));
        assertEquals(0, manager.getSessionCount());
    }

    @Test
    void shouldSubscribeToAllChannelsWithoutParameter() {
        Session session = session(Map.of());

        socket.onOpen(session);

        assertEquals(1, manager.getSubscriberCount("player_match_change"));
        assertEquals(1, manager.getSubscriberCount("matchdata_change"));
    }

    @Test
    void shouldRejectUnknownChannel() throws Exception {
        Session session = session(Map.of("channels", List.of("match_change,bogus")));

        socket.onOpen(session);

        ArgumentCaptor<CloseReason> captor = ArgumentCaptor.forClass(CloseReason.class);
        verify(session).close(captor.capture());
        assertEquals(CloseReason.CloseCodes.CANNOT_ACCEPT, captor.getValue().getCloseCode());
        assertEquals(0, manager.getSessionCount());
        assertNull(session.getUserProperties().get(StreamSocket.SESSION_ID));
    }

    @Test
    void shouldDisconnectOnError() {
        Session session = session(Map.of("channels", List.of("gameclock_change")));
        socket.onOpen(session);
        String sessionId = (String) session.getUserProperties().get(StreamSocket.SESSION_ID);

        socket.onError(session, new IllegalStateException("reset"));

        assertEquals(0, manager.getSessionCount());
    }
}
