package tech.notifyrelay.listener;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import tech.notifyrelay.notify.bus.BusClient;
import tech.notifyrelay.notify.error.ConnectFailedException;
import tech.notifyrelay.notify.error.PublishFailedException;
import tech.notifyrelay.notify.model.ChangeEvent;
import tech.notifyrelay.notify.model.ChannelSet;

import java.time.Duration;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class NotifyRelayTest {

    private static final Duration INTERVAL = Duration.ofMillis(100);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ChannelSet channels = ChannelSet.defaults();

    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

    private BusClient busClient;
    private Queue<FakeUpstreamClient> scripted;
    private List<FakeUpstreamClient> created;
    private AtomicInteger fatalExits;
    private NotifyRelay relay;

    @BeforeEach
    void setUp() {
        busClient = mock(BusClient.class);
        when(busClient.isHealthy()).thenReturn(true);
        scripted = new ConcurrentLinkedQueue<>();
        created = new CopyOnWriteArrayList<>();
        fatalExits = new AtomicInteger();

        relay = new NotifyRelay(busClient, owner -> {
            FakeUpstreamClient next = scripted.poll();
            FakeUpstreamClient client = next != null ? next : new FakeUpstreamClient();
            created.add(client);
            return client;
        }, channels, meterRegistry, INTERVAL, fatalExits::incrementAndGet);
    }

    @AfterEach
    void tearDown() {
        relay.stop();
    }

    @Test
    void shouldForwardNotificationsToBusInArrivalOrder() throws Exception {
        // Given
        relay.start();
        await().until(() -> relay.getStatus().upstreamOpen());
        FakeUpstreamClient upstream = created.get(0);
        assertEquals(channels, upstream.openedWith());

        // When
        JsonNode first = objectMapper.readTree("{\"id\": 1}");
        JsonNode second = objectMapper.readTree("{\"id\": 2}");
        upstream.emit(ChangeEvent.of("match_change", first));
        upstream.emit(ChangeEvent.of("scoreboard_change", second));

        // Then
        InOrder inOrder = inOrder(busClient);
        inOrder.verify(busClient).publish("match_change", first);
        inOrder.verify(busClient).publish("scoreboard_change", second);
        assertEquals(2, relay.getStatus().forwarded());
        verify(busClient).listen();
    }

    @Test
    void shouldDropEventWhenBusIsDown() throws Exception {
        // Given
        doThrow(new PublishFailedException("Bus connection is down"))
            .when(busClient).publish(anyString(), any(JsonNode.class));
        relay.start();
        await().until(() -> relay.getStatus().upstreamOpen());

        // When
        created.get(0).emit(ChangeEvent.of("match_change", objectMapper.createObjectNode()));

        // Then
        NotifyRelay.RelayStatus status = relay.getStatus();
        assertEquals(0, status.forwarded());
        assertEquals(1, status.dropped());
        assertEquals(1.0, meterRegistry.get("notifyrelay.relay.dropped").counter().count());
        assertTrue(status.upstreamOpen(), "A bus outage must not affect the LISTEN subscription");
    }

    @Test
    void shouldRetryUnreachableUpstreamEveryInterval() {
        // Given
        scripted.add(new FakeUpstreamClient(new ConnectFailedException("refused", null, true)));
        scripted.add(new FakeUpstreamClient(new ConnectFailedException("refused", null, true)));

        // When
        relay.start();

        // Then
        await().atMost(Duration.ofSeconds(2)).until(() -> relay.getStatus().upstreamOpen());
        assertEquals(3, created.size());
        assertEquals(0, fatalExits.get());
        assertEquals(1, created.get(0).closeCount.get());
    }

    @Test
    void shouldExitOnFatalConnectFailure() throws Exception {
        // Given
        scripted.add(new FakeUpstreamClient(new ConnectFailedException("password authentication failed", null, false)));

        // When
        relay.start();

        // Then
        await().until(() -> fatalExits.get() == 1);
        Thread.sleep(INTERVAL.toMillis() * 3);
        assertEquals(1, created.size(), "A fatal failure must not be retried");
        assertFalse(relay.getStatus().running());
    }

    @Test
    void shouldReopenAfterUpstreamDrop() throws Exception {
        // Given
        relay.start();
        await().until(() -> relay.getStatus().upstreamOpen());
        FakeUpstreamClient first = created.get(0);

        // When
        first.drop();

        // Then
        assertFalse(relay.getStatus().upstreamOpen());
        await().atMost(Duration.ofSeconds(2)).until(() -> created.size() == 2 && relay.getStatus().upstreamOpen());
        assertEquals(1, first.closeCount.get());

        JsonNode payload = objectMapper.readTree("{\"id\": 3}");
        created.get(1).emit(ChangeEvent.of("gameclock_change", payload));
        verify(busClient).publish("gameclock_change", payload);
    }

    @Test
    void shouldReleaseUpstreamAndBusOnStop() {
        // Given
        relay.start();
        await().until(() -> relay.getStatus().upstreamOpen());

        // When
        relay.stop();

        // Then
        assertFalse(relay.getStatus().running());
        assertEquals(1, created.get(0).closeCount.get());
        verify(busClient).stop();
    }
}
