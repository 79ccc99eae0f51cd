package tech.notifyrelay.stream.manager;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jboss.logging.MDC;
import tech.notifyrelay.notify.bus.BusClient;
import tech.notifyrelay.notify.config.NotifyRelayConfig;
import tech.notifyrelay.notify.error.SessionBrokenException;
import tech.notifyrelay.notify.model.ChangeEvent;
import tech.notifyrelay.notify.model.ChannelSet;
import tech.notifyrelay.notify.upstream.UpstreamClientFactory;
import tech.notifyrelay.stream.failover.FailoverController;
import tech.notifyrelay.stream.failover.FailoverListener;
import tech.notifyrelay.stream.failover.FailoverState;
import tech.notifyrelay.stream.session.ClientSession;
import tech.notifyrelay.stream.session.SessionTransport;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns this worker's client sessions and the dispatch table from channel to sessions.
 *
 * <p>Dispatch runs on whichever thread the active source delivers on (the bus event loop
 * or the upstream receive thread) and only does non-blocking queue offers. Each session
 * has its own sender thread that drains its queue into the transport, so a slow or dead
 * client costs only itself. A session whose queue overflows is evicted.</p>
 *
 * <p>Which source feeds {@link #dispatch(ChangeEvent)} is decided entirely by the
 * {@link FailoverController}.</p>
 */
@ApplicationScoped
public class ConnectionManager implements FailoverListener {

    private static final Logger LOG = Logger.getLogger(ConnectionManager.class);

    private static final Duration SENDER_POLL = Duration.ofMillis(200);

    @Inject
    NotifyRelayConfig config;

    @Inject
    BusClient busClient;

    @Inject
    UpstreamClientFactory upstreamFactory;

    @Inject
    ChannelSet channels;

    @Inject
    MeterRegistry meterRegistry;

    private final Map<String, ClientSession> sessions = new ConcurrentHashMap<>();
    private final Map<String, Set<ClientSession>> dispatchTable = new ConcurrentHashMap<>();

    private int queueCapacity;
    private FailoverController failoverController;
    private ExecutorService senderPool;
    private Counter evictedCounter;
    private volatile boolean running = false;
    private volatile String lastTransitionReason;

    ConnectionManager() {
        // CDI
    }

    /**
     * Test constructor.
     */
    public ConnectionManager(BusClient busClient, UpstreamClientFactory upstreamFactory, ChannelSet channels,
                             MeterRegistry meterRegistry, boolean useBus, Duration reconnectInterval,
                             int queueCapacity) {
        this.busClient = busClient;
        this.upstreamFactory = upstreamFactory;
        this.channels = channels;
        this.meterRegistry = meterRegistry;
        initialize(useBus, reconnectInterval, queueCapacity);
    }

    void onStart(@Observes StartupEvent event) {
        initialize(config.useBus(), config.reconnectInterval(), config.session().queueCapacity());
        start();
    }

    void onShutdown(@Observes ShutdownEvent event) {
        shutdown();
    }

    private void initialize(boolean useBus, Duration reconnectInterval, int queueCapacity) {
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("Session queue capacity must be positive: " + queueCapacity);
        }
        this.queueCapacity = queueCapacity;
        this.failoverController = new FailoverController(
            busClient, upstreamFactory, channels, meterRegistry, useBus, reconnectInterval, this::dispatch);
        this.failoverController.addListener(this);

        this.evictedCounter = Counter.builder("notifyrelay.sessions.evicted")
            .description("Sessions evicted because their outbound queue overflowed")
            .register(meterRegistry);
        Gauge.builder("notifyrelay.sessions.active", sessions, Map::size)
            .description("Connected streaming sessions")
            .register(meterRegistry);

        AtomicInteger threadCounter = new AtomicInteger();
        this.senderPool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "session-sender-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        LOG.infof("Connection manager starting useBus=%s queueCapacity=%d", failoverController.isBusMode(), queueCapacity);
        failoverController.start();
    }

    /**
     * Stops the event source and closes every session.
     */
    public synchronized void shutdown() {
        if (!running) {
            return;
        }
        running = false;
        LOG.infof("Connection manager shutting down sessions=%d", sessions.size());

        failoverController.stop();
        for (ClientSession session : List.copyOf(sessions.values())) {
            disconnect(session, "shutdown");
        }

        senderPool.shutdown();
        try {
            if (!senderPool.awaitTermination(5, TimeUnit.SECONDS)) {
                senderPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            senderPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LOG.infof("Connection manager stopped evicted=%d", getEvictedCount());
    }

    /**
     * Registers a new client for the requested channels.
     *
     * @param requested channel names, or null for every relayed channel
     * @throws IllegalArgumentException if a requested channel is unknown or none is requested
     */
    public ClientSession accept(SessionTransport transport, Collection<String> requested) {
        if (!running) {
            throw new IllegalStateException("Connection manager is not running");
        }
        Set<String> interest = requested == null ? channels.names() : channels.require(requested);

        ClientSession session = new ClientSession(transport, interest, queueCapacity);
        sessions.put(session.getId(), session);
        for (String channel : interest) {
            dispatchTable.computeIfAbsent(channel, k -> ConcurrentHashMap.newKeySet()).add(session);
        }

        try {
            senderPool.execute(() -> runSender(session));
        } catch (RejectedExecutionException e) {
            disconnect(session, "shutdown");
            throw new IllegalStateException("Connection manager is shutting down", e);
        }

        LOG.infof("Session accepted sessionId=%s channels=%s transport=%s sessions=%d",
            session.getId(), interest, transport.describe(), sessions.size());
        return session;
    }

    /**
     * Fans one event out to every interested session. Never blocks.
     */
    public void dispatch(ChangeEvent event) {
        Set<ClientSession> targets = dispatchTable.get(event.channel());
        if (targets == null || targets.isEmpty()) {
            LOG.debugf("No sessions for channel=%s", event.channel());
            return;
        }
        for (ClientSession session : targets) {
            if (!session.offer(event) && session.isAlive()) {
                evictedCounter.increment();
                LOG.warnf("Evicting backpressured session sessionId=%s queued=%d",
                    session.getId(), session.getQueuedEvents());
                disconnect(session, "backpressure");
            }
        }
    }

    /**
     * Removes the session, if still registered, and closes its transport. Safe to call
     * from any thread, any number of times.
     */
    public boolean disconnect(String sessionId, String reason) {
        ClientSession session = sessions.get(sessionId);
        return session != null && disconnect(session, reason);
    }

    private boolean disconnect(ClientSession session, String reason) {
        if (!session.close()) {
            return false;
        }
        sessions.remove(session.getId());
        for (String channel : session.getChannels()) {
            Set<ClientSession> subscribers = dispatchTable.get(channel);
            if (subscribers != null) {
                subscribers.remove(session);
            }
        }
        // The sender may be stuck in a send to this client; closing here releases the socket now
        session.getTransport().close();
        LOG.infof("Session closed sessionId=%s reason=%s sessions=%d", session.getId(), reason, sessions.size());
        return true;
    }

    private void runSender(ClientSession session) {
        MDC.put("sessionId", session.getId());
        try {
            while (session.isAlive()) {
                ChangeEvent event;
                try {
                    event = session.poll(SENDER_POLL);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    disconnect(session, "interrupted");
                    break;
                }
                if (event == null || !session.isAlive()) {
                    continue;
                }
                try {
                    session.getTransport().send(event);
                } catch (SessionBrokenException e) {
                    LOG.warnf("Session transport failed sessionId=%s: %s", e.getSessionId(), e.getMessage());
                    disconnect(session, "transport failed");
                } catch (RuntimeException e) {
                    LOG.errorf(e, "Unexpected error sending to session sessionId=%s", session.getId());
                    disconnect(session, "send error");
                }
            }
        } finally {
            session.getTransport().close();
            MDC.remove("sessionId");
        }
    }

    @Override
    public void onTransition(FailoverState from, FailoverState to, String reason) {
        lastTransitionReason = from + "->" + to + ": " + reason;
    }

    public int getSessionCount() {
        return sessions.size();
    }

    public int getSubscriberCount(String channel) {
        Set<ClientSession> subscribers = dispatchTable.get(channel);
        return subscribers == null ? 0 : subscribers.size();
    }

    boolean isRegistered(String sessionId) {
        return sessions.containsKey(sessionId);
    }

    public FailoverController getFailoverController() {
        return failoverController;
    }

    public boolean isBusHealthy() {
        return failoverController.isBusMode() && busClient.isHealthy();
    }

    public long getEvictedCount() {
        return (long) evictedCounter.count();
    }

    public String getLastTransitionReason() {
        return lastTransitionReason;
    }
}
