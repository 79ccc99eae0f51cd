package tech.notifyrelay.listener;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.quarkus.runtime.Quarkus;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.notifyrelay.notify.bus.BusClient;
import tech.notifyrelay.notify.config.NotifyRelayConfig;
import tech.notifyrelay.notify.error.ConnectFailedException;
import tech.notifyrelay.notify.error.DisconnectedException;
import tech.notifyrelay.notify.error.PublishFailedException;
import tech.notifyrelay.notify.model.ChangeEvent;
import tech.notifyrelay.notify.model.ChannelSet;
import tech.notifyrelay.notify.upstream.UpstreamClientFactory;
import tech.notifyrelay.notify.upstream.UpstreamSubscriptionClient;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Relay process: one LISTEN connection per deployment unit, every notification
 * republished onto the Redis bus.
 *
 * <p>Run exactly one instance per pod. Workers in bus mode then need no connection of
 * their own. The relay holds no client state, so restarting it never disconnects a
 * client session.</p>
 *
 * <h2>Failure policy</h2>
 * <ul>
 *   <li>Upstream drop or unreachable store: reopen every reconnect interval, forever</li>
 *   <li>Authentication or configuration failure: exit with status 1</li>
 *   <li>Bus down at publish time: event dropped and logged</li>
 * </ul>
 */
@ApplicationScoped
public class NotifyRelay {

    private static final Logger LOG = Logger.getLogger(NotifyRelay.class);

    private static final String OWNER = "relay";

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

    private Duration reconnectInterval;
    private Runnable fatalExit;
    private ScheduledExecutorService scheduler;

    private volatile boolean running = false;
    private volatile UpstreamSubscriptionClient upstream;
    private volatile Instant lastEventAt;

    private Counter forwardedCounter;
    private Counter droppedCounter;
    private final AtomicLong reconnectAttempts = new AtomicLong();

    NotifyRelay() {
        // CDI
    }

    /**
     * Test constructor.
     */
    NotifyRelay(BusClient busClient, UpstreamClientFactory upstreamFactory, ChannelSet channels,
                MeterRegistry meterRegistry, Duration reconnectInterval, Runnable fatalExit) {
        this.busClient = busClient;
        this.upstreamFactory = upstreamFactory;
        this.channels = channels;
        this.meterRegistry = meterRegistry;
        this.reconnectInterval = reconnectInterval;
        this.fatalExit = fatalExit;
        initializeMetrics();
    }

    @PostConstruct
    void initializeMetrics() {
        forwardedCounter = Counter.builder("notifyrelay.relay.forwarded")
            .description("Notifications republished onto the bus")
            .register(meterRegistry);
        droppedCounter = Counter.builder("notifyrelay.relay.dropped")
            .description("Notifications dropped because the bus was down")
            .register(meterRegistry);
    }

    void onStart(@Observes StartupEvent event) {
        this.reconnectInterval = config.reconnectInterval();
        this.fatalExit = () -> Quarkus.asyncExit(1);
        start();
    }

    void onShutdown(@Observes ShutdownEvent event) {
        stop();
    }

    public synchronized void start() {
        if (running) {
            LOG.warn("Notify relay already running");
            return;
        }
        running = true;
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "relay-reconnect");
            t.setDaemon(true);
            return t;
        });

        LOG.infof("Starting notify relay channels=%s reconnectInterval=%s", channels, reconnectInterval);
        busClient.listen();
        scheduler.execute(this::openUpstream);
    }

    public synchronized void stop() {
        if (scheduler == null || scheduler.isShutdown()) {
            return;
        }
        LOG.info("Stopping notify relay...");
        running = false;

        scheduler.shutdownNow();
        try {
            scheduler.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        UpstreamSubscriptionClient client = upstream;
        upstream = null;
        if (client != null) {
            client.close();
        }
        busClient.stop();
        LOG.infof("Notify relay stopped forwarded=%.0f dropped=%.0f", forwardedCounter.count(), droppedCounter.count());
    }

    private void openUpstream() {
        if (!running) {
            return;
        }
        long attempt = reconnectAttempts.incrementAndGet();
        LOG.infof("Upstream connect attempt=%d owner=%s", attempt, OWNER);

        UpstreamSubscriptionClient client = upstreamFactory.create(OWNER);
        client.onEvent(this::forward);
        client.onDisconnect(e -> onUpstreamDisconnected(client, e));
        try {
            client.open(channels);
        } catch (ConnectFailedException e) {
            client.close();
            if (!e.isRetryable()) {
                LOG.errorf(e, "FATAL: upstream connect failed attempt=%d and will not be retried: %s",
                    attempt, e.getMessage());
                running = false;
                fatalExit.run();
                return;
            }
            LOG.warnf("Upstream connect failed attempt=%d cause=%s, retrying in %s",
                attempt, e.getMessage(), reconnectInterval);
            scheduleReopen();
            return;
        }

        upstream = client;
        reconnectAttempts.set(0);
        LOG.infof("Upstream connect succeeded attempt=%d owner=%s", attempt, OWNER);
    }

    private void onUpstreamDisconnected(UpstreamSubscriptionClient client, DisconnectedException e) {
        LOG.warnf("Upstream subscription lost owner=%s cause=%s, reconnecting in %s",
            OWNER, e.getMessage(), reconnectInterval);
        if (upstream == client) {
            upstream = null;
        }
        client.close();
        scheduleReopen();
    }

    private void scheduleReopen() {
        if (!running) {
            return;
        }
        try {
            scheduler.schedule(this::openUpstream, reconnectInterval.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            LOG.debug("Upstream reopen not scheduled, relay is stopping");
        }
    }

    void forward(ChangeEvent event) {
        lastEventAt = event.observedAt();
        try {
            busClient.publish(event.channel(), event.payload());
            forwardedCounter.increment();
            LOG.debugf("Forwarded notification channel=%s to bus", event.channel());
        } catch (PublishFailedException e) {
            droppedCounter.increment();
            LOG.warnf("Dropped notification channel=%s reason=%s", event.channel(), e.getMessage());
        }
    }

    public RelayStatus getStatus() {
        UpstreamSubscriptionClient client = upstream;
        return new RelayStatus(
            running,
            client != null && client.isOpen(),
            busClient.isHealthy(),
            (long) forwardedCounter.count(),
            (long) droppedCounter.count(),
            lastEventAt
        );
    }

    /**
     * Status snapshot for health checks and monitoring.
     */
    public record RelayStatus(
        boolean running,
        boolean upstreamOpen,
        boolean busHealthy,
        long forwarded,
        long dropped,
        Instant lastEventAt
    ) {
    }
}
