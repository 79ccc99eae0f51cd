package tech.notifyrelay.stream.failover;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.jboss.logging.Logger;
import tech.notifyrelay.notify.bus.BusClient;
import tech.notifyrelay.notify.bus.BusHealthListener;
import tech.notifyrelay.notify.error.ConnectFailedException;
import tech.notifyrelay.notify.error.DisconnectedException;
import tech.notifyrelay.notify.model.ChangeEvent;
import tech.notifyrelay.notify.model.ChangeEventHandler;
import tech.notifyrelay.notify.model.ChannelSet;
import tech.notifyrelay.notify.upstream.UpstreamClientFactory;
import tech.notifyrelay.notify.upstream.UpstreamSubscriptionClient;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Switches a worker's event source between the shared bus and a private upstream
 * subscription without touching client sessions.
 *
 * <h2>Threading</h2>
 * <p>Every state change runs on one controller thread, so the controller is the single
 * writer of {@link FailoverState} and {@link SourceMode}. Bus health signals, upstream
 * drops and reopen timers are all funnelled onto that thread.</p>
 *
 * <h2>Switch-over</h2>
 * <p>Both sources deliver through {@link #deliverFrom(SourceMode, ChangeEvent)}, which
 * holds the read lock of {@code swapLock} and forwards only events whose source matches
 * the current mode. Changing the mode takes the write lock, so the flip is atomic with
 * respect to in-flight deliveries. Events from the inactive source are dropped, never
 * queued: a switch can lose an event but can never deliver one twice.</p>
 *
 * <pre>
 *   BUS_ACTIVE --bus down--> FALLING_BACK --private open--> DIRECT_ACTIVE
 *        ^                        |                              |
 *        +---- RECOVERING <-------+--------- bus restored -------+
 * </pre>
 */
public class FailoverController implements BusHealthListener {

    private static final Logger LOG = Logger.getLogger(FailoverController.class);

    static final String OWNER = "worker";

    private final BusClient busClient;
    private final UpstreamClientFactory upstreamFactory;
    private final ChannelSet channels;
    private final boolean useBus;
    private final Duration reconnectInterval;
    private final ChangeEventHandler dispatcher;
    private final MeterRegistry meterRegistry;

    private final ReentrantReadWriteLock swapLock = new ReentrantReadWriteLock();
    private final List<FailoverListener> listeners = new CopyOnWriteArrayList<>();
    private final Counter droppedCounter;

    private final ScheduledExecutorService executor;

    private volatile FailoverState state;
    private volatile SourceMode mode;
    private volatile boolean running = false;

    // Written on the controller thread; read by stop() after the thread is gone
    private volatile UpstreamSubscriptionClient directClient;
    // Only touched on the controller thread
    private ScheduledFuture<?> pendingReopen;

    Duration shutdownTimeout = Duration.ofSeconds(5);

    public FailoverController(BusClient busClient,
                              UpstreamClientFactory upstreamFactory,
                              ChannelSet channels,
                              MeterRegistry meterRegistry,
                              boolean useBus,
                              Duration reconnectInterval,
                              ChangeEventHandler dispatcher) {
        this.busClient = busClient;
        this.upstreamFactory = upstreamFactory;
        this.channels = channels;
        this.useBus = useBus;
        this.reconnectInterval = reconnectInterval;
        this.dispatcher = dispatcher;
        this.meterRegistry = meterRegistry;
        this.droppedCounter = Counter.builder("notifyrelay.failover.dropped")
            .description("Events discarded because they came from the inactive source")
            .register(meterRegistry);
        this.state = useBus ? FailoverState.BUS_ACTIVE : FailoverState.DIRECT_ACTIVE;
        this.mode = useBus ? SourceMode.BUS : SourceMode.DIRECT;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "failover-controller");
            t.setDaemon(true);
            return t;
        });
    }

    public void addListener(FailoverListener listener) {
        listeners.add(listener);
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        if (executor.isShutdown()) {
            LOG.warn("Failover controller already stopped, not starting");
            return;
        }
        running = true;

        if (useBus) {
            LOG.infof("Failover controller starting in bus mode state=%s channels=%s", state, channels);
            registerBusCallbacks();
            busClient.addHealthListener(this);
            busClient.subscribe(channels);
            busClient.listen();
        } else {
            LOG.infof("Failover controller starting in static direct mode state=%s channels=%s", state, channels);
            submit(this::openDirect);
        }
    }

    public synchronized void stop() {
        if (executor.isShutdown()) {
            return;
        }
        boolean wasRunning = running;
        running = false;
        executor.shutdownNow();
        if (!wasRunning) {
            return;
        }
        LOG.info("Stopping failover controller...");

        try {
            if (!executor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                // A private open still in progress closes its own client once it sees running=false
                LOG.warn("Failover controller thread did not terminate in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        closeDirect("shutdown");
        if (useBus) {
            busClient.removeHealthListener(this);
            for (String channel : channels) {
                busClient.unregisterCallback(channel);
            }
            busClient.stop();
        }
        LOG.infof("Failover controller stopped state=%s dropped=%d", state, getDroppedEvents());
    }

    /**
     * Entry point for both sources. Forwards the event only if {@code source} is the
     * active source.
     */
    public void deliverFrom(SourceMode source, ChangeEvent event) {
        swapLock.readLock().lock();
        try {
            if (source != mode) {
                droppedCounter.increment();
                LOG.debugf("Dropped event from inactive source source=%s mode=%s channel=%s",
                    source, mode, event.channel());
                return;
            }
            dispatcher.onEvent(event);
        } finally {
            swapLock.readLock().unlock();
        }
    }

    @Override
    public void onBusDown(Throwable cause) {
        submit(() -> handleBusDown(cause));
    }

    @Override
    public void onBusRestored() {
        submit(this::handleBusRestored);
    }

    private void handleBusDown(Throwable cause) {
        if (state != FailoverState.BUS_ACTIVE) {
            LOG.debugf("Bus down ignored state=%s", state);
            return;
        }
        String detail = cause != null ? cause.getMessage() : "unknown";
        transition(FailoverState.FALLING_BACK, "bus down: " + detail);
        openDirect();
    }

    private void handleBusRestored() {
        switch (state) {
            case FALLING_BACK -> {
                cancelPendingReopen();
                transition(FailoverState.RECOVERING, "bus restored during fallback");
                recover();
            }
            case DIRECT_ACTIVE -> {
                transition(FailoverState.RECOVERING, "bus restored");
                recover();
            }
            default -> LOG.debugf("Bus restored ignored state=%s", state);
        }
    }

    private void recover() {
        try {
            registerBusCallbacks();
            if (!busClient.isHealthy()) {
                throw new IllegalStateException("bus unhealthy again");
            }
        } catch (RuntimeException e) {
            LOG.warnf("Re-registering bus callbacks failed: %s", e.getMessage());
            if (directClient != null) {
                transition(FailoverState.DIRECT_ACTIVE, "bus re-register failed");
            } else {
                transition(FailoverState.FALLING_BACK, "bus re-register failed");
                scheduleDirectReopen();
            }
            return;
        }

        swapMode(SourceMode.BUS);
        transition(FailoverState.BUS_ACTIVE, "bus callbacks re-registered");
        closeDirect("recovered");
    }

    private void closeDirect(String reason) {
        UpstreamSubscriptionClient client = directClient;
        directClient = null;
        if (client != null) {
            client.close();
            LOG.infof("Private upstream subscription closed owner=%s reason=%s", OWNER, reason);
        }
    }

    private void openDirect() {
        if (!running) {
            return;
        }
        UpstreamSubscriptionClient client = upstreamFactory.create(OWNER);
        client.onEvent(event -> deliverFrom(SourceMode.DIRECT, event));
        client.onDisconnect(e -> submit(() -> handleDirectDisconnected(client, e)));

        LOG.infof("Opening private upstream subscription owner=%s state=%s", OWNER, state);
        try {
            client.open(channels);
        } catch (ConnectFailedException e) {
            client.close();
            if (e.isRetryable()) {
                LOG.warnf("Private upstream connect failed cause=%s, retrying in %s",
                    e.getMessage(), reconnectInterval);
            } else {
                // Sessions stay attached, so keep retrying and rely on the operator.
                LOG.errorf("Private upstream connect failed and needs operator attention cause=%s, retrying in %s",
                    e.getMessage(), reconnectInterval);
            }
            scheduleDirectReopen();
            return;
        }

        directClient = client;
        if (!running) {
            // stop() gave up waiting for this open
            closeDirect("shutdown");
            return;
        }
        LOG.infof("Private upstream subscription open owner=%s", OWNER);
        swapMode(SourceMode.DIRECT);
        transition(FailoverState.DIRECT_ACTIVE, "private subscription open");
    }

    private void handleDirectDisconnected(UpstreamSubscriptionClient client, DisconnectedException e) {
        if (client != directClient) {
            LOG.debug("Ignoring disconnect of a stale private upstream client");
            return;
        }
        directClient = null;
        client.close();

        if (useBus) {
            transition(FailoverState.FALLING_BACK, "private subscription lost: " + e.getMessage());
        } else {
            LOG.warnf("Private upstream subscription lost cause=%s, reopening in %s",
                e.getMessage(), reconnectInterval);
        }
        scheduleDirectReopen();
    }

    private void scheduleDirectReopen() {
        if (!running) {
            return;
        }
        cancelPendingReopen();
        try {
            pendingReopen = executor.schedule(this::reopenDirect, reconnectInterval.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            LOG.debug("Private upstream reopen not scheduled, controller is stopping");
        }
    }

    private void reopenDirect() {
        pendingReopen = null;
        boolean needed = useBus ? state == FailoverState.FALLING_BACK : directClient == null;
        if (!needed) {
            LOG.debugf("Private upstream reopen skipped state=%s", state);
            return;
        }
        openDirect();
    }

    private void cancelPendingReopen() {
        if (pendingReopen != null) {
            pendingReopen.cancel(false);
            pendingReopen = null;
        }
    }

    private void registerBusCallbacks() {
        for (String channel : channels) {
            busClient.registerCallback(channel, event -> deliverFrom(SourceMode.BUS, event));
        }
    }

    private void swapMode(SourceMode next) {
        SourceMode previous;
        swapLock.writeLock().lock();
        try {
            previous = mode;
            mode = next;
        } finally {
            swapLock.writeLock().unlock();
        }
        if (previous != next) {
            LOG.infof("Source mode swapped from=%s to=%s", previous, next);
            for (FailoverListener listener : listeners) {
                notifyListener(() -> listener.onModeChange(previous, next));
            }
        }
    }

    private void transition(FailoverState next, String reason) {
        FailoverState previous = state;
        if (previous == next) {
            return;
        }
        state = next;
        meterRegistry.counter("notifyrelay.failover.transitions", "to", next.name()).increment();
        LOG.infof("Failover transition from=%s to=%s reason=%s", previous, next, reason);
        for (FailoverListener listener : listeners) {
            notifyListener(() -> listener.onTransition(previous, next, reason));
        }
    }

    private void notifyListener(Runnable call) {
        try {
            call.run();
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failover listener threw");
        }
    }

    private void submit(Runnable task) {
        try {
            executor.execute(task);
        } catch (RejectedExecutionException e) {
            LOG.debug("Failover task rejected, controller is stopping");
        }
    }

    public FailoverState getState() {
        return state;
    }

    public SourceMode getSourceMode() {
        return mode;
    }

    public boolean isBusMode() {
        return useBus;
    }

    public long getDroppedEvents() {
        return (long) droppedCounter.count();
    }
}
