package tech.notifyrelay.notify.bus;

import com.fasterxml.jackson.databind.JsonNode;
import io.vertx.core.Future;
import io.vertx.redis.client.Command;
import io.vertx.redis.client.Redis;
import io.vertx.redis.client.RedisConnection;
import io.vertx.redis.client.Request;
import io.vertx.redis.client.Response;
import org.jboss.logging.Logger;
import tech.notifyrelay.notify.codec.EventCodec;
import tech.notifyrelay.notify.error.DisconnectedException;
import tech.notifyrelay.notify.error.PublishFailedException;
import tech.notifyrelay.notify.model.CallbackRegistry;
import tech.notifyrelay.notify.model.ChangeEvent;
import tech.notifyrelay.notify.model.ChangeEventHandler;
import tech.notifyrelay.notify.model.ChannelSet;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Redis pub/sub bus client built on the Vert.x Redis client.
 *
 * <h2>Connections</h2>
 * <ul>
 *   <li>A dedicated connection is held for the whole session. When channels are
 *   subscribed it is in SUBSCRIBE mode on the envelope channel; otherwise it only
 *   serves as the liveness check for publishing.</li>
 *   <li>Publishes go through the client's pooled {@code send}, never blocking.</li>
 * </ul>
 *
 * <h2>Reconnect</h2>
 * Any failure (connect timeout, refused connection, exception or end on the dedicated
 * connection, failed SUBSCRIBE or PUBLISH) marks the bus DOWN and schedules a reconnect
 * attempt after the fixed interval. Attempts repeat indefinitely with no backoff.
 * Health listeners hear DOWN once per outage and RESTORED only after the subscription
 * is re-established.
 */
public class RedisBusClient implements BusClient {

    private static final Logger LOG = Logger.getLogger(RedisBusClient.class);

    private static final String PUSH_MESSAGE = "message";

    enum Health { UNKNOWN, UP, DOWN }

    private final Redis redis;
    private final String busChannel;
    private final Duration reconnectInterval;
    private final Duration connectTimeout;
    private final EventCodec codec;
    private final ScheduledExecutorService reconnectExecutor;

    private final CallbackRegistry callbacks = new CallbackRegistry();
    private final Set<String> subscribedChannels = ConcurrentHashMap.newKeySet();
    private final List<BusHealthListener> healthListeners = new CopyOnWriteArrayList<>();

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean reconnectScheduled = new AtomicBoolean(false);
    private final AtomicReference<Health> health = new AtomicReference<>(Health.UNKNOWN);
    private final AtomicLong reconnectAttempts = new AtomicLong();

    private final Object connectionLock = new Object();
    private volatile RedisConnection connection;
    private volatile boolean connectionSubscribed;

    public RedisBusClient(Redis redis, String busChannel, Duration reconnectInterval,
                          Duration connectTimeout, EventCodec codec) {
        this.redis = redis;
        this.busChannel = busChannel;
        this.reconnectInterval = reconnectInterval;
        this.connectTimeout = connectTimeout;
        this.codec = codec;
        this.reconnectExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "bus-reconnect");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void publish(String channel, JsonNode payload) throws PublishFailedException {
        if (health.get() != Health.UP) {
            throw new PublishFailedException("Bus connection is down, dropping event for channel " + channel);
        }
        String message = codec.encodeEnvelope(channel, payload);
        redis.send(Request.cmd(Command.PUBLISH).arg(busChannel).arg(message))
            .onFailure(t -> {
                LOG.warnf("Publish to bus failed, event dropped channel=%s cause=%s", channel, t.getMessage());
                onConnectionLost(null, t);
            });
        LOG.tracef("Published to bus channel=%s", channel);
    }

    @Override
    public void subscribe(ChannelSet channels) {
        subscribedChannels.addAll(channels.names());

        RedisConnection conn = connection;
        if (conn == null || connectionSubscribed) {
            // Applied by the next (re)connect
            return;
        }
        conn.send(Request.cmd(Command.SUBSCRIBE).arg(busChannel))
            .onSuccess(r -> {
                connectionSubscribed = true;
                LOG.infof("Bus subscription open channel=%s relayedChannels=%s", busChannel, subscribedChannels);
            })
            .onFailure(t -> {
                LOG.warnf("Bus SUBSCRIBE failed channel=%s cause=%s", busChannel, t.getMessage());
                onConnectionLost(conn, t);
            });
    }

    @Override
    public void registerCallback(String channel, ChangeEventHandler handler) {
        callbacks.replace(channel, handler);
        LOG.debugf("Registered bus callback for channel=%s", channel);
    }

    @Override
    public void unregisterCallback(String channel) {
        callbacks.unregisterAll(channel);
        LOG.debugf("Unregistered bus callback for channel=%s", channel);
    }

    @Override
    public void listen() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        LOG.infof("Starting bus client channel=%s reconnectInterval=%s", busChannel, reconnectInterval);
        submit(this::connectOrRetry);
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        reconnectExecutor.shutdownNow();
        RedisConnection conn;
        synchronized (connectionLock) {
            conn = connection;
            connection = null;
            connectionSubscribed = false;
        }
        closeQuietly(conn);
        health.set(Health.UNKNOWN);
        LOG.infof("Bus client stopped channel=%s", busChannel);
    }

    @Override
    public boolean isHealthy() {
        return health.get() == Health.UP;
    }

    @Override
    public void addHealthListener(BusHealthListener listener) {
        healthListeners.add(listener);
    }

    @Override
    public void removeHealthListener(BusHealthListener listener) {
        healthListeners.remove(listener);
    }

    long getReconnectAttempts() {
        return reconnectAttempts.get();
    }

    private void connectOrRetry() {
        if (!running.get()) {
            return;
        }
        long attempt = reconnectAttempts.incrementAndGet();
        LOG.infof("Bus connect attempt=%d channel=%s", attempt, busChannel);
        try {
            connect();
            LOG.infof("Bus connect succeeded attempt=%d channel=%s", attempt, busChannel);
            reconnectAttempts.set(0);
            markUp();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
            LOG.warnf("Bus connect failed attempt=%d cause=%s, retrying in %s",
                attempt, describe(cause), reconnectInterval);
            markDown(cause);
            scheduleReconnect();
        }
    }

    private void connect() throws Exception {
        Future<RedisConnection> connecting = redis.connect();
        RedisConnection conn;
        try {
            conn = await(connecting);
        } catch (TimeoutException e) {
            // Nobody owns a connection that completes after we gave up on it
            connecting.onSuccess(this::closeQuietly);
            throw e;
        }
        conn.handler(this::onMessage);
        conn.exceptionHandler(t -> onConnectionLost(conn, t));
        conn.endHandler(v -> onConnectionLost(conn, new DisconnectedException("Bus connection closed by peer")));

        boolean subscribed = false;
        try {
            if (!subscribedChannels.isEmpty()) {
                await(conn.send(Request.cmd(Command.SUBSCRIBE).arg(busChannel)));
                subscribed = true;
                LOG.infof("Bus subscription open channel=%s relayedChannels=%s", busChannel, subscribedChannels);
            } else {
                await(conn.send(Request.cmd(Command.PING)));
            }
        } catch (Exception e) {
            closeQuietly(conn);
            throw e;
        }

        synchronized (connectionLock) {
            if (!running.get()) {
                closeQuietly(conn);
                return;
            }
            connection = conn;
            connectionSubscribed = subscribed;
        }
    }

    private <T> T await(Future<T> future) throws Exception {
        return future.toCompletionStage()
            .toCompletableFuture()
            .get(connectTimeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    void onMessage(Response response) {
        if (response == null || response.size() < 3 || !PUSH_MESSAGE.equals(String.valueOf(response.get(0)))) {
            return;
        }
        Optional<ChangeEvent> decoded = codec.decodeEnvelope(String.valueOf(response.get(2)));
        if (decoded.isEmpty()) {
            return;
        }
        ChangeEvent event = decoded.get();
        if (!subscribedChannels.contains(event.channel())) {
            LOG.debugf("Ignoring bus event for unsubscribed channel=%s", event.channel());
            return;
        }
        List<ChangeEventHandler> handlers = callbacks.handlersFor(event.channel());
        if (handlers.isEmpty()) {
            LOG.debugf("No callback registered for channel=%s", event.channel());
            return;
        }
        for (ChangeEventHandler handler : handlers) {
            try {
                handler.onEvent(event);
            } catch (RuntimeException e) {
                LOG.errorf(e, "Error processing bus event on channel=%s", event.channel());
            }
        }
    }

    /**
     * @param source the dedicated connection that failed, or null for a failed publish
     */
    private void onConnectionLost(RedisConnection source, Throwable cause) {
        if (!running.get()) {
            return;
        }
        RedisConnection lost;
        synchronized (connectionLock) {
            if (source != null && source != connection) {
                // Stale notification from a connection already replaced
                return;
            }
            lost = connection;
            connection = null;
            connectionSubscribed = false;
        }
        closeQuietly(lost);
        LOG.warnf("Bus connection lost channel=%s cause=%s", busChannel, describe(cause));
        markDown(cause);
        scheduleReconnect();
    }

    private void scheduleReconnect() {
        if (!running.get() || !reconnectScheduled.compareAndSet(false, true)) {
            return;
        }
        try {
            reconnectExecutor.schedule(() -> {
                reconnectScheduled.set(false);
                connectOrRetry();
            }, reconnectInterval.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            reconnectScheduled.set(false);
            LOG.debug("Bus reconnect not scheduled, client is stopping");
        }
    }

    private void submit(Runnable task) {
        try {
            reconnectExecutor.execute(task);
        } catch (RejectedExecutionException e) {
            LOG.debug("Bus task rejected, client is stopping");
        }
    }

    private void markUp() {
        Health previous = health.getAndSet(Health.UP);
        if (previous == Health.DOWN) {
            LOG.infof("Bus health restored channel=%s", busChannel);
            for (BusHealthListener listener : healthListeners) {
                try {
                    listener.onBusRestored();
                } catch (RuntimeException e) {
                    LOG.errorf(e, "Bus health listener failed on restore");
                }
            }
        }
    }

    private void markDown(Throwable cause) {
        Health previous = health.getAndSet(Health.DOWN);
        if (previous != Health.DOWN) {
            LOG.warnf("Bus health lost channel=%s cause=%s", busChannel, describe(cause));
            for (BusHealthListener listener : healthListeners) {
                try {
                    listener.onBusDown(cause);
                } catch (RuntimeException e) {
                    LOG.errorf(e, "Bus health listener failed on down");
                }
            }
        }
    }

    private void closeQuietly(RedisConnection conn) {
        if (conn == null) {
            return;
        }
        try {
            conn.close();
        } catch (RuntimeException e) {
            LOG.debugf("Error closing bus connection: %s", e.getMessage());
        }
    }

    private static String describe(Throwable t) {
        return t.getClass().getSimpleName() + ": " + t.getMessage();
    }
}
