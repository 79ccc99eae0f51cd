package tech.notifyrelay.notify.upstream;

import org.jboss.logging.Logger;
import org.postgresql.PGConnection;
import org.postgresql.PGNotification;
import tech.notifyrelay.notify.codec.EventCodec;
import tech.notifyrelay.notify.error.ConnectFailedException;
import tech.notifyrelay.notify.error.DisconnectedException;
import tech.notifyrelay.notify.model.ChangeEvent;
import tech.notifyrelay.notify.model.ChangeEventHandler;
import tech.notifyrelay.notify.model.ChannelSet;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * PostgreSQL LISTEN/NOTIFY subscription over a dedicated JDBC connection.
 *
 * <h2>Receive loop</h2>
 * A single thread polls {@link PGConnection#getNotifications(int)} with a short timeout
 * and hands every notification to the handler in arrival order. A {@link SQLException}
 * from the poll means the connection is gone: the loop ends, the connection is closed and
 * the disconnect listener is told exactly once.
 */
public class PgNotifyClient implements UpstreamSubscriptionClient {

    private static final Logger LOG = Logger.getLogger(PgNotifyClient.class);

    private static final long JOIN_TIMEOUT_MS = 5_000;

    private final PgConnectionFactory connectionFactory;
    private final EventCodec codec;
    private final Duration pollTimeout;
    private final String owner;

    private final AtomicBoolean open = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile ChangeEventHandler handler;
    private volatile Consumer<DisconnectedException> disconnectListener;
    private volatile Connection connection;
    private volatile Thread receiver;
    private volatile int channelCount;

    public PgNotifyClient(PgConnectionFactory connectionFactory, EventCodec codec, Duration pollTimeout, String owner) {
        this.connectionFactory = connectionFactory;
        this.codec = codec;
        this.pollTimeout = pollTimeout;
        this.owner = owner;
    }

    @Override
    public void onEvent(ChangeEventHandler handler) {
        this.handler = handler;
    }

    @Override
    public void onDisconnect(Consumer<DisconnectedException> listener) {
        this.disconnectListener = listener;
    }

    @Override
    public void open(ChannelSet channels) throws ConnectFailedException {
        if (closed.get()) {
            throw new IllegalStateException("Upstream client [" + owner + "] is closed");
        }
        if (open.get()) {
            throw new IllegalStateException("Upstream client [" + owner + "] is already open");
        }
        if (handler == null) {
            throw new IllegalStateException("No event handler registered on upstream client [" + owner + "]");
        }

        Connection conn = null;
        PGConnection pgConnection;
        try {
            conn = connectionFactory.connect();
            pgConnection = conn.unwrap(PGConnection.class);
            try (Statement statement = conn.createStatement()) {
                for (String channel : channels) {
                    // Names are validated by ChannelSet, quoting keeps them case-exact
                    statement.execute("LISTEN \"" + channel + "\"");
                    LOG.infof("Upstream subscription open: LISTEN channel=%s owner=%s", channel, owner);
                }
            }
        } catch (SQLException e) {
            closeQuietly(conn);
            throw ConnectFailedException.fromSql(connectionFactory.describe(), e);
        }

        this.connection = conn;
        this.channelCount = channels.size();
        open.set(true);

        Thread thread = new Thread(() -> receiveLoop(pgConnection), "pg-notify-" + owner);
        thread.setDaemon(true);
        this.receiver = thread;
        thread.start();

        LOG.infof("Upstream subscription established owner=%s target=%s channels=%d",
            owner, connectionFactory.describe(), channels.size());
    }

    private void receiveLoop(PGConnection pgConnection) {
        int timeoutMs = (int) Math.max(1, pollTimeout.toMillis());
        while (open.get()) {
            PGNotification[] notifications;
            try {
                notifications = pgConnection.getNotifications(timeoutMs);
            } catch (SQLException e) {
                if (open.get()) {
                    signalDisconnected(e);
                }
                break;
            }
            if (notifications == null) {
                continue;
            }
            for (PGNotification notification : notifications) {
                if (!open.get()) {
                    break;
                }
                deliver(notification);
            }
        }
        LOG.debugf("Upstream receive loop for owner=%s exited", owner);
    }

    private void deliver(PGNotification notification) {
        String channel = notification.getName();
        LOG.tracef("Received NOTIFY channel=%s owner=%s", channel, owner);
        Optional<ChangeEvent> event = codec.decodeNotification(channel, notification.getParameter());
        if (event.isEmpty()) {
            return;
        }
        try {
            handler.onEvent(event.get());
        } catch (RuntimeException e) {
            LOG.errorf(e, "Error processing notification on channel=%s owner=%s", channel, owner);
        }
    }

    private void signalDisconnected(SQLException cause) {
        if (!open.compareAndSet(true, false)) {
            return;
        }
        LOG.warnf("Upstream subscription dropped owner=%s sqlState=%s: %s",
            owner, cause.getSQLState(), cause.getMessage());
        closeConnection();

        Consumer<DisconnectedException> listener = disconnectListener;
        if (listener != null) {
            listener.accept(new DisconnectedException("Upstream connection lost for " + owner, cause));
        }
    }

    @Override
    public boolean isOpen() {
        return open.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        boolean wasOpen = open.getAndSet(false);

        Thread thread = receiver;
        if (thread != null && thread != Thread.currentThread()) {
            try {
                thread.join(JOIN_TIMEOUT_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        closeConnection();
        if (wasOpen) {
            LOG.infof("Upstream subscription closed owner=%s channels=%d", owner, channelCount);
        }
    }

    private void closeConnection() {
        Connection conn = connection;
        connection = null;
        closeQuietly(conn);
    }

    private void closeQuietly(Connection conn) {
        if (conn == null) {
            return;
        }
        try {
            conn.close();
        } catch (SQLException e) {
            LOG.debugf("Error closing upstream connection for owner=%s: %s", owner, e.getMessage());
        }
    }
}
