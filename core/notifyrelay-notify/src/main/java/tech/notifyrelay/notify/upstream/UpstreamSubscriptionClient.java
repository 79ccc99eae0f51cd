package tech.notifyrelay.notify.upstream;

import tech.notifyrelay.notify.error.ConnectFailedException;
import tech.notifyrelay.notify.error.DisconnectedException;
import tech.notifyrelay.notify.model.ChangeEventHandler;
import tech.notifyrelay.notify.model.ChannelSet;

import java.util.function.Consumer;

/**
 * One persistent subscription to the source store's change notification channels.
 *
 * <p>The client never reconnects on its own. An unexpected drop is surfaced once to the
 * disconnect listener and the owner decides whether and when to open a new client.
 * Instances are single use: once closed or disconnected, create a new one.</p>
 */
public interface UpstreamSubscriptionClient extends AutoCloseable {

    /**
     * Opens the subscription and starts delivering events to the registered handler.
     *
     * @throws ConnectFailedException if the store is unreachable or rejects the login
     */
    void open(ChannelSet channels) throws ConnectFailedException;

    /**
     * Registers the single consumer, invoked once per notification in arrival order.
     * Must be called before {@link #open(ChannelSet)}.
     */
    void onEvent(ChangeEventHandler handler);

    /**
     * Registers the listener told about an unexpected connection drop.
     */
    void onDisconnect(Consumer<DisconnectedException> listener);

    boolean isOpen();

    /**
     * Releases the subscription connection. Idempotent.
     */
    @Override
    void close();
}
