package tech.notifyrelay.notify.bus;

import com.fasterxml.jackson.databind.JsonNode;
import tech.notifyrelay.notify.error.PublishFailedException;
import tech.notifyrelay.notify.model.ChangeEventHandler;
import tech.notifyrelay.notify.model.ChannelSet;

/**
 * Publish/subscribe connection to the intermediary message bus.
 *
 * <p>The client owns its reconnect loop: after a send or receive failure it retries on
 * a fixed interval, indefinitely. Health changes are reported to
 * {@link BusHealthListener}s. Nothing published while the connection is down is ever
 * delivered.</p>
 */
public interface BusClient {

    /**
     * Fire-and-forget publish. Never waits for delivery.
     *
     * @throws PublishFailedException if the bus connection is currently down
     */
    void publish(String channel, JsonNode payload) throws PublishFailedException;

    /**
     * Opens (or, after a reconnect, re-opens) the receive-side subscription for these channels.
     */
    void subscribe(ChannelSet channels);

    /**
     * Sets the handler for a channel, replacing any previous one.
     */
    void registerCallback(String channel, ChangeEventHandler handler);

    void unregisterCallback(String channel);

    /**
     * Starts the connection and receive loop. Returns immediately; the loop runs until
     * {@link #stop()}.
     */
    void listen();

    /**
     * Stops the receive loop and cancels pending reconnect attempts. Idempotent.
     */
    void stop();

    /**
     * @return true if connected (and, when subscribed, the subscription is active)
     */
    boolean isHealthy();

    void addHealthListener(BusHealthListener listener);

    void removeHealthListener(BusHealthListener listener);
}
