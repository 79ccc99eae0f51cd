package tech.notifyrelay.notify.bus;

/**
 * Health signals from a {@link BusClient}, invoked from the client's reconnect thread.
 */
public interface BusHealthListener {

    /**
     * The bus became unreachable: connect timeout, connection refused, dropped
     * connection or failed subscribe.
     */
    void onBusDown(Throwable cause);

    /**
     * The bus is reachable again and every previously subscribed channel is
     * subscribed again.
     */
    void onBusRestored();
}
