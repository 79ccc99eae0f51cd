package tech.notifyrelay.stream.session;

import tech.notifyrelay.notify.model.ChangeEvent;

import java.time.Duration;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One connected streaming client: its channel interest, a bounded outbound queue and a
 * liveness flag.
 *
 * <p>Dispatch only ever calls {@link #offer(ChangeEvent)}, which never blocks. A full
 * queue means the client cannot keep up and the owner evicts it.</p>
 */
public class ClientSession {

    private final String id;
    private final Set<String> channels;
    private final SessionTransport transport;
    private final BlockingQueue<ChangeEvent> outbound;
    private final AtomicBoolean alive = new AtomicBoolean(true);

    public ClientSession(SessionTransport transport, Set<String> channels, int queueCapacity) {
        this.id = UUID.randomUUID().toString();
        this.transport = transport;
        this.channels = Set.copyOf(channels);
        this.outbound = new ArrayBlockingQueue<>(queueCapacity);
    }

    /**
     * @return false if the session is closed or its queue is full
     */
    public boolean offer(ChangeEvent event) {
        return alive.get() && outbound.offer(event);
    }

    public ChangeEvent poll(Duration timeout) throws InterruptedException {
        return outbound.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Marks the session dead and discards queued events.
     *
     * @return true for the call that actually closed it
     */
    public boolean close() {
        if (!alive.compareAndSet(true, false)) {
            return false;
        }
        outbound.clear();
        return true;
    }

    public boolean isAlive() {
        return alive.get();
    }

    public String getId() {
        return id;
    }

    public Set<String> getChannels() {
        return channels;
    }

    public SessionTransport getTransport() {
        return transport;
    }

    public int getQueuedEvents() {
        return outbound.size();
    }

    @Override
    public String toString() {
        return "ClientSession[" + id + ", channels=" + channels + ", transport=" + transport.describe() + "]";
    }
}
