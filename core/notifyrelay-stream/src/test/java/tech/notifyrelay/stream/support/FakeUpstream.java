package tech.notifyrelay.stream.support;

import tech.notifyrelay.notify.error.ConnectFailedException;
import tech.notifyrelay.notify.error.DisconnectedException;
import tech.notifyrelay.notify.model.ChangeEvent;
import tech.notifyrelay.notify.model.ChangeEventHandler;
import tech.notifyrelay.notify.model.ChannelSet;
import tech.notifyrelay.notify.upstream.UpstreamClientFactory;
import tech.notifyrelay.notify.upstream.UpstreamSubscriptionClient;

import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Upstream client factory whose clients are scripted by the test. Open failures are
 * queued with {@link #failNextOpen(boolean)}; otherwise open succeeds. An open can be held
 * with {@link #holdNextOpen(CountDownLatch)} until the latch is released.
 */
public class FakeUpstream implements UpstreamClientFactory {

    private final Queue<ConnectFailedException> openFailures = new ConcurrentLinkedQueue<>();
    private final List<Client> created = new CopyOnWriteArrayList<>();
    private volatile CountDownLatch nextOpenGate;

    public void failNextOpen(boolean retryable) {
        openFailures.add(new ConnectFailedException("connection refused", null, retryable));
    }

    /**
     * The next open blocks until {@code gate} opens and ignores interrupts meanwhile,
     * like a JDBC connect stuck on the network.
     */
    public void holdNextOpen(CountDownLatch gate) {
        nextOpenGate = gate;
    }

    @Override
    public UpstreamSubscriptionClient create(String owner) {
        CountDownLatch gate = nextOpenGate;
        nextOpenGate = null;
        Client client = new Client(openFailures.poll(), gate);
        created.add(client);
        return client;
    }

    public List<Client> created() {
        return created;
    }

    public Client last() {
        return created.get(created.size() - 1);
    }

    public long openCount() {
        return created.stream().filter(Client::isOpen).count();
    }

    public static class Client implements UpstreamSubscriptionClient {

        private final ConnectFailedException openFailure;
        private final AtomicInteger closeCount = new AtomicInteger();
        private volatile ChangeEventHandler handler;
        private volatile Consumer<DisconnectedException> disconnectListener;
        private volatile boolean open;
        private final CountDownLatch openGate;
        private volatile boolean opened;

        Client(ConnectFailedException openFailure, CountDownLatch openGate) {
            this.openFailure = openFailure;
            this.openGate = openGate;
        }

        @Override
        public void open(ChannelSet channels) throws ConnectFailedException {
            if (openGate != null) {
                awaitUninterruptibly(openGate);
            }
            if (openFailure != null) {
                throw openFailure;
            }
            open = true;
            opened = true;
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
        public boolean isOpen() {
            return open;
        }

        @Override
        public void close() {
            open = false;
            closeCount.incrementAndGet();
        }

        /**
         * Delivers as the receive loop would, even after close, so stale-source handling can be checked.
         */
        public void emit(ChangeEvent event) {
            handler.onEvent(event);
        }

        public void drop() {
            open = false;
            disconnectListener.accept(new DisconnectedException("connection reset"));
        }

        public boolean wasOpened() {
            return opened;
        }

        public int closeCount() {
            return closeCount.get();
        }

        private static void awaitUninterruptibly(CountDownLatch latch) {
            boolean interrupted = false;
            while (true) {
                try {
                    latch.await();
                    break;
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
