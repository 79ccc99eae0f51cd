package tech.notifyrelay.notify.model;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Channel name to handler list mapping, looked up by exact channel name.
 *
 * <p>Reads are lock-free and may run on receive loop threads while handlers are being
 * registered from another thread.</p>
 */
public class CallbackRegistry {

    private final Map<String, List<ChangeEventHandler>> handlers = new ConcurrentHashMap<>();

    /**
     * Registers {@code handler} as the only handler for {@code channel}.
     */
    public void replace(String channel, ChangeEventHandler handler) {
        handlers.put(channel, new CopyOnWriteArrayList<>(List.of(handler)));
    }

    public void unregisterAll(String channel) {
        handlers.remove(channel);
    }

    public List<ChangeEventHandler> handlersFor(String channel) {
        List<ChangeEventHandler> list = handlers.get(channel);
        return list != null ? list : List.of();
    }
}
