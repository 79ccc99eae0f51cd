package tech.notifyrelay.stream.failover;

/**
 * Observer of failover state changes. Invoked on the controller thread; must not block.
 */
public interface FailoverListener {

    void onTransition(FailoverState from, FailoverState to, String reason);

    default void onModeChange(SourceMode from, SourceMode to) {
    }
}
