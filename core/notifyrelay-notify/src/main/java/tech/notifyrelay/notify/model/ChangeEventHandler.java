package tech.notifyrelay.notify.model;

/**
 * Consumer of change events, invoked from a receive loop.
 */
@FunctionalInterface
public interface ChangeEventHandler {

    /**
     * @param event the event received from the active source
     */
    void onEvent(ChangeEvent event);
}
