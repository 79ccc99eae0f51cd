package tech.notifyrelay.stream.failover;

/**
 * States of the per-worker failover state machine.
 */
public enum FailoverState {
    /** Events arrive through the shared bus subscription. */
    BUS_ACTIVE,
    /** Bus lost; a private upstream subscription is being opened. */
    FALLING_BACK,
    /** Events arrive through this worker's private upstream subscription. */
    DIRECT_ACTIVE,
    /** Bus back; dispatch is being moved back onto it. */
    RECOVERING
}
