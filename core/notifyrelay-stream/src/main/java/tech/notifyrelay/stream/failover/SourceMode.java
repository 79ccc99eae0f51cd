package tech.notifyrelay.stream.failover;

/**
 * Which source currently drives dispatch. Exactly one at any instant.
 */
public enum SourceMode {
    BUS,
    DIRECT
}
