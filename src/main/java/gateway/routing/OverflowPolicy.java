package gateway.routing;

/**
 * What the delivery pool does when its queue is full.
 */
public enum OverflowPolicy {
    /** The scheduling thread (normally the broker receive loop) waits for room. */
    BLOCK,
    /** The delivery being scheduled is cancelled. */
    DROP_NEWEST,
    /** The oldest queued delivery is cancelled to make room. */
    DROP_OLDEST
}
