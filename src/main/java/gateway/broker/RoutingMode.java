package gateway.broker;

/**
 * How the receive loop turns a broker message into a fan-out.
 */
public enum RoutingMode {
    /** The broker channel name is the topic; the data is forwarded untouched. */
    CHANNEL,
    /** The data is a tagged envelope; its type and topic decide between send and broadcast. */
    ENVELOPE
}
