package gateway.routing;

import gateway.GatewayException;

/**
 * Delivery to a single connection failed. Never aborts the rest of a fan-out.
 */
public class DeliveryException extends GatewayException {

    private final String connectionId;

    public DeliveryException(String connectionId, Throwable cause) {
        super("Delivery to connection '" + connectionId + "' failed: " + describe(cause), cause);
        this.connectionId = connectionId;
    }

    public String getConnectionId() {
        return connectionId;
    }

    private static String describe(Throwable cause) {
        if (cause == null) return "unknown";
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
