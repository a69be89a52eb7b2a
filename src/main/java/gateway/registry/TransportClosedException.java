package gateway.registry;

import gateway.GatewayException;

/**
 * A graceful close was requested on a transport that already reported itself disconnected.
 * Use {@link ConnectionRegistry#rawRemoveConnection(Connection)} for those.
 */
public class TransportClosedException extends GatewayException {

    private final String connectionId;

    public TransportClosedException(String connectionId) {
        super("Transport of connection '" + connectionId + "' is already closed");
        this.connectionId = connectionId;
    }

    public String getConnectionId() {
        return connectionId;
    }
}
