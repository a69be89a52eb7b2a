package gateway.registry;

import gateway.GatewayException;

/**
 * The transport refused or failed the opening handshake. The connection was never registered.
 */
public class HandshakeException extends GatewayException {

    public HandshakeException(String message) {
        super(message);
    }

    public HandshakeException(String message, Throwable cause) {
        super(message, cause);
    }
}
