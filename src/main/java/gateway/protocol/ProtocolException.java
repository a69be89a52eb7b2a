package gateway.protocol;

import gateway.GatewayException;

/**
 * Envelope is valid JSON but breaks the routing protocol (missing keys, unknown type, type/topic mismatch).
 */
public class ProtocolException extends GatewayException {

    public ProtocolException(String message) {
        super(message);
    }
}
