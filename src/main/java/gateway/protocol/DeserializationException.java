package gateway.protocol;

import gateway.GatewayException;

public class DeserializationException extends GatewayException {

    public DeserializationException(String message, Throwable cause) {
        super(message, cause);
    }

    public DeserializationException(String message) {
        super(message);
    }
}
