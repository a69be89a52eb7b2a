package gateway.broker;

import gateway.GatewayException;

public class BrokerException extends GatewayException {

    public BrokerException(String message) {
        super(message);
    }

    public BrokerException(String message, Throwable cause) {
        super(message, cause);
    }
}
