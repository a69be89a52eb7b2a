package gateway.protocol.netty;

/**
 * A RESP error reply ({@code -ERR ...}).
 */
public class RespError {
    private final String message;

    public RespError(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return "-" + message;
    }
}
