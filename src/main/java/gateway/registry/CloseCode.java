package gateway.registry;

// WebSocket close codes (RFC 6455 section 7.4)
public final class CloseCode {
    public static final int NORMAL_CLOSURE = 1000;
    public static final int SERVICE_RESTART = 1012;

    private CloseCode() { }
}
