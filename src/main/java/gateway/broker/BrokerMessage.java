package gateway.broker;

/**
 * Something delivered on a broker subscription: either a published message or a
 * subscription acknowledgement (meta message) that the gateway never forwards.
 */
public class BrokerMessage {

    public enum Kind {
        MESSAGE,
        SUBSCRIBE,
        UNSUBSCRIBE
    }

    private final Kind kind;
    private final String channel;
    private final String data;

    public BrokerMessage(Kind kind, String channel, String data) {
        this.kind = kind;
        this.channel = channel;
        this.data = data;
    }

    public static BrokerMessage message(String channel, String data) {
        return new BrokerMessage(Kind.MESSAGE, channel, data);
    }

    public static BrokerMessage subscribed(String channel) {
        return new BrokerMessage(Kind.SUBSCRIBE, channel, null);
    }

    public static BrokerMessage unsubscribed(String channel) {
        return new BrokerMessage(Kind.UNSUBSCRIBE, channel, null);
    }

    public Kind getKind() {
        return kind;
    }

    public String getChannel() {
        return channel;
    }

    public String getData() {
        return data;
    }

    public boolean isMeta() {
        return kind != Kind.MESSAGE;
    }

    @Override
    public String toString() {
        return "BrokerMessage{" + kind + " " + channel + (data != null ? ": " + data : "") + "}";
    }
}
