package gateway.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Client-facing envelope: {@code {"type": "send"|"broadcast", "topic": string|null, ...fields}}.
 * A {@code broadcast} never carries a topic, a {@code send} always does.
 */
public final class MessageEnvelope {

    public static final String TYPE = "type";
    public static final String TOPIC = "topic";
    public static final String SEND = "send";
    public static final String BROADCAST = "broadcast";

    // Content after the first JSON value makes the whole envelope invalid
    private static final ObjectMapper mapper = new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private MessageEnvelope() { }

    /**
     * Returns a tagged copy of {@code payload}. The caller's node is left untouched.
     */
    public static ObjectNode tagClientMessage(ObjectNode payload, String topic) {
        ObjectNode tagged = payload == null ? mapper.createObjectNode() : payload.deepCopy();
        if (topic == null || topic.isEmpty()) {
            tagged.put(TYPE, BROADCAST);
            tagged.putNull(TOPIC);
        } else {
            tagged.put(TYPE, SEND);
            tagged.put(TOPIC, topic);
        }
        return tagged;
    }

    public static Untagged untagBrokerMessage(String raw) {
        if (raw == null) throw new DeserializationException("Envelope is null");
        JsonNode node;
        try {
            node = mapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new DeserializationException("Envelope is not valid JSON: " + e.getOriginalMessage(), e);
        }
        return untagBrokerMessage(node);
    }

    public static Untagged untagBrokerMessage(JsonNode raw) {
        if (raw == null || !raw.isObject()) {
            throw new DeserializationException("Envelope must be a JSON object");
        }
        if (!raw.has(TYPE)) throw new ProtocolException("Envelope has no '" + TYPE + "' key");
        if (!raw.has(TOPIC)) throw new ProtocolException("Envelope has no '" + TOPIC + "' key");

        JsonNode typeNode = raw.get(TYPE);
        JsonNode topicNode = raw.get(TOPIC);
        if (!typeNode.isTextual()) throw new ProtocolException("Envelope '" + TYPE + "' must be a string");
        if (!topicNode.isNull() && !topicNode.isTextual()) {
            throw new ProtocolException("Envelope '" + TOPIC + "' must be a string or null");
        }

        String type = typeNode.asText();
        String topic = topicNode.isNull() ? null : topicNode.asText();

        if (SEND.equals(type)) {
            if (topic == null || topic.isEmpty()) throw new ProtocolException("A 'send' envelope needs a topic");
        } else if (BROADCAST.equals(type)) {
            if (topic != null) throw new ProtocolException("A 'broadcast' envelope must not carry a topic");
        } else {
            throw new ProtocolException("Unknown envelope type '" + type + "'");
        }

        ObjectNode remainder = ((ObjectNode) raw).deepCopy();
        remainder.remove(TYPE);
        remainder.remove(TOPIC);
        return new Untagged(type, topic, remainder);
    }

    /**
     * Result of {@link #untagBrokerMessage}: routing metadata split from the application fields.
     */
    public static final class Untagged {
        private final String type;
        private final String topic;
        private final ObjectNode remainder;

        public Untagged(String type, String topic, ObjectNode remainder) {
            this.type = type;
            this.topic = topic;
            this.remainder = remainder;
        }

        public String getType() {
            return type;
        }

        public String getTopic() {
            return topic;
        }

        public ObjectNode getRemainder() {
            return remainder;
        }

        public boolean isBroadcast() {
            return BROADCAST.equals(type);
        }
    }
}
