package gateway.routing;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.ArrayList;

/**
 * Aggregate outcome of one {@link Broadcaster#send} or {@link Broadcaster#broadcast} call.
 * Connection ids keep the order in which deliveries were scheduled.
 */
public class DeliveryReport {

    private static final DeliveryReport EMPTY = new DeliveryReport(Collections.emptyList(), Collections.emptyMap(), Collections.emptyList());

    private final List<String> delivered;
    private final Map<String, DeliveryException> failed;
    private final List<String> cancelled;

    DeliveryReport(List<String> delivered, Map<String, DeliveryException> failed, List<String> cancelled) {
        this.delivered = Collections.unmodifiableList(delivered);
        this.failed = Collections.unmodifiableMap(failed);
        this.cancelled = Collections.unmodifiableList(cancelled);
    }

    static DeliveryReport empty() {
        return EMPTY;
    }

    static DeliveryReport of(List<Delivery> deliveries) {
        List<String> delivered = new ArrayList<>();
        Map<String, DeliveryException> failed = new LinkedHashMap<>();
        List<String> cancelled = new ArrayList<>();
        for (Delivery d : deliveries) {
            String id = d.getConnection().getId();
            switch (d.outcome().join()) {
                case DELIVERED: delivered.add(id); break;
                case FAILED: failed.put(id, d.getFailure()); break;
                case CANCELLED: cancelled.add(id); break;
            }
        }
        return new DeliveryReport(delivered, failed, cancelled);
    }

    public List<String> getDelivered() {
        return delivered;
    }

    public Map<String, DeliveryException> getFailed() {
        return failed;
    }

    public List<String> getCancelled() {
        return cancelled;
    }

    public int attempted() {
        return delivered.size() + failed.size() + cancelled.size();
    }

    public boolean isClean() {
        return failed.isEmpty() && cancelled.isEmpty();
    }

    @Override
    public String toString() {
        return "DeliveryReport{delivered=" + delivered + ", failed=" + failed.keySet() + ", cancelled=" + cancelled + "}";
    }
}
