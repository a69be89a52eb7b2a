package gateway.routing;

import gateway.Lifecycle;
import gateway.registry.Connection;
import gateway.registry.ConnectionRegistry;
import gateway.utils.Log;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Fans a payload out to the registered connections. Each matching connection gets its own
 * delivery task, so one slow or broken peer never holds up the others.
 * <p>
 * Both operations return as soon as the deliveries are scheduled. The returned future completes
 * once every scheduled delivery has finished, failed or been cancelled.
 */
public class Broadcaster {

    private final ConnectionRegistry registry;
    private final DeliveryExecutor executor;
    private final Lifecycle lifecycle;

    public Broadcaster(ConnectionRegistry registry, DeliveryExecutor executor, Lifecycle lifecycle) {
        this.registry = registry;
        this.executor = executor;
        this.lifecycle = lifecycle;
    }

    /**
     * Delivers to every connection whose pattern matches {@code topic}. Connections without a
     * pattern are skipped.
     */
    public CompletableFuture<DeliveryReport> send(String topic, String payload) {
        if (!lifecycle.isActive()) {
            Log.debug("Dropping message for topic " + topic + ", gateway is " + lifecycle);
            return CompletableFuture.completedFuture(DeliveryReport.empty());
        }
        List<Delivery> deliveries = new ArrayList<>();
        for (Connection connection : registry.snapshot()) {
            if (connection.hasPattern() && TopicMatcher.matches(topic, connection.getPattern())) {
                deliveries.add(executor.submit(connection, payload));
            }
        }
        return report(deliveries, "topic " + topic);
    }

    /**
     * Delivers to every registered connection, patterns ignored.
     */
    public CompletableFuture<DeliveryReport> broadcast(String payload) {
        if (!lifecycle.isActive()) {
            Log.debug("Dropping broadcast, gateway is " + lifecycle);
            return CompletableFuture.completedFuture(DeliveryReport.empty());
        }
        List<Delivery> deliveries = new ArrayList<>();
        for (Connection connection : registry.snapshot()) {
            deliveries.add(executor.submit(connection, payload));
        }
        return report(deliveries, "broadcast");
    }

    private CompletableFuture<DeliveryReport> report(List<Delivery> deliveries, String what) {
        if (deliveries.isEmpty()) {
            return CompletableFuture.completedFuture(DeliveryReport.empty());
        }
        CompletableFuture<?>[] outcomes = new CompletableFuture<?>[deliveries.size()];
        for (int i = 0; i < outcomes.length; i++) {
            outcomes[i] = deliveries.get(i).outcome();
        }
        return CompletableFuture.allOf(outcomes).thenApply(ignored -> {
            DeliveryReport report = DeliveryReport.of(deliveries);
            if (!report.getFailed().isEmpty()) {
                Log.warn("Delivery for " + what + " failed for " + report.getFailed().keySet());
            }
            return report;
        });
    }
}
