package gateway.broker;

import gateway.GatewayException;
import gateway.Lifecycle;
import gateway.protocol.DeserializationException;
import gateway.protocol.MessageEnvelope;
import gateway.protocol.ProtocolException;
import gateway.registry.CloseCode;
import gateway.registry.Connection;
import gateway.registry.ConnectionRegistry;
import gateway.registry.TransportClosedException;
import gateway.routing.Broadcaster;
import gateway.routing.DeliveryExecutor;
import gateway.utils.Log;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Connects one gateway's registry to the shared broker channel.
 * <p>
 * Outbound, {@link #publish} hands locally originated messages to the broker. Inbound, a receive
 * loop drains the subscription and feeds every message to the {@link Broadcaster}. Gateways never
 * talk to each other: each one only knows its own subscribers, and the broker carries everything
 * that was published. A gateway receives the echo of its own publishes like any other message.
 */
public class BrokerBridge {

    private static final long CLOSE_TIMEOUT_MILLIS = 5000;

    private final BrokerClient client;
    private final String channel;
    private final ConnectionRegistry registry;
    private final Broadcaster broadcaster;
    private final DeliveryExecutor executor;
    private final Lifecycle lifecycle;
    private final RoutingMode routingMode;

    private final ExecutorService receiver = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "Broker-Receiver");
        t.setDaemon(true);
        return t;
    });
    private volatile Future<?> receiveLoop;

    public BrokerBridge(BrokerClient client, String channel, ConnectionRegistry registry, Broadcaster broadcaster,
                        DeliveryExecutor executor, Lifecycle lifecycle, RoutingMode routingMode) {
        this.client = client;
        this.channel = channel;
        this.registry = registry;
        this.broadcaster = broadcaster;
        this.executor = executor;
        this.lifecycle = lifecycle;
        this.routingMode = routingMode;
    }

    /**
     * Subscribes to the broker channel and starts the receive loop.
     */
    public synchronized void startup() {
        if (!lifecycle.isActive()) throw new IllegalStateException("Gateway is " + lifecycle);
        if (receiveLoop != null) throw new IllegalStateException("Bridge already started");

        try {
            client.subscribe(channel).join();
        } catch (CompletionException e) {
            throw new BrokerException("Subscribe to channel '" + channel + "' failed", e.getCause());
        }
        receiveLoop = receiver.submit(this::receive);
        Log.info("Subscribed to broker channel '" + channel + "' (routing: " + routingMode + ")");
    }

    /**
     * Publishes a locally originated message on the broker channel.
     */
    public CompletableFuture<Void> publish(String payload) {
        if (!lifecycle.isActive()) {
            CompletableFuture<Void> rejected = new CompletableFuture<>();
            rejected.completeExceptionally(new GatewayException("Gateway is " + lifecycle + ", message not published"));
            return rejected;
        }
        return client.publish(channel, payload);
    }

    private void receive() {
        while (lifecycle.isActive() && !Thread.currentThread().isInterrupted()) {
            BrokerMessage message;
            try {
                message = client.nextMessage();
            } catch (InterruptedException e) {
                break;
            }
            if (message.isMeta()) {
                Log.debug("Broker " + message.getKind().name().toLowerCase() + " ack for " + message.getChannel());
                continue;
            }
            // Shutdown may have started while we were waiting
            if (!lifecycle.isActive()) break;
            try {
                route(message);
            } catch (RuntimeException e) {
                Log.error("Failed to route broker message on " + message.getChannel(), e);
            }
        }
        Log.debug("Broker receive loop stopped");
    }

    void route(BrokerMessage message) {
        if (routingMode == RoutingMode.CHANNEL) {
            broadcaster.send(message.getChannel(), message.getData());
            return;
        }

        MessageEnvelope.Untagged envelope;
        try {
            envelope = MessageEnvelope.untagBrokerMessage(message.getData());
        } catch (DeserializationException | ProtocolException e) {
            Log.warn("Skipping malformed envelope from broker: " + e.getMessage());
            return;
        }
        String payload = envelope.getRemainder().toString();
        if (envelope.isBroadcast()) {
            broadcaster.broadcast(payload);
        } else {
            broadcaster.send(envelope.getTopic(), payload);
        }
    }

    /**
     * Stops the gateway: cancels outstanding deliveries, closes every connection with
     * {@link CloseCode#SERVICE_RESTART}, stops the receive loop and releases the broker client.
     * Only the first call does anything.
     */
    public void shutdown() {
        if (!lifecycle.beginShutdown()) return;
        Log.info("Shutting down gateway bridge for channel '" + channel + "'...");

        int cancelled = executor.cancelAll();

        List<CompletableFuture<Void>> closing = new ArrayList<>();
        int raw = 0;
        for (Connection connection : registry.snapshot()) {
            try {
                if (connection.getTransport().isOpen()) {
                    closing.add(registry.removeConnection(connection, CloseCode.SERVICE_RESTART));
                } else {
                    registry.rawRemoveConnection(connection);
                    raw++;
                }
            } catch (TransportClosedException e) {
                // Peer left between the check and the close
                registry.rawRemoveConnection(connection);
                raw++;
            } catch (IllegalStateException e) {
                Log.debug("Connection " + connection.getId() + " is already being removed");
            }
        }
        awaitClosed(closing);

        Future<?> loop = receiveLoop;
        if (loop != null) loop.cancel(true);
        receiver.shutdownNow();
        client.close();
        executor.shutdown();
        lifecycle.markStopped();

        Log.info("Gateway stopped: " + cancelled + " deliveries cancelled, " + closing.size()
                + " connections closed, " + raw + " already gone");
    }

    private static void awaitClosed(List<CompletableFuture<Void>> closing) {
        if (closing.isEmpty()) return;
        try {
            CompletableFuture.allOf(closing.toArray(new CompletableFuture[0])).get(CLOSE_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            Log.warn("Some connections failed to close: " + e.getCause().getMessage());
        } catch (TimeoutException e) {
            Log.warn("Connections still closing after " + CLOSE_TIMEOUT_MILLIS + " ms");
        }
    }

    public boolean isRunning() {
        Future<?> loop = receiveLoop;
        return loop != null && !loop.isDone();
    }

    public String getChannel() {
        return channel;
    }

    public RoutingMode getRoutingMode() {
        return routingMode;
    }

    public ConnectionRegistry getRegistry() {
        return registry;
    }

    public Broadcaster getBroadcaster() {
        return broadcaster;
    }

    public Lifecycle getLifecycle() {
        return lifecycle;
    }
}
