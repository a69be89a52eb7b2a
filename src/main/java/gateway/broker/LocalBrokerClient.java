package gateway.broker;

import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link BrokerClient} over a {@link LocalBroker}. Acknowledges subscriptions with meta messages
 * the way a Redis server does.
 */
public class LocalBrokerClient implements BrokerClient, LocalBroker.Subscriber {

    private final LocalBroker broker;
    private final BlockingQueue<BrokerMessage> inbox = new LinkedBlockingQueue<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    LocalBrokerClient(LocalBroker broker) {
        this.broker = broker;
    }

    @Override
    public CompletableFuture<Void> publish(String channel, String payload) {
        if (closed.get()) return failed("Broker client is closed");
        broker.publish(channel, payload);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> subscribe(String channel) {
        if (closed.get()) return failed("Broker client is closed");
        broker.subscribe(channel, this);
        inbox.add(BrokerMessage.subscribed(channel));
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public BrokerMessage nextMessage() throws InterruptedException {
        return inbox.take();
    }

    @Override
    public void send(String channel, String message) {
        inbox.add(BrokerMessage.message(channel, message));
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            List<String> channels = broker.unsubscribeAll(this);
            for (String channel : channels) {
                inbox.add(BrokerMessage.unsubscribed(channel));
            }
        }
    }

    private static CompletableFuture<Void> failed(String message) {
        CompletableFuture<Void> f = new CompletableFuture<>();
        f.completeExceptionally(new BrokerException(message));
        return f;
    }
}
