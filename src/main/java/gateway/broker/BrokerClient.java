package gateway.broker;

import java.util.concurrent.CompletableFuture;

/**
 * Pub/sub client the gateway uses to reach the shared broker channel. Connection setup,
 * authentication and reconnects belong to the implementation.
 */
public interface BrokerClient extends AutoCloseable {

    CompletableFuture<Void> publish(String channel, String payload);

    CompletableFuture<Void> subscribe(String channel);

    /**
     * Blocks until the next message or subscription acknowledgement arrives.
     *
     * @throws InterruptedException when the waiting thread is interrupted
     */
    BrokerMessage nextMessage() throws InterruptedException;

    @Override
    void close();
}
