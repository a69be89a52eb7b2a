package gateway.registry;

import java.util.concurrent.CompletableFuture;

/**
 * The socket underneath a {@link Connection}. Every operation may suspend, so all of them
 * report completion through a future.
 */
public interface Transport {

    /**
     * Completes the opening handshake. Fails with {@link HandshakeException} when the peer cannot be accepted.
     */
    CompletableFuture<Void> accept();

    CompletableFuture<Void> close(int code);

    /**
     * Writes one whole text frame. A frame is either fully queued for the wire or not written at all.
     */
    CompletableFuture<Void> send(String payload);

    /**
     * False once the peer went away or the transport was closed.
     */
    boolean isOpen();
}
