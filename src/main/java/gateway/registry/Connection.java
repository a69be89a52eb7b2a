package gateway.registry;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One client session. The pattern is fixed for the whole life of the connection;
 * a connection without a pattern only receives broadcasts.
 */
public class Connection {

    public enum State {
        OPEN,
        // one removal path has claimed the connection
        CLOSING,
        CLOSED
    }

    private final String id;
    private final String pattern;
    private final Transport transport;
    private final AtomicReference<State> state = new AtomicReference<>(State.OPEN);

    public Connection(Transport transport, String id, String pattern) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.id = Objects.requireNonNull(id, "id");
        this.pattern = (pattern == null || pattern.isEmpty()) ? null : pattern;
    }

    public String getId() {
        return id;
    }

    public String getPattern() {
        return pattern;
    }

    public boolean hasPattern() {
        return pattern != null;
    }

    public Transport getTransport() {
        return transport;
    }

    public State getState() {
        return state.get();
    }

    public boolean isOpen() {
        return state.get() == State.OPEN;
    }

    public CompletableFuture<Void> accept() {
        return transport.accept();
    }

    public CompletableFuture<Void> close(int code) {
        return transport.close(code);
    }

    public CompletableFuture<Void> send(String payload) {
        return transport.send(payload);
    }

    boolean claimRemoval() {
        return state.compareAndSet(State.OPEN, State.CLOSING);
    }

    void releaseClaim() {
        state.compareAndSet(State.CLOSING, State.OPEN);
    }

    void markClosed() {
        state.set(State.CLOSED);
    }

    @Override
    public String toString() {
        return "Connection{id=" + id + ", pattern=" + pattern + ", state=" + state.get() + "}";
    }
}
