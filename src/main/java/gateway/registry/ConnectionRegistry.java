package gateway.registry;

import gateway.utils.Log;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Active connections of one gateway, keyed by id in insertion order.
 * <p>
 * Handshake acceptors, the broker receive loop and shutdown all touch the map, so every
 * mutation goes through the write lock and readers get a copy.
 */
public class ConnectionRegistry {

    private final Map<String, Connection> connections = new LinkedHashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Accepts the handshake, then registers the connection. If the handshake fails the
     * returned future fails with {@link HandshakeException} and nothing is registered.
     */
    public CompletableFuture<Connection> connect(Connection connection) {
        if (!connection.isOpen()) {
            throw new IllegalStateException("Connection '" + connection.getId() + "' is " + connection.getState() + " and cannot be registered");
        }
        if (get(connection.getId()) != null) {
            throw new IllegalStateException("Connection id '" + connection.getId() + "' is already registered");
        }

        CompletableFuture<Void> accepted;
        try {
            accepted = connection.accept();
        } catch (RuntimeException e) {
            accepted = new CompletableFuture<>();
            accepted.completeExceptionally(e);
        }

        return accepted.handle((ignored, err) -> {
            if (err != null) {
                Throwable cause = unwrap(err);
                if (cause instanceof HandshakeException) throw (HandshakeException) cause;
                throw new HandshakeException("Handshake failed for connection '" + connection.getId() + "'", cause);
            }
            insert(connection);
            return connection;
        });
    }

    /**
     * Removes a registered connection. Removing a connection that is not registered is a caller error.
     */
    public void disconnect(Connection connection) {
        lock.writeLock().lock();
        try {
            Connection current = connections.get(connection.getId());
            if (current != connection) {
                throw new IllegalStateException("Connection '" + connection.getId() + "' is not registered");
            }
            connections.remove(connection.getId());
            connection.markClosed();
        } finally {
            lock.writeLock().unlock();
        }
        Log.debug("Connection " + connection.getId() + " removed, " + size() + " left");
    }

    public CompletableFuture<Connection> newConnection(Transport transport, String id, String pattern) {
        return connect(new Connection(transport, id, pattern));
    }

    /**
     * Closes the transport with {@code closeCode}, then disconnects. Only for transports that are still usable;
     * a transport that already went away fails fast with {@link TransportClosedException}.
     */
    public CompletableFuture<Void> removeConnection(Connection connection, int closeCode) {
        claimRegistered(connection);
        if (!connection.getTransport().isOpen()) {
            connection.releaseClaim();
            throw new TransportClosedException(connection.getId());
        }

        CompletableFuture<Void> closed;
        try {
            closed = connection.close(closeCode);
        } catch (RuntimeException e) {
            closed = new CompletableFuture<>();
            closed.completeExceptionally(e);
        }

        return closed.handle((ignored, err) -> {
            if (err != null) {
                Log.warn("Close of connection " + connection.getId() + " failed: " + unwrap(err).getMessage());
            }
            disconnect(connection);
            return null;
        });
    }

    /**
     * Disconnects without touching the transport. Use it once the peer has already gone.
     */
    public void rawRemoveConnection(Connection connection) {
        claimRegistered(connection);
        disconnect(connection);
    }

    public Connection get(String id) {
        lock.readLock().lock();
        try {
            return connections.get(id);
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isRegistered(Connection connection) {
        return get(connection.getId()) == connection;
    }

    /**
     * Copy of the registered connections in insertion order.
     */
    public List<Connection> snapshot() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(connections.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return connections.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    private void insert(Connection connection) {
        lock.writeLock().lock();
        try {
            if (!connection.isOpen()) {
                throw new IllegalStateException("Connection '" + connection.getId() + "' was closed during its handshake");
            }
            if (connections.putIfAbsent(connection.getId(), connection) != null) {
                throw new IllegalStateException("Connection id '" + connection.getId() + "' is already registered");
            }
        } finally {
            lock.writeLock().unlock();
        }
        Log.debug("Connection " + connection.getId() + " registered (pattern=" + connection.getPattern() + ")");
    }

    private void claimRegistered(Connection connection) {
        if (!connection.claimRemoval()) {
            throw new IllegalStateException("Connection '" + connection.getId() + "' is already " + connection.getState());
        }
        if (!isRegistered(connection)) {
            // An unregistered connection must stay usable for a later connect
            connection.releaseClaim();
            throw new IllegalStateException("Connection '" + connection.getId() + "' is not registered");
        }
    }

    static Throwable unwrap(Throwable err) {
        while (err instanceof CompletionException && err.getCause() != null) {
            err = err.getCause();
        }
        return err;
    }
}
