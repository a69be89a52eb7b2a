package gateway.routing;

import gateway.registry.Connection;
import gateway.utils.Log;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * One payload on its way to one connection. Cancellable on its own; the outcome future
 * always completes, whatever happened to the task.
 */
public class Delivery extends FutureTask<Void> {

    public enum Status {
        DELIVERED,
        FAILED,
        CANCELLED
    }

    private final Connection connection;
    private final CompletableFuture<Status> outcome = new CompletableFuture<>();
    private final Consumer<Delivery> onDone;
    private volatile DeliveryException failure;

    Delivery(Connection connection, String payload, long sendTimeoutMillis, Consumer<Delivery> onDone) {
        super(() -> {
            write(connection, payload, sendTimeoutMillis);
            return null;
        });
        this.connection = connection;
        this.onDone = onDone;
    }

    private static void write(Connection connection, String payload, long sendTimeoutMillis) throws InterruptedException {
        try {
            // The transport queues the whole frame or nothing, so an interrupt here never leaves half a frame behind
            connection.send(payload).get(sendTimeoutMillis, TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw new DeliveryException(connection.getId(), e.getCause());
        } catch (TimeoutException e) {
            throw new DeliveryException(connection.getId(), new TimeoutException("no write completion after " + sendTimeoutMillis + " ms"));
        } catch (RuntimeException e) {
            throw new DeliveryException(connection.getId(), e);
        }
    }

    @Override
    protected void done() {
        try {
            onDone.accept(this);
        } finally {
            if (isCancelled()) {
                outcome.complete(Status.CANCELLED);
            } else {
                try {
                    get();
                    outcome.complete(Status.DELIVERED);
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    failure = cause instanceof DeliveryException
                            ? (DeliveryException) cause
                            : new DeliveryException(connection.getId(), cause);
                    Log.warn(failure.getMessage());
                    outcome.complete(Status.FAILED);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    outcome.complete(Status.CANCELLED);
                }
            }
        }
    }

    public Connection getConnection() {
        return connection;
    }

    public CompletableFuture<Status> outcome() {
        return outcome;
    }

    public DeliveryException getFailure() {
        return failure;
    }
}
