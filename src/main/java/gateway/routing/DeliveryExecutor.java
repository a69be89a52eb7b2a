package gateway.routing;

import gateway.registry.Connection;
import gateway.utils.Log;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded pool running {@link Delivery} tasks. Every delivery is tracked from submission until it
 * finishes so that shutdown can cancel whatever is still outstanding.
 */
public class DeliveryExecutor {

    private final ThreadPoolExecutor pool;
    private final long sendTimeoutMillis;

    // guarded by this
    private final Set<Delivery> inFlight = new LinkedHashSet<>();
    private boolean closed = false;

    public DeliveryExecutor(int threads, int queueCapacity, OverflowPolicy overflowPolicy, long sendTimeoutMillis) {
        if (threads < 1) throw new IllegalArgumentException("threads must be >= 1");
        if (queueCapacity < 1) throw new IllegalArgumentException("queueCapacity must be >= 1");
        this.sendTimeoutMillis = sendTimeoutMillis;

        AtomicInteger counter = new AtomicInteger();
        this.pool = new ThreadPoolExecutor(threads, threads, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(queueCapacity),
                r -> {
                    Thread t = new Thread(r, "Delivery-" + counter.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                },
                rejectionHandler(overflowPolicy));
    }

    /**
     * Schedules one delivery. Never throws for a full queue: depending on the overflow policy the
     * caller waits, or a delivery comes back already cancelled.
     */
    public Delivery submit(Connection connection, String payload) {
        Delivery delivery = new Delivery(connection, payload, sendTimeoutMillis, this::untrack);
        synchronized (this) {
            if (closed) {
                delivery.cancel(false);
                return delivery;
            }
            inFlight.add(delivery);
        }
        try {
            pool.execute(delivery);
        } catch (RejectedExecutionException e) {
            delivery.cancel(false);
        }
        return delivery;
    }

    /**
     * Cancels every outstanding delivery and refuses new ones from now on.
     *
     * @return how many deliveries were cancelled
     */
    public int cancelAll() {
        List<Delivery> pending;
        synchronized (this) {
            closed = true;
            pending = new ArrayList<>(inFlight);
        }
        int cancelled = 0;
        for (Delivery delivery : pending) {
            if (delivery.cancel(true)) cancelled++;
        }
        pool.getQueue().clear();
        return cancelled;
    }

    public synchronized int inFlightCount() {
        return inFlight.size();
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    public void shutdown() {
        cancelAll();
        pool.shutdownNow();
        try {
            if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                Log.warn("Delivery workers did not stop within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private synchronized void untrack(Delivery delivery) {
        inFlight.remove(delivery);
    }

    private static RejectedExecutionHandler rejectionHandler(OverflowPolicy policy) {
        switch (policy) {
            case BLOCK:
                return (r, executor) -> {
                    if (executor.isShutdown()) {
                        throw new RejectedExecutionException("Delivery pool is shut down");
                    }
                    try {
                        executor.getQueue().put(r);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new RejectedExecutionException("Interrupted while waiting for delivery queue space", e);
                    }
                };
            case DROP_OLDEST:
                return (r, executor) -> {
                    if (executor.isShutdown()) {
                        throw new RejectedExecutionException("Delivery pool is shut down");
                    }
                    Runnable oldest = executor.getQueue().poll();
                    if (oldest instanceof Delivery) {
                        Delivery dropped = (Delivery) oldest;
                        Log.warn("Delivery queue full, dropping oldest delivery to " + dropped.getConnection().getId());
                        dropped.cancel(false);
                    }
                    executor.execute(r);
                };
            case DROP_NEWEST:
            default:
                return (r, executor) -> {
                    if (r instanceof Delivery) {
                        Log.warn("Delivery queue full, dropping delivery to " + ((Delivery) r).getConnection().getId());
                    }
                    throw new RejectedExecutionException("Delivery queue full");
                };
        }
    }
}
