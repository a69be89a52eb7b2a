package gateway;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Lifecycle of one gateway instance. Only moves forward: ACTIVE, SHUTTING_DOWN, STOPPED.
 */
public class Lifecycle {

    public enum State {
        ACTIVE,
        SHUTTING_DOWN,
        STOPPED
    }

    private final AtomicReference<State> state = new AtomicReference<>(State.ACTIVE);

    public State get() {
        return state.get();
    }

    public boolean isActive() {
        return state.get() == State.ACTIVE;
    }

    /**
     * @return true for the single caller that moved the gateway out of ACTIVE
     */
    public boolean beginShutdown() {
        return state.compareAndSet(State.ACTIVE, State.SHUTTING_DOWN);
    }

    public void markStopped() {
        state.set(State.STOPPED);
    }

    @Override
    public String toString() {
        return state.get().name();
    }
}
