package blitz.engine.service.engine;

import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Holds the single authoritative state value of an engine.
 * <p>
 * Reads are lock-free snapshots. Writers take the lock, which must only be held
 * across in-memory work and event publication, never across a blocking call.
 */
public class StateStore<S> {
    private final ReentrantLock lock = new ReentrantLock();
    private volatile S current;

    public StateStore(S initial) {
        this.current = Objects.requireNonNull(initial, "initial state");
    }

    public S read() {
        return current;
    }

    public void replace(S next) {
        Objects.requireNonNull(next, "next state");
        lock.lock();
        try {
            current = next;
        } finally {
            lock.unlock();
        }
    }

    public void withLock(Consumer<S> action) {
        lock.lock();
        try {
            action.accept(current);
        } finally {
            lock.unlock();
        }
    }

    public <R> R computeWithLock(Function<S, R> action) {
        lock.lock();
        try {
            return action.apply(current);
        } finally {
            lock.unlock();
        }
    }

    public boolean isHeldByCurrentThread() {
        return lock.isHeldByCurrentThread();
    }
}
