package blitz.engine.service.engine;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One subscriber's bounded view of an {@link EventBus}.
 */
public class Subscription<E> implements AutoCloseable {
    private final EventBus<E> bus;
    private final BlockingQueue<E> queue;
    private final AtomicLong lagged = new AtomicLong();
    private final AtomicBoolean closed = new AtomicBoolean();

    Subscription(EventBus<E> bus, int capacity) {
        this.bus = bus;
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    void offer(E event) {
        if (closed.get()) {
            return;
        }
        while (!queue.offer(event)) {
            if (queue.poll() != null) {
                lagged.incrementAndGet();
                bus.recordDrop();
            }
        }
    }

    /**
     * Blocks until the next event is available.
     */
    public E next() throws InterruptedException {
        return queue.take();
    }

    /**
     * @return the next event, or {@code null} if none arrived within the timeout
     */
    public E poll(Duration timeout) throws InterruptedException {
        return queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * @return the number of events dropped since the previous call
     */
    public long takeLagged() {
        return lagged.getAndSet(0);
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            bus.unsubscribe(this);
            queue.clear();
        }
    }
}
