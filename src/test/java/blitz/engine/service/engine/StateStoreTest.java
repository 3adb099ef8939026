package blitz.engine.service.engine;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class StateStoreTest {

    @Test
    void read_returnsInitialState() {
        StateStore<String> store = new StateStore<>("idle");

        assertEquals("idle", store.read());
    }

    @Test
    void replace_swapsWholeValue() {
        StateStore<String> store = new StateStore<>("idle");

        store.replace("busy");

        assertEquals("busy", store.read());
    }

    @Test
    void replace_rejectsNull() {
        StateStore<String> store = new StateStore<>("idle");

        assertThrows(NullPointerException.class, () -> store.replace(null));
        assertEquals("idle", store.read());
    }

    @Test
    void computeWithLock_holdsLockWhileRunning() {
        StateStore<String> store = new StateStore<>("idle");

        boolean held = store.computeWithLock(state -> store.isHeldByCurrentThread());

        assertTrue(held);
        assertFalse(store.isHeldByCurrentThread());
    }

    @Test
    void withLock_serializesConcurrentReadModifyWrite() throws Exception {
        StateStore<Integer> store = new StateStore<>(0);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                futures.add(executor.submit(() -> {
                    for (int i = 0; i < 1000; i++) {
                        store.withLock(value -> store.replace(value + 1));
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(8000, store.read());
    }
}
