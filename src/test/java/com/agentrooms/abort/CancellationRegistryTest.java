package com.agentrooms.abort;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CancellationRegistryTest {

    @Test
    void signalAbortsAndRemoves() {
        var registry = new CancellationRegistry();
        var handle = new CancellationHandle("r1");
        registry.register("r1", handle);

        assertTrue(registry.signal("r1"));
        assertTrue(handle.isAborted());
        assertFalse(registry.contains("r1"));
    }

    @Test
    void secondSignalReportsNotFound() {
        var registry = new CancellationRegistry();
        var handle = new CancellationHandle("r1");
        var fired = new AtomicInteger();
        handle.onAbort(fired::incrementAndGet);
        registry.register("r1", handle);

        assertTrue(registry.signal("r1"));
        assertFalse(registry.signal("r1"));
        assertEquals(1, fired.get());
    }

    @Test
    void unknownIdIsNotFound() {
        assertFalse(new CancellationRegistry().signal("missing"));
    }

    @Test
    void reRegisteringAbortsThePreviousHandle() {
        var registry = new CancellationRegistry();
        var first = new CancellationHandle("r1");
        var second = new CancellationHandle("r1");
        registry.register("r1", first);
        registry.register("r1", second);

        assertTrue(first.isAborted());
        assertFalse(second.isAborted());
        assertTrue(registry.contains("r1"));
    }

    @Test
    void staleReleaseKeepsTheSuccessor() {
        var registry = new CancellationRegistry();
        var first = new CancellationHandle("r1");
        var second = new CancellationHandle("r1");
        registry.register("r1", first);
        registry.register("r1", second);

        registry.release("r1", first);
        assertTrue(registry.contains("r1"));

        registry.release("r1", second);
        assertFalse(registry.contains("r1"));
    }

    @Test
    void releaseIsIdempotent() {
        var registry = new CancellationRegistry();
        registry.register("r1", new CancellationHandle("r1"));
        registry.release("r1");
        registry.release("r1");
        assertEquals(0, registry.size());
    }

    @Test
    void lateListenerRunsImmediately() {
        var handle = new CancellationHandle("r1");
        assertTrue(handle.abort());
        assertFalse(handle.abort());

        var fired = new AtomicInteger();
        handle.onAbort(fired::incrementAndGet);
        assertEquals(1, fired.get());
    }

    @Test
    void failingListenerDoesNotStopOthers() {
        var handle = new CancellationHandle("r1");
        var fired = new AtomicInteger();
        handle.onAbort(() -> { throw new IllegalStateException("boom"); });
        handle.onAbort(fired::incrementAndGet);
        handle.abort();
        assertEquals(1, fired.get());
    }

    @Test
    void signalRacingReleaseNeverFaults() throws Exception {
        var registry = new CancellationRegistry();
        var aborts = new AtomicInteger();
        for (int i = 0; i < 200; i++) {
            var id = "r" + i;
            var handle = new CancellationHandle(id);
            handle.onAbort(aborts::incrementAndGet);
            registry.register(id, handle);
        }

        var start = new CountDownLatch(1);
        var threads = new ArrayList<Thread>();
        for (int t = 0; t < 4; t++) {
            var signaller = t % 2 == 0;
            var thread = new Thread(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                for (int i = 0; i < 200; i++) {
                    if (signaller) registry.signal("r" + i);
                    else registry.release("r" + i);
                }
            });
            thread.start();
            threads.add(thread);
        }
        start.countDown();
        for (var thread : threads) thread.join(5000);

        assertEquals(0, registry.size());
        assertTrue(aborts.get() <= 200);
    }
}
