package com.agentrooms.abort;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-flight requests by requestId. Safe to call from any thread; a signal
 * racing a release leaves the map consistent either way.
 */
public class CancellationRegistry {

    private static final Logger log = LoggerFactory.getLogger(CancellationRegistry.class);

    private final ConcurrentMap<String, CancellationHandle> handles = new ConcurrentHashMap<>();

    public void register(String requestId, CancellationHandle handle) {
        var previous = handles.put(requestId, handle);
        if (previous != null && previous != handle) {
            log.info("Request {} reused while in flight, aborting the earlier stream", requestId);
            previous.abort();
        }
    }

    public boolean signal(String requestId) {
        var handle = handles.remove(requestId);
        if (handle == null) return false;
        handle.abort();
        return true;
    }

    public void release(String requestId) {
        handles.remove(requestId);
    }

    /** Removes the entry only while it still maps to {@code handle}. */
    public void release(String requestId, CancellationHandle handle) {
        handles.remove(requestId, handle);
    }

    public boolean contains(String requestId) {
        return handles.containsKey(requestId);
    }

    public int size() {
        return handles.size();
    }
}
