package com.agentrooms.abort;

import com.agentrooms.shared.error.DispatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Abort signal for one in-flight request. Listeners run exactly once, either
 * when {@link #abort()} fires or immediately if they register afterwards.
 */
public final class CancellationHandle {

    private static final Logger log = LoggerFactory.getLogger(CancellationHandle.class);

    private final String requestId;
    private final List<Runnable> listeners = new ArrayList<>();
    private volatile boolean aborted;

    public CancellationHandle(String requestId) {
        this.requestId = requestId;
    }

    public String requestId() {
        return requestId;
    }

    public boolean isAborted() {
        return aborted;
    }

    public void throwIfAborted() {
        if (aborted) throw DispatchException.cancelled();
    }

    public void onAbort(Runnable listener) {
        synchronized (this) {
            if (!aborted) {
                listeners.add(listener);
                return;
            }
        }
        fire(listener);
    }

    /** Returns false when the handle had already been aborted. */
    public boolean abort() {
        List<Runnable> pending;
        synchronized (this) {
            if (aborted) return false;
            aborted = true;
            pending = List.copyOf(listeners);
            listeners.clear();
        }
        log.debug("Aborting request {}", requestId);
        pending.forEach(this::fire);
        return true;
    }

    private void fire(Runnable listener) {
        try {
            listener.run();
        } catch (RuntimeException e) {
            log.debug("Abort listener for {} failed: {}", requestId, e.getMessage());
        }
    }
}
