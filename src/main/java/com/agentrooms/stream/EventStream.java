package com.agentrooms.stream;

import com.agentrooms.abort.CancellationHandle;
import com.agentrooms.abort.CancellationRegistry;
import com.agentrooms.shared.error.DispatchException;
import com.agentrooms.shared.model.StreamEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.CancellationException;

/**
 * Pull-based producer of one request's events. The source only advances when
 * the consumer asks for more. Whatever happens inside {@link #open()} or
 * {@link #advance()}, the sequence ends with exactly one terminal event and
 * the request's cancellation entry is released.
 *
 * <p>Not thread-safe: one consumer pulls. Only the {@link CancellationHandle}
 * is touched from other threads.
 */
public abstract class EventStream implements Iterator<StreamEvent>, Closeable {

    private static final Logger log = LoggerFactory.getLogger(EventStream.class);

    protected final String requestId;
    protected final CancellationHandle handle;
    private final CancellationRegistry registry;
    private final Deque<StreamEvent> buffer = new ArrayDeque<>();
    private boolean started;
    private boolean finished;
    private boolean cleanedUp;

    protected EventStream(String requestId, CancellationRegistry registry) {
        this.requestId = requestId;
        this.registry = registry;
        this.handle = new CancellationHandle(requestId);
    }

    /** Starts the source. May {@link #emit} events. */
    protected abstract void open() throws Exception;

    /**
     * Produces the next events via {@link #emit}.
     *
     * @return false once the source is exhausted
     */
    protected abstract boolean advance() throws Exception;

    /** Releases connections, readers or processes. Called exactly once. */
    protected void cleanup() throws Exception {
    }

    protected String describeFailure(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    protected final void emit(StreamEvent event) {
        if (finished) {
            log.debug("Dropping {} for {} after terminal event", event.type(), requestId);
            return;
        }
        if (event.isTerminal()) {
            finish(event);
        } else {
            buffer.add(event);
        }
    }

    public final CancellationHandle handle() {
        return handle;
    }

    @Override
    public boolean hasNext() {
        fill();
        return !buffer.isEmpty();
    }

    @Override
    public StreamEvent next() {
        if (!hasNext()) throw new NoSuchElementException();
        return buffer.poll();
    }

    private void fill() {
        if (!finished && handle.isAborted()) {
            buffer.clear();
            finish(StreamEvent.aborted());
        }
        while (buffer.isEmpty() && !finished) {
            try {
                if (!started) {
                    started = true;
                    registry.register(requestId, handle);
                    handle.throwIfAborted();
                    open();
                    continue;
                }
                handle.throwIfAborted();
                if (!advance() && !finished) {
                    finish(StreamEvent.done());
                }
            } catch (Exception e) {
                buffer.clear();
                finish(toTerminal(e));
            }
        }
    }

    private StreamEvent toTerminal(Exception e) {
        if (e instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
        if (handle.isAborted()
                || e instanceof CancellationException
                || e instanceof InterruptedException
                || (e instanceof DispatchException de && de.isCancellation())) {
            log.debug("Request {} aborted", requestId);
            return StreamEvent.aborted();
        }
        var message = describeFailure(e);
        if (e instanceof DispatchException) {
            log.warn("Request {} failed: {}", requestId, message);
        } else {
            log.error("Request {} failed unexpectedly", requestId, e);
        }
        return StreamEvent.failed(message);
    }

    private void finish(StreamEvent terminal) {
        buffer.add(terminal);
        finished = true;
        release();
    }

    private void release() {
        if (!cleanedUp) {
            cleanedUp = true;
            try {
                cleanup();
            } catch (Exception e) {
                log.debug("Cleanup for {} failed: {}", requestId, e.getMessage());
            }
        }
        registry.release(requestId, handle);
    }

    /**
     * Stops the stream without a terminal event, for consumers that went
     * away. An unfinished stream counts as aborted.
     */
    @Override
    public void close() {
        if (finished) return;
        finished = true;
        buffer.clear();
        handle.abort();
        release();
    }

    /** A stream that fails with {@code message} as soon as it is pulled. */
    public static EventStream failing(String requestId, CancellationRegistry registry, String message) {
        return new EventStream(requestId, registry) {
            @Override
            protected void open() {
                throw DispatchException.backend(message);
            }

            @Override
            protected boolean advance() {
                return false;
            }
        };
    }
}
