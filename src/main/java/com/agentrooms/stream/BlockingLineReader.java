package com.agentrooms.stream;

import com.agentrooms.shared.error.DispatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Reads lines from a blocking source on a daemon pump thread so the consumer
 * can wait with a timeout and be woken by {@link #interrupt()}.
 * The queue is bounded, so the pump stops reading when nobody consumes.
 */
public class BlockingLineReader implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(BlockingLineReader.class);
    private static final int CAPACITY = 256;
    private static final Object END = new Object();
    private static final Object WAKE = new Object();

    private final BlockingQueue<Object> lines = new LinkedBlockingQueue<>(CAPACITY);
    private final InputStream source;
    private final Thread pump;
    private volatile boolean interrupted;
    private volatile boolean closed;
    private boolean exhausted;

    public BlockingLineReader(InputStream source, String name) {
        this.source = source;
        this.pump = new Thread(this::pump, name);
        this.pump.setDaemon(true);
        this.pump.start();
    }

    private void pump() {
        try (var reader = new BufferedReader(new InputStreamReader(source, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                lines.put(line);
            }
            lines.put(END);
        } catch (IOException e) {
            if (!closed) {
                lines.offer(e);
            }
            lines.offer(END);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /** Next line, or null at end of input. Waits as long as it takes. */
    public String next() throws IOException, InterruptedException {
        return next(null);
    }

    /**
     * Next line, or null at end of input.
     *
     * @throws DispatchException TIMEOUT when no line arrives within {@code timeout},
     *                           CANCELLED after {@link #interrupt()}
     */
    public String next(Duration timeout) throws IOException, InterruptedException {
        if (exhausted) return null;
        if (interrupted) throw DispatchException.cancelled();
        var item = timeout == null
                ? lines.take()
                : lines.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (interrupted) throw DispatchException.cancelled();
        if (item == null) {
            throw DispatchException.timeout("Stream read timeout after " + describe(timeout));
        }
        if (item == END) {
            exhausted = true;
            return null;
        }
        if (item instanceof IOException e) {
            exhausted = true;
            throw e;
        }
        return (String) item;
    }

    /** Wakes a waiting consumer; every later {@link #next} call fails as cancelled. */
    public void interrupt() {
        interrupted = true;
        lines.offer(WAKE);
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        lines.clear();
        pump.interrupt();
        try {
            source.close();
        } catch (IOException e) {
            log.debug("Closing {} failed: {}", pump.getName(), e.getMessage());
        }
    }

    static String describe(Duration timeout) {
        var millis = timeout.toMillis();
        return millis % 1000 == 0 ? (millis / 1000) + " seconds" : millis + " ms";
    }
}
