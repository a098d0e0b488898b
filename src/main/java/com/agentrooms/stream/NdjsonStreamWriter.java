package com.agentrooms.stream;

import com.agentrooms.shared.model.StreamEvent;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Iterator;
import java.util.Random;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Writes an event sequence as NDJSON. A connection ack goes out before the
 * first pull, whitespace-only lines are sprinkled in to defeat proxy buffering,
 * and exactly one terminal event is written per call. A periodic heartbeat
 * writes the same whitespace line, so a departed client is noticed and the
 * producer aborted without waiting for its next event.
 */
public class NdjsonStreamWriter {

    private static final Logger log = LoggerFactory.getLogger(NdjsonStreamWriter.class);
    private static final byte[] FLUSH_LINE = " \n".getBytes(StandardCharsets.UTF_8);
    private static final ObjectMapper mapper = new ObjectMapper();

    private final double flushProbability;
    private final Random random;
    private final Clock clock;
    private final Duration heartbeat;
    private final ScheduledExecutorService heartbeats;

    public NdjsonStreamWriter(double flushProbability, Duration heartbeat) {
        this(flushProbability, new Random(), Clock.systemUTC(), heartbeat);
    }

    public NdjsonStreamWriter(double flushProbability, Random random, Clock clock) {
        this(flushProbability, random, clock, Duration.ZERO);
    }

    /**
     * @param heartbeat interval between heartbeat lines; zero disables them
     */
    public NdjsonStreamWriter(double flushProbability, Random random, Clock clock, Duration heartbeat) {
        this.flushProbability = flushProbability;
        this.random = random;
        this.clock = clock;
        this.heartbeat = heartbeat;
        this.heartbeats = heartbeat.isZero() ? null : Executors.newSingleThreadScheduledExecutor(r -> {
            var t = new Thread(r, "ndjson-heartbeat");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * @return the terminal event that was written
     * @throws IOException when the client went away; the producer has been closed by then
     */
    public StreamEvent write(Iterator<StreamEvent> events, OutputStream out) throws IOException {
        var lock = new Object();
        try {
            synchronized (lock) {
                writeEvent(out, connectionAck());
                out.write(FLUSH_LINE);
                out.flush();
            }
        } catch (IOException e) {
            closeProducer(events);
            throw e;
        }

        var beat = startHeartbeat(events, out, lock);
        try {
            return writeEvents(events, out, lock);
        } finally {
            if (beat != null) beat.cancel(false);
        }
    }

    private StreamEvent writeEvents(Iterator<StreamEvent> events, OutputStream out, Object lock) throws IOException {
        StreamEvent terminal = null;
        try {
            while (terminal == null && events.hasNext()) {
                var event = events.next();
                synchronized (lock) {
                    writeEvent(out, event);
                    if (event.isTerminal()) {
                        terminal = event;
                    } else if (random.nextDouble() < flushProbability) {
                        out.write(FLUSH_LINE);
                    }
                    out.flush();
                }
            }
            if (terminal == null) {
                terminal = StreamEvent.failed("Stream ended without a terminal event");
                synchronized (lock) {
                    writeEvent(out, terminal);
                    out.flush();
                }
            }
        } catch (IOException e) {
            log.debug("Client disconnected: {}", e.getMessage());
            closeProducer(events);
            throw e;
        } catch (RuntimeException e) {
            log.error("Event producer failed", e);
            closeProducer(events);
            terminal = StreamEvent.failed(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            synchronized (lock) {
                writeEvent(out, terminal);
                out.flush();
            }
        }
        return terminal;
    }

    private ScheduledFuture<?> startHeartbeat(Iterator<StreamEvent> events, OutputStream out, Object lock) {
        if (heartbeats == null) return null;
        var millis = heartbeat.toMillis();
        return heartbeats.scheduleAtFixedRate(() -> {
            try {
                synchronized (lock) {
                    out.write(FLUSH_LINE);
                    out.flush();
                }
            } catch (IOException e) {
                log.debug("Heartbeat found the client gone: {}", e.getMessage());
                if (events instanceof EventStream stream) {
                    stream.handle().abort();
                }
                // stops further runs of this task
                throw new IllegalStateException("client disconnected", e);
            }
        }, millis, millis, TimeUnit.MILLISECONDS);
    }

    private StreamEvent connectionAck() {
        var data = mapper.createObjectNode();
        data.put("type", "system");
        data.put("subtype", "connection_ack");
        data.put("timestamp", clock.millis());
        return StreamEvent.claudeJson(data);
    }

    private static void writeEvent(OutputStream out, StreamEvent event) throws IOException {
        out.write(StreamEventCodec.encode(event).getBytes(StandardCharsets.UTF_8));
        out.write('\n');
    }

    private static void closeProducer(Iterator<StreamEvent> events) {
        if (events instanceof Closeable closeable) {
            try {
                closeable.close();
            } catch (IOException e) {
                log.debug("Closing producer failed: {}", e.getMessage());
            }
        }
    }
}
