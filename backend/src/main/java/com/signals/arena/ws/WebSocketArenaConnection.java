package com.signals.arena.ws;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Outbound side of one Spring WebSocket session.
 *
 * <p>{@link #send} only enqueues. Frames are written by a flush task on the transport executor, at most
 * one flush per session at a time, so frames keep their order and a blocked socket write holds a
 * transport thread instead of the caller. A session whose buffered frames exceed the byte limit, or whose
 * current write has been stuck longer than the send time limit, is closed as not reliable.
 */
public class WebSocketArenaConnection implements ArenaConnection {

    private static final Logger log = LoggerFactory.getLogger(WebSocketArenaConnection.class);

    private final WebSocketSession session;
    private final Executor transportExecutor;
    private final long sendTimeLimitNanos;
    private final int bufferSizeLimitBytes;

    private final Queue<TextMessage> pending = new ConcurrentLinkedQueue<>();
    private final AtomicLong bufferedBytes = new AtomicLong();
    private final AtomicBoolean flushScheduled = new AtomicBoolean();
    private final AtomicBoolean closing = new AtomicBoolean();
    private volatile long writeStartedAt;

    public WebSocketArenaConnection(
            WebSocketSession session,
            Executor transportExecutor,
            int sendTimeLimitMs,
            int bufferSizeLimitBytes
    ) {
        this.session = session;
        this.transportExecutor = transportExecutor;
        this.sendTimeLimitNanos = TimeUnit.MILLISECONDS.toNanos(sendTimeLimitMs);
        this.bufferSizeLimitBytes = bufferSizeLimitBytes;
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public boolean isOpen() {
        return !closing.get() && session.isOpen();
    }

    @Override
    public void send(String text) throws IOException {
        if (!isOpen()) {
            throw new IOException("Session " + session.getId() + " is closed");
        }
        long startedAt = writeStartedAt;
        if (startedAt != 0L && System.nanoTime() - startedAt > sendTimeLimitNanos) {
            closeAsUnreliable("write blocked longer than " + TimeUnit.NANOSECONDS.toMillis(sendTimeLimitNanos) + " ms");
            throw new IOException("Session " + session.getId() + " exceeded its send time limit");
        }

        TextMessage message = new TextMessage(text);
        if (bufferedBytes.addAndGet(message.getPayloadLength()) > bufferSizeLimitBytes) {
            bufferedBytes.addAndGet(-message.getPayloadLength());
            closeAsUnreliable("buffered frames exceeded " + bufferSizeLimitBytes + " bytes");
            throw new IOException("Session " + session.getId() + " exceeded its send buffer");
        }
        pending.add(message);
        scheduleFlush();
    }

    @Override
    public void close() {
        if (closing.compareAndSet(false, true)) {
            runOnTransport(() -> closeSession(CloseStatus.NORMAL));
        }
    }

    int bufferedBytes() {
        return (int) bufferedBytes.get();
    }

    private void scheduleFlush() throws IOException {
        if (!flushScheduled.compareAndSet(false, true)) {
            return;
        }
        try {
            transportExecutor.execute(this::flush);
        } catch (RejectedExecutionException ex) {
            flushScheduled.set(false);
            throw new IOException("Transport executor rejected flush for session " + session.getId(), ex);
        }
    }

    private void flush() {
        try {
            TextMessage message;
            while ((message = pending.poll()) != null) {
                bufferedBytes.addAndGet(-message.getPayloadLength());
                if (!isOpen()) {
                    continue;
                }
                writeStartedAt = System.nanoTime();
                session.sendMessage(message);
                writeStartedAt = 0L;
            }
        } catch (IOException | RuntimeException ex) {
            writeStartedAt = 0L;
            log.debug("Write to session {} failed: {}", session.getId(), ex.getMessage());
            pending.clear();
            bufferedBytes.set(0L);
        } finally {
            flushScheduled.set(false);
        }
        if (!pending.isEmpty() && isOpen()) {
            try {
                scheduleFlush();
            } catch (IOException ex) {
                log.debug("Dropping {} queued frame(s) for session {}: {}", pending.size(), session.getId(), ex.getMessage());
            }
        }
    }

    private void closeAsUnreliable(String reason) {
        if (closing.compareAndSet(false, true)) {
            log.warn("Closing session {}: {}", session.getId(), reason);
            pending.clear();
            bufferedBytes.set(0L);
            runOnTransport(() -> closeSession(CloseStatus.SESSION_NOT_RELIABLE));
        }
    }

    private void runOnTransport(Runnable task) {
        try {
            transportExecutor.execute(task);
        } catch (RejectedExecutionException ex) {
            log.debug("Transport executor rejected close of session {}", session.getId());
        }
    }

    private void closeSession(CloseStatus status) {
        try {
            session.close(status);
        } catch (IOException ex) {
            log.debug("Closing session {} failed: {}", session.getId(), ex.getMessage());
        }
    }
}
