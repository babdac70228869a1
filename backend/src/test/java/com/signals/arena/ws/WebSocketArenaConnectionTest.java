package com.signals.arena.ws;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WebSocketArenaConnectionTest {

    private final List<String> written = new CopyOnWriteArrayList<>();
    private final CountDownLatch writeEntered = new CountDownLatch(1);
    private final CountDownLatch releaseWrite = new CountDownLatch(1);

    private WebSocketSession session;
    private ExecutorService writers;

    @BeforeEach
    void setUp() throws IOException {
        session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn("agent-1");
        when(session.isOpen()).thenReturn(true);
        writers = Executors.newFixedThreadPool(2);
    }

    @AfterEach
    void tearDown() {
        releaseWrite.countDown();
        writers.shutdownNow();
    }

    @Test
    void send_returnsWhileTheSocketWriteIsBlocked() throws Exception {
        blockWrites();
        WebSocketArenaConnection connection = new WebSocketArenaConnection(session, writers, 10_000, 64 * 1024);

        assertTimeoutPreemptively(Duration.ofMillis(500), () -> {
            connection.send("first");
            assertTrue(writeEntered.await(1, TimeUnit.SECONDS));
            connection.send("second");
            connection.send("third");
        });
        assertEquals(List.of("first"), written);

        releaseWrite.countDown();

        verify(session, timeout(2000).times(3)).sendMessage(any());
        assertEquals(List.of("first", "second", "third"), written);
        assertEquals(0, connection.bufferedBytes());
    }

    @Test
    void send_closesTheSessionWhenBufferedFramesExceedTheLimit() throws Exception {
        List<Runnable> queuedTasks = new ArrayList<>();
        WebSocketArenaConnection connection = new WebSocketArenaConnection(session, queuedTasks::add, 10_000, 10);

        connection.send("12345678");
        assertThrows(IOException.class, () -> connection.send("abcdef"));
        assertFalse(connection.isOpen());
        assertThrows(IOException.class, () -> connection.send("x"));

        queuedTasks.forEach(Runnable::run);

        verify(session).close(CloseStatus.SESSION_NOT_RELIABLE);
        verify(session, never()).sendMessage(any());
    }

    @Test
    void send_closesTheSessionWhenAWriteOutlivesTheTimeLimit() throws Exception {
        blockWrites();
        WebSocketArenaConnection connection = new WebSocketArenaConnection(session, writers, 50, 64 * 1024);

        connection.send("first");
        assertTrue(writeEntered.await(1, TimeUnit.SECONDS));
        Thread.sleep(120);

        assertThrows(IOException.class, () -> connection.send("second"));

        verify(session, timeout(2000)).close(CloseStatus.SESSION_NOT_RELIABLE);
        assertFalse(connection.isOpen());
    }

    @Test
    void send_writesFramesInOrderAndReleasesTheBuffer() throws Exception {
        recordWrites();
        WebSocketArenaConnection connection = new WebSocketArenaConnection(session, Runnable::run, 10_000, 64 * 1024);

        connection.send("a");
        connection.send("b");
        connection.close();

        assertEquals(List.of("a", "b"), written);
        assertEquals(0, connection.bufferedBytes());
        verify(session).close(CloseStatus.NORMAL);
        assertThrows(IOException.class, () -> connection.send("c"));
    }

    private void blockWrites() throws IOException {
        doAnswer(invocation -> {
            written.add(((TextMessage) invocation.getArgument(0)).getPayload());
            writeEntered.countDown();
            releaseWrite.await(5, TimeUnit.SECONDS);
            return null;
        }).when(session).sendMessage(any());
    }

    private void recordWrites() throws IOException {
        doAnswer(invocation -> {
            written.add(((TextMessage) invocation.getArgument(0)).getPayload());
            return null;
        }).when(session).sendMessage(any());
    }
}
