/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.goodnamebot.unit.server;

import com.goodnamebot.server.PollLoop;
import com.goodnamebot.server.ReconnectPolicy;
import com.goodnamebot.session.BotSession;
import com.goodnamebot.session.BotSessionException;
import com.goodnamebot.session.InboundMessage;
import com.goodnamebot.trigger.TriggerRegistry;
import com.goodnamebot.utils.BotLogger;
import org.junit.jupiter.api.*;
import org.mockito.InOrder;

import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for PollLoop.
 */
@DisplayName("PollLoop")
class PollLoopTest {

    private BotSession session;
    private TriggerRegistry registry;
    private List<Long> sleeps;
    private PollLoop loop;

    private final InboundMessage first = new InboundMessage("message", "name alert", "U1", "C1");
    private final InboundMessage second = new InboundMessage("message", "!gna Foo", "U2", "C1");

    @BeforeEach
    void setUp() {
        session = mock(BotSession.class);
        registry = mock(TriggerRegistry.class);
        sleeps = new ArrayList<>();
        loop = new PollLoop(session, registry, new ReconnectPolicy(10, 100, 3), 1000,
                new BotLogger(new PrintStream(OutputStream.nullOutputStream()), false), sleeps::add);
    }

    @Test
    @DisplayName("should dispatch every message of a batch in order")
    void shouldDispatchBatch() throws Exception {
        when(session.receiveBatch()).thenReturn(List.of(first, second));

        assertEquals(2, loop.tick());

        InOrder inOrder = inOrder(registry);
        inOrder.verify(registry).dispatch(first);
        inOrder.verify(registry).dispatch(second);
        assertEquals(PollLoop.State.RUNNING, loop.getState());
        verify(session, never()).connect();
    }

    @Test
    @DisplayName("should reconnect after a read failure")
    void shouldRecoverFromReadFailure() throws Exception {
        when(session.receiveBatch()).thenThrow(new IOException("RTM stream lost"));

        assertEquals(0, loop.tick());

        verify(session, times(1)).connect();
        verifyNoInteractions(registry);
        assertEquals(PollLoop.State.RUNNING, loop.getState());
        assertEquals(1, sleeps.size());
        assertTrue(sleeps.get(0) >= 5 && sleeps.get(0) < 15, "backoff was " + sleeps.get(0));
    }

    @Test
    @DisplayName("should keep retrying with growing delays until connected")
    void shouldRetryUntilConnected() throws Exception {
        when(session.receiveBatch()).thenThrow(new IOException("RTM stream lost"));
        doThrow(new BotSessionException("down"))
                .doThrow(new BotSessionException("still down"))
                .doNothing()
                .when(session).connect();

        loop.tick();

        verify(session, times(3)).connect();
        assertEquals(3, sleeps.size());
        assertTrue(sleeps.get(2) >= 20, "third backoff was " + sleeps.get(2));
        assertEquals(PollLoop.State.RUNNING, loop.getState());
    }

    @Test
    @DisplayName("should give up after the reconnect budget is spent")
    void shouldGiveUpAfterMaxAttempts() throws Exception {
        when(session.receiveBatch()).thenThrow(new IOException("RTM stream lost"));
        doThrow(new BotSessionException("down")).when(session).connect();

        BotSessionException e = assertThrows(BotSessionException.class, () -> loop.tick());

        assertTrue(e.getMessage().contains("3"));
        verify(session, times(3)).connect();
        assertEquals(PollLoop.State.RECOVERING, loop.getState());
    }

    @Test
    @DisplayName("should recover from failures escaping dispatch")
    void shouldRecoverFromDispatchFailure() throws Exception {
        when(session.receiveBatch()).thenReturn(List.of(first));
        when(registry.dispatch(first)).thenThrow(new IllegalStateException("escaped"));

        loop.tick();

        verify(session).connect();
    }

    @Test
    @DisplayName("should sleep the poll interval between ticks until interrupted")
    void shouldSleepBetweenTicks() throws Exception {
        when(session.receiveBatch()).thenReturn(List.of());
        PollLoop interruptingLoop = new PollLoop(session, registry, new ReconnectPolicy(10, 100, 3), 1000,
                new BotLogger(new PrintStream(OutputStream.nullOutputStream()), false),
                millis -> {
                    sleeps.add(millis);
                    if (sleeps.size() == 2) {
                        Thread.currentThread().interrupt();
                    }
                });

        try {
            interruptingLoop.run();
        } finally {
            // clear the flag for the next test on this thread
            Thread.interrupted();
        }

        assertEquals(List.of(1000L, 1000L), sleeps);
        verify(session, times(2)).receiveBatch();
    }
}
