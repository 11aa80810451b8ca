/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.goodnamebot.server;

import com.goodnamebot.session.BotSession;
import com.goodnamebot.session.BotSessionException;
import com.goodnamebot.session.InboundMessage;
import com.goodnamebot.trigger.TriggerRegistry;
import com.goodnamebot.utils.BotLogger;

import java.util.List;

/**
 * Main activity of the bot: read, dispatch, sleep, forever.
 *
 * <p>Any exception escaping a read/dispatch cycle moves the loop to
 * {@link State#RECOVERING}, where it reconnects the session following the
 * {@link ReconnectPolicy}. Running out of attempts is fatal.
 */
public class PollLoop {

    public enum State { RUNNING, RECOVERING }

    /**
     * Sleep hook, replaced in tests.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final BotSession session;
    private final TriggerRegistry registry;
    private final ReconnectPolicy reconnectPolicy;
    private final long pollIntervalMs;
    private final BotLogger logger;
    private final Sleeper sleeper;

    private volatile State state = State.RUNNING;

    public PollLoop(BotSession session, TriggerRegistry registry, ReconnectPolicy reconnectPolicy,
                    long pollIntervalMs, BotLogger logger) {
        this(session, registry, reconnectPolicy, pollIntervalMs, logger, Thread::sleep);
    }

    public PollLoop(BotSession session, TriggerRegistry registry, ReconnectPolicy reconnectPolicy,
                    long pollIntervalMs, BotLogger logger, Sleeper sleeper) {
        if (pollIntervalMs < 0) {
            throw new IllegalArgumentException("pollIntervalMs must be >= 0, got: " + pollIntervalMs);
        }
        this.session = session;
        this.registry = registry;
        this.reconnectPolicy = reconnectPolicy;
        this.pollIntervalMs = pollIntervalMs;
        this.logger = logger.named("PollLoop");
        this.sleeper = sleeper;
    }

    /**
     * Runs until the thread is interrupted.
     *
     * @throws BotSessionException if the session cannot be recovered
     * @throws InterruptedException if interrupted while sleeping
     */
    public void run() throws InterruptedException {
        logger.info("Polling every " + pollIntervalMs + "ms");
        while (!Thread.currentThread().isInterrupted()) {
            tick();
            sleeper.sleep(pollIntervalMs);
        }
    }

    /**
     * One read/dispatch cycle, recovering the session if it fails.
     *
     * @return number of messages dispatched, 0 if the cycle failed
     * @throws BotSessionException if the session cannot be recovered
     * @throws InterruptedException if interrupted while backing off
     */
    public int tick() throws InterruptedException {
        try {
            List<InboundMessage> batch = session.receiveBatch();
            for (InboundMessage message : batch) {
                registry.dispatch(message);
            }
            return batch.size();
        } catch (Exception e) {
            logger.error("Got exception when attempting to read! " + e.getMessage());
            recover();
            return 0;
        }
    }

    /**
     * Reconnects with backoff, returning to {@link State#RUNNING} on success.
     *
     * @throws BotSessionException once every attempt has failed
     * @throws InterruptedException if interrupted while backing off
     */
    void recover() throws InterruptedException {
        state = State.RECOVERING;
        int maxAttempts = reconnectPolicy.getMaxAttempts();
        BotSessionException lastFailure = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            long delayMs = reconnectPolicy.computeDelayMs(attempt);
            logger.info("Reconnect attempt " + attempt + "/" + maxAttempts + " in " + delayMs + "ms");
            sleeper.sleep(delayMs);
            try {
                session.connect();
                state = State.RUNNING;
                logger.info("Recovered after " + attempt + " attempt(s)");
                return;
            } catch (BotSessionException e) {
                lastFailure = e;
                logger.warn("Reconnect attempt " + attempt + " failed: " + e.getMessage());
            }
        }

        throw new BotSessionException("Giving up after " + maxAttempts + " reconnect attempt(s)", lastFailure);
    }

    public State getState() {
        return state;
    }
}
