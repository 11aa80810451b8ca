/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.goodnamebot.server;

import com.goodnamebot.config.ConfigLoader;
import com.goodnamebot.config.ConfigurationException;

import java.util.Properties;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Reconnect schedule: exponential backoff with jitter and a bounded number of attempts.
 *
 * <p>Delay for attempt {@code n} is {@code baseDelay * 2^(n-1)}, capped at
 * {@code maxDelay}, multiplied by a random factor in [0.5, 1.5) and capped again.
 */
public final class ReconnectPolicy {

    private static final long DEFAULT_BASE_DELAY_MS = 1000;
    private static final long DEFAULT_MAX_DELAY_MS = 60000;
    private static final int DEFAULT_MAX_ATTEMPTS = 10;

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final int maxAttempts;

    /**
     * @param baseDelayMs delay before the first attempt, must be positive
     * @param maxDelayMs  upper bound for any delay
     * @param maxAttempts attempts before giving up, must be positive
     */
    public ReconnectPolicy(long baseDelayMs, long maxDelayMs, int maxAttempts) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be > 0, got: " + maxAttempts);
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Reads {@code reconnect.base.delay.ms}, {@code reconnect.max.delay.ms} and
     * {@code reconnect.max.attempts}.
     *
     * @throws ConfigurationException if a value is not a number or out of range
     */
    public static ReconnectPolicy fromProperties(Properties properties) {
        long baseDelayMs = ConfigLoader.longProperty(properties, "reconnect.base.delay.ms", DEFAULT_BASE_DELAY_MS);
        long maxDelayMs = ConfigLoader.longProperty(properties, "reconnect.max.delay.ms", DEFAULT_MAX_DELAY_MS);
        int maxAttempts = ConfigLoader.intProperty(properties, "reconnect.max.attempts", DEFAULT_MAX_ATTEMPTS);
        try {
            return new ReconnectPolicy(baseDelayMs, maxDelayMs, maxAttempts);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid reconnect settings: " + e.getMessage(), e);
        }
    }

    /**
     * @param attempt 1-based attempt number
     * @return milliseconds to wait before that attempt
     */
    public long computeDelayMs(int attempt) {
        if (attempt <= 0) {
            return 0L;
        }
        long expDelay;
        if (attempt >= 31) {
            expDelay = Long.MAX_VALUE;
        } else {
            long shift = 1L << (attempt - 1);
            expDelay = shift > maxDelayMs / baseDelayMs ? Long.MAX_VALUE : baseDelayMs * shift;
        }
        long capped = Math.min(maxDelayMs, expDelay);
        double jitter = ThreadLocalRandom.current().nextDouble(0.5, 1.5);
        return Math.min(maxDelayMs, Math.max(0L, (long) (capped * jitter)));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }
}
