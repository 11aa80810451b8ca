/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.goodnamebot.session;

/**
 * Outbound half of the session as seen by trigger actions.
 */
@FunctionalInterface
public interface MessageSender {

    /**
     * Posts text to a channel. Failures are logged, never thrown.
     *
     * @param channelId destination channel id
     * @param text      message text
     */
    void send(String channelId, String text);
}
