/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.goodnamebot.trigger;

import com.goodnamebot.session.InboundMessage;

/**
 * Something the bot does when a trigger matches an inbound message.
 *
 * <p>Implementations may throw; {@link TriggerRegistry} logs the failure and
 * carries on with the remaining bindings.
 *
 * @see ActionType
 */
public interface TriggerAction {

    /**
     * @return the configured action this implementation answers to
     */
    ActionType getType();

    /**
     * Handles one matching message.
     *
     * @param message the message that matched, carrying sender and channel
     * @param match   the trigger and its captured groups
     * @throws Exception if the action fails
     */
    void handle(InboundMessage message, TriggerMatch match) throws Exception;
}
