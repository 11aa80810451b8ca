/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.goodnamebot.trigger.actions;

import com.goodnamebot.session.InboundMessage;
import com.goodnamebot.trigger.ActionType;
import com.goodnamebot.trigger.TriggerAction;
import com.goodnamebot.trigger.TriggerMatch;
import com.goodnamebot.utils.BotLogger;

/**
 * Stand-in for triggers whose configured action does not exist. Logs, never replies.
 */
public class MissingAction implements TriggerAction {

    private final BotLogger logger;

    public MissingAction(BotLogger logger) {
        this.logger = logger.named("MissingAction");
    }

    @Override
    public ActionType getType() {
        return ActionType.MISSING_ACTION;
    }

    @Override
    public void handle(InboundMessage message, TriggerMatch match) {
        logger.warn("Action defined for pattern '" + match.trigger()
                + "' did not match any known action. Data: " + message);
    }
}
