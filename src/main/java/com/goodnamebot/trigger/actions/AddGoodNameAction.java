/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.goodnamebot.trigger.actions;

import com.goodnamebot.session.InboundMessage;
import com.goodnamebot.session.MessageSender;
import com.goodnamebot.store.GoodNameStore;
import com.goodnamebot.trigger.ActionType;
import com.goodnamebot.trigger.TriggerAction;
import com.goodnamebot.trigger.TriggerMatch;
import com.goodnamebot.utils.BotLogger;

import java.util.Optional;

/**
 * Records the text captured by the trigger's first group as a good name and
 * confirms it in the channel. Duplicates and store failures are silent.
 */
public class AddGoodNameAction implements TriggerAction {

    static final String CONFIRMATION_FORMAT = "Good name %s recorded.";

    private final GoodNameStore store;
    private final MessageSender sender;
    private final BotLogger logger;

    public AddGoodNameAction(GoodNameStore store, MessageSender sender, BotLogger logger) {
        this.store = store;
        this.sender = sender;
        this.logger = logger.named("AddGoodName");
    }

    @Override
    public ActionType getType() {
        return ActionType.ADD_GOOD_NAME;
    }

    /**
     * @throws IllegalStateException if the trigger has no capture group
     */
    @Override
    public void handle(InboundMessage message, TriggerMatch match) {
        if (match.groups().isEmpty()) {
            throw new IllegalStateException("Trigger '" + match.trigger() + "' has no group to take the name from");
        }
        String proposed = match.group(1);
        if (proposed == null) {
            logger.debug(() -> "Trigger '" + match.trigger() + "' matched without capturing a name");
            return;
        }

        Optional<String> added = store.addGoodName(proposed, message.user());
        if (added.isPresent()) {
            sender.send(message.channel(), String.format(CONFIRMATION_FORMAT, added.get()));
        } else {
            logger.debug(() -> "Good name not recorded: '" + proposed.strip() + "'");
        }
    }
}
