/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.goodnamebot.trigger.actions;

import com.goodnamebot.session.InboundMessage;
import com.goodnamebot.session.MessageSender;
import com.goodnamebot.store.GoodName;
import com.goodnamebot.store.GoodNameStore;
import com.goodnamebot.trigger.ActionType;
import com.goodnamebot.trigger.TriggerAction;
import com.goodnamebot.trigger.TriggerMatch;
import com.goodnamebot.utils.BotLogger;

import java.util.Optional;

/**
 * Posts a random good name to the channel the trigger came from.
 * Posts nothing when the store has no name to offer.
 */
public class GoodNameAlertAction implements TriggerAction {

    static final String MESSAGE_FORMAT = "Good name: %s";

    private final GoodNameStore store;
    private final MessageSender sender;
    private final BotLogger logger;

    public GoodNameAlertAction(GoodNameStore store, MessageSender sender, BotLogger logger) {
        this.store = store;
        this.sender = sender;
        this.logger = logger.named("GoodNameAlert");
    }

    @Override
    public ActionType getType() {
        return ActionType.POST_GOOD_NAME_ALERT;
    }

    @Override
    public void handle(InboundMessage message, TriggerMatch match) {
        Optional<GoodName> goodName = store.getRandomGoodName();
        if (goodName.isEmpty()) {
            logger.debug(() -> "No good name available for alert in " + message.channel());
            return;
        }
        sender.send(message.channel(), String.format(MESSAGE_FORMAT, goodName.get().getGoodName()));
    }
}
