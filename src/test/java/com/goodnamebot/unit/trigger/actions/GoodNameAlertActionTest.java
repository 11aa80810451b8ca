/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.goodnamebot.unit.trigger.actions;

import com.goodnamebot.session.InboundMessage;
import com.goodnamebot.session.MessageSender;
import com.goodnamebot.store.GoodName;
import com.goodnamebot.store.GoodNameStore;
import com.goodnamebot.trigger.ActionType;
import com.goodnamebot.trigger.TriggerMatch;
import com.goodnamebot.trigger.actions.GoodNameAlertAction;
import com.goodnamebot.utils.BotLogger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.OutputStream;
import java.io.PrintStream;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("GoodNameAlertAction")
class GoodNameAlertActionTest {

    private GoodNameStore store;
    private MessageSender sender;
    private GoodNameAlertAction action;

    private final InboundMessage message = new InboundMessage("message", "name alert", "U2", "C2");
    private final TriggerMatch match = new TriggerMatch(".*name alert.*", "name alert", List.of());

    @BeforeEach
    void setUp() {
        store = mock(GoodNameStore.class);
        sender = mock(MessageSender.class);
        action = new GoodNameAlertAction(store, sender, new BotLogger(new PrintStream(OutputStream.nullOutputStream()), true));
    }

    @Test
    @DisplayName("should post a random good name to the originating channel")
    void shouldPostRandomName() {
        when(store.getRandomGoodName())
                .thenReturn(Optional.of(GoodName.create("Foo", "U1", "11", LocalDateTime.now())));

        action.handle(message, match);

        verify(sender).send("C2", "Good name: Foo");
        verify(store, never()).addGoodName(anyString(), anyString());
    }

    @Test
    @DisplayName("should stay silent when no name is available")
    void shouldStaySilentWhenUnavailable() {
        when(store.getRandomGoodName()).thenReturn(Optional.empty());

        action.handle(message, match);

        verifyNoInteractions(sender);
    }

    @Test
    @DisplayName("should report its action type")
    void shouldReportType() {
        assertEquals(ActionType.POST_GOOD_NAME_ALERT, action.getType());
    }
}
