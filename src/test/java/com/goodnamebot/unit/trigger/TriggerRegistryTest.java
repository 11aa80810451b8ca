/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.goodnamebot.unit.trigger;

import com.goodnamebot.config.ConfigurationException;
import com.goodnamebot.config.TriggerConfig;
import com.goodnamebot.session.InboundMessage;
import com.goodnamebot.trigger.ActionType;
import com.goodnamebot.trigger.TriggerAction;
import com.goodnamebot.trigger.TriggerMatch;
import com.goodnamebot.trigger.TriggerRegistry;
import com.goodnamebot.trigger.actions.MissingAction;
import com.goodnamebot.utils.BotLogger;
import org.junit.jupiter.api.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TriggerRegistry.
 */
@DisplayName("TriggerRegistry")
class TriggerRegistryTest {

    private static final String ALERT_TRIGGER = ".*name alert.*";
    private static final String ADD_TRIGGER = "!gna(.+)";

    private final List<String> calls = new ArrayList<>();
    private ByteArrayOutputStream logOutput;
    private BotLogger logger;
    private Map<ActionType, TriggerAction> actions;

    // Records every invocation as "<type>:<group 1 or whole match>"
    private class RecordingAction implements TriggerAction {
        private final ActionType type;

        RecordingAction(ActionType type) {
            this.type = type;
        }

        @Override
        public ActionType getType() {
            return type;
        }

        @Override
        public void handle(InboundMessage message, TriggerMatch match) {
            String captured = match.groups().isEmpty() ? match.group(0) : match.group(1);
            calls.add(type.getConfigName() + ":" + captured);
        }
    }

    private static class FailingAction implements TriggerAction {
        @Override
        public ActionType getType() {
            return ActionType.POST_GOOD_NAME_ALERT;
        }

        @Override
        public void handle(InboundMessage message, TriggerMatch match) throws Exception {
            throw new RuntimeException("Simulated action failure");
        }
    }

    @BeforeEach
    void setUp() {
        logOutput = new ByteArrayOutputStream();
        logger = new BotLogger(new PrintStream(logOutput, true, StandardCharsets.UTF_8), true);
        actions = new EnumMap<>(ActionType.class);
        actions.put(ActionType.POST_GOOD_NAME_ALERT, new RecordingAction(ActionType.POST_GOOD_NAME_ALERT));
        actions.put(ActionType.ADD_GOOD_NAME, new RecordingAction(ActionType.ADD_GOOD_NAME));
        actions.put(ActionType.MISSING_ACTION, new MissingAction(logger));
    }

    private static InboundMessage message(String text) {
        return new InboundMessage("message", text, "U1", "C1");
    }

    private TriggerRegistry registry(TriggerConfig... triggers) {
        return new TriggerRegistry(List.of(triggers), actions, logger);
    }

    @Test
    @DisplayName("should fire every overlapping trigger in registration order")
    void shouldFireAllMatchesInOrder() {
        TriggerRegistry registry = registry(
                new TriggerConfig(ALERT_TRIGGER, "post_good_name_alert"),
                new TriggerConfig(ADD_TRIGGER, "add_good_name"));

        int matched = registry.dispatch(message("!gna Jerry Mander name alert"));

        assertEquals(2, matched);
        assertEquals(List.of(
                "post_good_name_alert:!gna Jerry Mander name alert",
                "add_good_name: Jerry Mander name alert"), calls);
    }

    @Test
    @DisplayName("should follow registration order rather than pattern specificity")
    void shouldFollowRegistrationOrder() {
        TriggerRegistry registry = registry(
                new TriggerConfig(ADD_TRIGGER, "add_good_name"),
                new TriggerConfig(ALERT_TRIGGER, "post_good_name_alert"));

        registry.dispatch(message("!gna Jerry Mander name alert"));

        assertEquals(List.of(
                "add_good_name: Jerry Mander name alert",
                "post_good_name_alert:!gna Jerry Mander name alert"), calls);
    }

    @Test
    @DisplayName("should match case-insensitively")
    void shouldIgnoreCase() {
        TriggerRegistry registry = registry(new TriggerConfig(ALERT_TRIGGER, "post_good_name_alert"));

        assertEquals(1, registry.dispatch(message("NAME ALERT!")));
    }

    @Test
    @DisplayName("should anchor triggers at the start of the trimmed line only")
    void shouldAnchorAtStart() {
        TriggerRegistry registry = registry(new TriggerConfig(ADD_TRIGGER, "add_good_name"));

        assertEquals(0, registry.dispatch(message("hey !gna Foo")));
        assertEquals(1, registry.dispatch(message("   !gna Foo   ")));
        assertEquals(List.of("add_good_name: Foo"), calls);
    }

    @Test
    @DisplayName("should strip Unicode whitespace before anchoring")
    void shouldStripUnicodeWhitespace() {
        TriggerRegistry registry = registry(new TriggerConfig(ADD_TRIGGER, "add_good_name"));

        assertEquals(1, registry.dispatch(message("\u2003\u3000!gna Foo\u2003")));
        assertEquals(List.of("add_good_name: Foo"), calls);
    }

    @Test
    @DisplayName("should ignore blank lines")
    void shouldIgnoreBlankLines() {
        TriggerRegistry registry = registry(new TriggerConfig(".*", "post_good_name_alert"));

        assertEquals(0, registry.dispatch(message("   ")));
        assertTrue(calls.isEmpty());
    }

    @Test
    @DisplayName("should keep dispatching after an action fails")
    void shouldIsolateFailures() {
        actions.put(ActionType.POST_GOOD_NAME_ALERT, new FailingAction());
        TriggerRegistry registry = registry(
                new TriggerConfig(ALERT_TRIGGER, "post_good_name_alert"),
                new TriggerConfig(ADD_TRIGGER, "add_good_name"));

        int matched = registry.dispatch(message("!gna name alert"));

        assertEquals(2, matched);
        assertEquals(List.of("add_good_name: name alert"), calls);
        assertTrue(logOutput.toString(StandardCharsets.UTF_8).contains("Simulated action failure"));
    }

    @Test
    @DisplayName("should bind unknown action names to the missing action")
    void shouldBindUnknownActionToMissingAction() {
        TriggerRegistry registry = registry(new TriggerConfig("!boom", "self_destruct"));

        assertEquals(ActionType.MISSING_ACTION, registry.getBindings().get(0).getAction().getType());
        assertEquals("self_destruct", registry.getBindings().get(0).getConfiguredAction());

        assertEquals(1, registry.dispatch(message("!boom")));
        String log = logOutput.toString(StandardCharsets.UTF_8);
        assertTrue(log.contains("'self_destruct' for trigger '!boom' is not a known action"), log);
        assertTrue(log.contains("did not match any known action"), log);
        assertTrue(calls.isEmpty());
    }

    @Test
    @DisplayName("should reject an invalid trigger regex")
    void shouldRejectInvalidRegex() {
        assertThrows(ConfigurationException.class,
                () -> registry(new TriggerConfig("!gna(", "add_good_name")));
    }

    @Test
    @DisplayName("should reject a missing trigger")
    void shouldRejectMissingTrigger() {
        assertThrows(ConfigurationException.class,
                () -> registry(new TriggerConfig(null, "add_good_name")));
    }

    @Test
    @DisplayName("should require a missing action implementation")
    void shouldRequireMissingAction() {
        actions.remove(ActionType.MISSING_ACTION);

        assertThrows(IllegalArgumentException.class,
                () -> registry(new TriggerConfig(ALERT_TRIGGER, "post_good_name_alert")));
    }
}
