/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.goodnamebot.trigger;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A compiled trigger pattern bound to its action.
 *
 * <p>Patterns are case-insensitive and anchored at the start of the line only,
 * so {@code !gna(.+)} matches {@code "!GNA Foo"} but not {@code "say !gna Foo"}.
 */
public final class TriggerBinding {

    private final String trigger;
    private final Pattern pattern;
    private final String configuredAction;
    private final TriggerAction action;

    TriggerBinding(String trigger, Pattern pattern, String configuredAction, TriggerAction action) {
        this.trigger = trigger;
        this.pattern = pattern;
        this.configuredAction = configuredAction;
        this.action = action;
    }

    /**
     * Matches the given line (already trimmed) against this trigger.
     */
    public Optional<TriggerMatch> match(String line) {
        Matcher matcher = pattern.matcher(line);
        if (!matcher.lookingAt()) {
            return Optional.empty();
        }
        return Optional.of(TriggerMatch.of(trigger, matcher));
    }

    public String getTrigger() {
        return trigger;
    }

    /** The action name as written in the configuration, may be null. */
    public String getConfiguredAction() {
        return configuredAction;
    }

    public TriggerAction getAction() {
        return action;
    }

    @Override
    public String toString() {
        return "'" + trigger + "' -> " + action.getType().getConfigName();
    }
}
