/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.goodnamebot.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One entry of the {@code actions} list: a trigger regex and the name of the
 * action to run when it matches.
 * <pre>
 * {"trigger": ".*name alert.*", "action": "post_good_name_alert"}
 * </pre>
 */
public class TriggerConfig {

    @JsonProperty("trigger")
    private final String trigger;

    @JsonProperty("action")
    private final String action;

    @JsonCreator
    public TriggerConfig(@JsonProperty("trigger") String trigger,
                         @JsonProperty("action") String action) {
        this.trigger = trigger;
        this.action = action;
    }

    public String getTrigger() {
        return trigger;
    }

    public String getAction() {
        return action;
    }

    @Override
    public String toString() {
        return "{trigger='" + trigger + "', action='" + action + "'}";
    }
}
