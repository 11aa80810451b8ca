/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.goodnamebot.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Contents of the bot's JSON configuration file.
 * <pre>
 * {
 *   "token": "xoxb-...",
 *   "actions": [
 *     {"trigger": ".*name alert.*", "action": "post_good_name_alert"},
 *     {"trigger": "!gna(.+)", "action": "add_good_name"}
 *   ],
 *   "debug_calls": [
 *     {"method": "chat.postMessage", "channel": "C024BE91L", "text": "Hello"}
 *   ]
 * }
 * </pre>
 */
public class BotConfig {

    @JsonProperty("token")
    private final String token;

    @JsonProperty("actions")
    private final List<TriggerConfig> actions;

    @JsonProperty("debug_calls")
    private final List<Map<String, Object>> debugCalls;

    @JsonCreator
    public BotConfig(@JsonProperty("token") String token,
                     @JsonProperty("actions") List<TriggerConfig> actions,
                     @JsonProperty("debug_calls") List<Map<String, Object>> debugCalls) {
        this.token = token;
        this.actions = actions;
        this.debugCalls = debugCalls != null ? debugCalls : List.of();
    }

    public String getToken() {
        return token;
    }

    public List<TriggerConfig> getActions() {
        return actions;
    }

    public List<Map<String, Object>> getDebugCalls() {
        return debugCalls;
    }
}
