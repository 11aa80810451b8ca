/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.goodnamebot.trigger;

/**
 * The actions a trigger can be bound to, by their configuration names.
 */
public enum ActionType {
    POST_GOOD_NAME_ALERT("post_good_name_alert"),
    ADD_GOOD_NAME("add_good_name"),
    MISSING_ACTION("missing_action");

    private final String configName;

    ActionType(String configName) {
        this.configName = configName;
    }

    public String getConfigName() {
        return configName;
    }

    /**
     * Resolves a configured action name. Unknown or absent names resolve to
     * {@link #MISSING_ACTION}.
     *
     * @param name action name from the configuration, may be null
     * @return the matching type, never null
     */
    public static ActionType fromConfigName(String name) {
        if (name != null) {
            String trimmed = name.strip();
            for (ActionType type : values()) {
                if (type.configName.equals(trimmed)) {
                    return type;
                }
            }
        }
        return MISSING_ACTION;
    }
}
