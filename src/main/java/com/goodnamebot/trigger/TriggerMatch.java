/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.goodnamebot.trigger;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;

/**
 * Result of a trigger matching a line.
 *
 * @param trigger     the trigger pattern as configured
 * @param matchedText the part of the line the pattern consumed
 * @param groups      captured groups 1..n, null for groups that did not participate
 */
public record TriggerMatch(String trigger, String matchedText, List<String> groups) {

    static TriggerMatch of(String trigger, Matcher matcher) {
        String[] captured = new String[matcher.groupCount()];
        for (int i = 0; i < captured.length; i++) {
            captured[i] = matcher.group(i + 1);
        }
        // Arrays.asList keeps null entries, List.of would reject them
        return new TriggerMatch(trigger, matcher.group(), Collections.unmodifiableList(Arrays.asList(captured)));
    }

    /**
     * Group accessor with regex numbering: 0 is the whole match.
     *
     * @throws IndexOutOfBoundsException if the pattern has no such group
     */
    public String group(int index) {
        return index == 0 ? matchedText : groups.get(index - 1);
    }
}
