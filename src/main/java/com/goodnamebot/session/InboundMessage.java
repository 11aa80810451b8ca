/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.goodnamebot.session;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * An inbound event from the real-time stream, reduced to the fields the bot uses.
 *
 * @param type    event type discriminator, e.g. {@code "message"}
 * @param text    message text, empty if absent
 * @param user    id of the sending user, null if absent
 * @param channel id of the channel the event arrived on, null if absent
 */
public record InboundMessage(String type, String text, String user, String channel) {

    public static final String TYPE_MESSAGE = "message";

    public InboundMessage {
        text = text != null ? text : "";
    }

    /**
     * Builds a message from a raw RTM event.
     */
    public static InboundMessage fromJson(JsonNode event) {
        return new InboundMessage(
                textOrNull(event, "type"),
                textOrNull(event, "text"),
                textOrNull(event, "user"),
                textOrNull(event, "channel"));
    }

    /**
     * @return true for a {@code message} event with non-blank text
     */
    public boolean isTextMessage() {
        return TYPE_MESSAGE.equals(type) && !text.isBlank();
    }

    private static String textOrNull(JsonNode event, String field) {
        JsonNode value = event.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }
}
