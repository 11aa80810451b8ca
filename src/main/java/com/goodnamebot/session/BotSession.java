/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.goodnamebot.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.goodnamebot.utils.BotLogger;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The bot's connection to the chat service.
 *
 * <p>Wraps a {@link SlackTransport}: turns raw events into {@link InboundMessage}s
 * worth dispatching and exposes the outbound {@link #send(String, String)}
 * primitive. Every payload in either direction is logged at debug level.
 */
public class BotSession implements MessageSender {

    static final String POST_MESSAGE = "chat.postMessage";

    private final SlackTransport transport;
    private final BotLogger logger;

    public BotSession(SlackTransport transport, BotLogger logger) {
        if (transport == null) {
            throw new IllegalArgumentException("Transport cannot be null");
        }
        this.transport = transport;
        this.logger = logger.named("BotSession");
    }

    /**
     * Connects to the chat service.
     *
     * @throws BotSessionException if the handshake fails
     */
    public void connect() {
        if (!transport.connect()) {
            logger.error("Connection error!");
            throw new BotSessionException("Could not connect to Slack");
        }
        logger.info("Connection established.");
    }

    /**
     * Returns the text messages received since the last call.
     *
     * <p>Non-message events, blank messages and the bot's own messages are
     * dropped here.
     *
     * @return messages to dispatch, possibly empty
     * @throws IOException if the connection has been lost
     */
    public List<InboundMessage> receiveBatch() throws IOException {
        List<JsonNode> events = transport.read();
        if (events.isEmpty()) {
            return List.of();
        }
        logger.debug(() -> "Received: " + events);

        Optional<String> self = transport.selfId();
        List<InboundMessage> messages = new ArrayList<>();
        for (JsonNode event : events) {
            InboundMessage message = InboundMessage.fromJson(event);
            if (!message.isTextMessage()) {
                continue;
            }
            if (self.isPresent() && self.get().equals(message.user())) {
                continue;
            }
            messages.add(message);
        }
        return messages;
    }

    @Override
    public void send(String channelId, String text) {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("channel", channelId);
        args.put("text", text);
        args.put("as_user", true);
        try {
            JsonNode result = apiCall(POST_MESSAGE, args);
            if (!result.path("ok").asBoolean(false)) {
                logger.warn("Erroneous result?: " + result);
            }
        } catch (IOException | RuntimeException e) {
            logger.warn("Failed to send message to " + channelId + ": " + e.getMessage());
        }
    }

    /**
     * Calls a Web API method, logging the response at debug level.
     */
    public JsonNode apiCall(String method, Map<String, ?> args) throws IOException {
        logger.debug(() -> "Calling api '" + method + "' " + args);
        JsonNode result = transport.apiCall(method, args);
        logger.debug(() -> "Response: " + result);
        return result;
    }

    /**
     * Issues the configured diagnostic calls in order. Each call is a map with a
     * {@code method} key; the remaining entries are its arguments. Failing calls
     * are logged and skipped.
     *
     * @param debugCalls configured calls, may be empty
     */
    public void performDebugCalls(List<Map<String, Object>> debugCalls) {
        for (Map<String, Object> call : debugCalls) {
            Object method = call.get("method");
            if (!(method instanceof String) || ((String) method).isBlank()) {
                logger.warn("Skipping debug call without a method: " + call);
                continue;
            }
            Map<String, Object> args = new LinkedHashMap<>(call);
            args.remove("method");
            // timeout is a transport setting, not an API argument
            args.remove("timeout");
            try {
                apiCall((String) method, args);
            } catch (IOException | RuntimeException e) {
                logger.warn("Debug call '" + method + "' failed: " + e.getMessage());
            }
        }
    }

    public void close() {
        transport.close();
    }
}
