/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.goodnamebot.session;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Raw access to the Slack real-time stream and Web API.
 *
 * @see SlackRtmTransport
 * @see BotSession
 */
public interface SlackTransport extends AutoCloseable {

    /**
     * Performs the real-time handshake, replacing any previous connection.
     *
     * @return true if the stream is open
     */
    boolean connect();

    /**
     * Returns the events received since the previous call. Never blocks.
     *
     * @return raw events, possibly empty
     * @throws IOException if the stream is not open or has been lost
     */
    List<JsonNode> read() throws IOException;

    /**
     * Calls a Web API method.
     *
     * @param method API method name, e.g. {@code chat.postMessage}
     * @param args   method arguments
     * @return the decoded response body, which carries an {@code ok} flag
     * @throws IOException on transport or HTTP failure
     */
    JsonNode apiCall(String method, Map<String, ?> args) throws IOException;

    /**
     * @return the bot's own user id once connected
     */
    Optional<String> selfId();

    @Override
    void close();
}
