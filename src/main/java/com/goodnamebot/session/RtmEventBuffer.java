/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.goodnamebot.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.goodnamebot.utils.BotLogger;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Events received on one RTM connection, waiting to be read by the poll loop.
 *
 * <p>Written from the WebSocket thread, drained from the poll loop thread.
 * Once the connection has failed, events that were already queued are still
 * handed out; the failure surfaces on the first drain that finds the queue empty.
 */
public class RtmEventBuffer {

    private final ConcurrentLinkedQueue<JsonNode> events = new ConcurrentLinkedQueue<>();
    private final ObjectMapper objectMapper;
    private final BotLogger logger;
    private volatile Throwable failure;

    public RtmEventBuffer(ObjectMapper objectMapper, BotLogger logger) {
        this.objectMapper = objectMapper;
        this.logger = logger;
    }

    /**
     * Parses and queues one complete text frame. A {@code goodbye} event is
     * queued and also marks the connection as failed.
     */
    public void enqueue(String frame) {
        try {
            JsonNode event = objectMapper.readTree(frame);
            events.add(event);
            if ("goodbye".equals(event.path("type").asText())) {
                fail(new IOException("Slack requested reconnect (goodbye)"));
            }
        } catch (JsonProcessingException e) {
            logger.warn("Dropping unparseable RTM frame: " + e.getOriginalMessage());
        }
    }

    /**
     * Records a connection failure. The first failure wins.
     */
    public void fail(Throwable cause) {
        if (failure == null) {
            failure = cause;
        }
    }

    public boolean isFailed() {
        return failure != null;
    }

    /**
     * @return every queued event, oldest first
     * @throws IOException if the queue is empty and the connection has failed
     */
    public List<JsonNode> drain() throws IOException {
        List<JsonNode> drained = new ArrayList<>();
        JsonNode event;
        while ((event = events.poll()) != null) {
            drained.add(event);
        }
        if (drained.isEmpty() && failure != null) {
            throw new IOException("RTM stream lost: " + failure.getMessage(), failure);
        }
        return drained;
    }
}
