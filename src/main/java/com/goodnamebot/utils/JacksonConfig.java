/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.goodnamebot.utils;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Shared ObjectMapper instances. ObjectMapper is thread-safe after configuration,
 * so a single instance can be reused across the application.
 */
public final class JacksonConfig {

    private static final ObjectMapper INSTANCE = new ObjectMapper();

    private static final ObjectMapper PRETTY_INSTANCE = new ObjectMapper();

    static {
        INSTANCE.registerModule(new JavaTimeModule());
        INSTANCE.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

        PRETTY_INSTANCE.registerModule(new JavaTimeModule());
        PRETTY_INSTANCE.enable(SerializationFeature.INDENT_OUTPUT);
        PRETTY_INSTANCE.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        PRETTY_INSTANCE.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    private JacksonConfig() {}

    /** Standard ObjectMapper for Slack payloads and configuration files. */
    public static ObjectMapper mapper() {
        return INSTANCE;
    }

    /** Pretty-printing ObjectMapper used for the good name document. */
    public static ObjectMapper prettyMapper() {
        return PRETTY_INSTANCE;
    }
}
