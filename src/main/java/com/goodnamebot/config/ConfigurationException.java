/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.goodnamebot.config;

/**
 * Invalid or incomplete configuration. Always fatal at startup.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
