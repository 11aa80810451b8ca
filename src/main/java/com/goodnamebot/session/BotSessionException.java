/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.goodnamebot.session;

/**
 * Fatal session failure: the handshake failed, or the reconnect budget ran out.
 */
public class BotSessionException extends RuntimeException {

    public BotSessionException(String message) {
        super(message);
    }

    public BotSessionException(String message, Throwable cause) {
        super(message, cause);
    }
}
