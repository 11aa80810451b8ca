/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.goodnamebot.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.goodnamebot.config.ConfigLoader;
import com.goodnamebot.utils.BotLogger;
import com.goodnamebot.utils.JacksonConfig;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.entity.UrlEncodedFormEntity;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.http.NameValuePair;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.message.BasicNameValuePair;
import org.apache.hc.core5.util.Timeout;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Slack transport over the RTM API.
 *
 * <p>Web API calls are form-encoded POSTs with a bearer token. {@link #connect()}
 * calls {@code rtm.connect} and opens a WebSocket to the returned URL; frames
 * arriving on the WebSocket thread are parsed into an {@link RtmEventBuffer}
 * until the poll loop drains them with {@link #read()}.
 */
public class SlackRtmTransport implements SlackTransport {

    private static final String DEFAULT_BASE_URL = "https://slack.com/api";
    private static final int DEFAULT_TIMEOUT_MS = 10000;

    private final String baseUrl;
    private final String token;
    private final int timeoutMs;
    private final BotLogger logger;
    private final ObjectMapper objectMapper;
    private final CloseableHttpClient httpClient;
    private final HttpClient webSocketClient;

    private volatile RtmListener listener;
    private volatile WebSocket webSocket;
    private volatile String selfId;

    public SlackRtmTransport(String token, Properties properties, BotLogger logger) {
        this(properties.getProperty("slack.api.base.url", DEFAULT_BASE_URL),
             token,
             ConfigLoader.intProperty(properties, "slack.timeout.ms", DEFAULT_TIMEOUT_MS),
             logger);
    }

    public SlackRtmTransport(String baseUrl, String token, int timeoutMs, BotLogger logger) {
        if (token == null || token.isEmpty()) {
            throw new IllegalArgumentException("Slack token cannot be null or empty");
        }
        this.baseUrl = baseUrl;
        this.token = token;
        this.timeoutMs = timeoutMs;
        this.logger = logger.named("SlackRtm");
        this.objectMapper = JacksonConfig.mapper();
        this.httpClient = HttpClients.custom()
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setResponseTimeout(Timeout.ofMilliseconds(timeoutMs))
                        .setConnectionRequestTimeout(Timeout.ofMilliseconds(timeoutMs))
                        .build())
                .build();
        this.webSocketClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(timeoutMs))
                .build();
    }

    @Override
    public boolean connect() {
        closeWebSocket();

        JsonNode handshake;
        try {
            handshake = apiCall("rtm.connect", Map.of());
        } catch (IOException e) {
            logger.error("rtm.connect failed: " + e.getMessage());
            return false;
        }
        if (!handshake.path("ok").asBoolean(false)) {
            logger.error("rtm.connect refused: " + handshake.path("error").asText("unknown error"));
            return false;
        }

        String url = handshake.path("url").asText(null);
        if (url == null) {
            logger.error("rtm.connect response did not contain a WebSocket URL");
            return false;
        }
        selfId = handshake.path("self").path("id").asText(null);

        RtmListener newListener = new RtmListener();
        try {
            webSocket = webSocketClient.newWebSocketBuilder()
                    .buildAsync(URI.create(url), newListener)
                    .get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException | TimeoutException e) {
            logger.error("Could not open RTM WebSocket: " + e.getMessage());
            return false;
        }
        listener = newListener;
        logger.info("RTM stream open (self=" + selfId + ")");
        return true;
    }

    @Override
    public List<JsonNode> read() throws IOException {
        RtmListener current = listener;
        if (current == null) {
            throw new IOException("RTM stream is not connected");
        }
        return current.buffer.drain();
    }

    @Override
    public JsonNode apiCall(String method, Map<String, ?> args) throws IOException {
        HttpPost post = new HttpPost(baseUrl + "/" + method);
        post.setHeader("Authorization", "Bearer " + token);

        List<NameValuePair> form = new ArrayList<>();
        for (Map.Entry<String, ?> arg : args.entrySet()) {
            form.add(new BasicNameValuePair(arg.getKey(), formValue(arg.getValue())));
        }
        post.setEntity(new UrlEncodedFormEntity(form, StandardCharsets.UTF_8));

        return httpClient.execute(post, httpResponse -> {
            int statusCode = httpResponse.getCode();
            String responseBody = EntityUtils.toString(httpResponse.getEntity(), StandardCharsets.UTF_8);
            if (statusCode != 200) {
                throw new IOException(method + " returned HTTP " + statusCode + ": " + responseBody);
            }
            return objectMapper.readTree(responseBody);
        });
    }

    @Override
    public Optional<String> selfId() {
        return Optional.ofNullable(selfId);
    }

    @Override
    public void close() {
        closeWebSocket();
        try {
            httpClient.close();
        } catch (IOException e) {
            logger.warn("Error closing HTTP client: " + e.getMessage());
        }
    }

    private void closeWebSocket() {
        WebSocket previous = webSocket;
        webSocket = null;
        listener = null;
        if (previous != null && !previous.isOutputClosed()) {
            previous.sendClose(WebSocket.NORMAL_CLOSURE, "reconnecting");
        }
    }

    private String formValue(Object value) throws JsonProcessingException {
        if (value == null) {
            return "";
        }
        if (value instanceof String || value instanceof Number || value instanceof Boolean) {
            return String.valueOf(value);
        }
        return objectMapper.writeValueAsString(value);
    }

    /**
     * Reassembles frames for one WebSocket connection into its event buffer.
     */
    private final class RtmListener implements WebSocket.Listener {
        private final RtmEventBuffer buffer = new RtmEventBuffer(objectMapper, logger);
        private final StringBuilder partial = new StringBuilder();

        @Override
        public CompletionStage<?> onText(WebSocket ws, CharSequence data, boolean last) {
            partial.append(data);
            if (last) {
                String frame = partial.toString();
                partial.setLength(0);
                buffer.enqueue(frame);
            }
            ws.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket ws, int statusCode, String reason) {
            buffer.fail(new IOException("RTM stream closed: " + statusCode + " " + reason));
            return null;
        }

        @Override
        public void onError(WebSocket ws, Throwable error) {
            buffer.fail(error);
        }
    }
}
