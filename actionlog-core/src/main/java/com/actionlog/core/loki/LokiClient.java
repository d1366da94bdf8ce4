package com.actionlog.core.loki;

import com.actionlog.client.transport.EventSender;
import com.actionlog.client.transport.UnexpectedStatusException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pushes single log lines to Loki through an {@link EventSender}. A disabled client, or one without
 * a push URL, accepts every push without touching the network.
 */
public final class LokiClient implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(LokiClient.class);

    private final LokiSettings settings;
    private final EventSender sender;
    private final ObjectMapper json;

    public LokiClient(LokiSettings settings, EventSender sender) {
        this(settings, sender, new ObjectMapper());
    }

    public LokiClient(LokiSettings settings, EventSender sender, ObjectMapper json) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.sender = settings.active() ? Objects.requireNonNull(sender, "sender") : sender;
        this.json = Objects.requireNonNull(json, "json");
    }

    public boolean enabled() {
        return settings.enabled();
    }

    public String job() {
        return settings.job();
    }

    public void push(Map<String, String> labels, Instant timestamp, String line) throws LokiPushException {
        if (!settings.active()) return;

        byte[] body;
        try {
            body = json.writeValueAsBytes(LokiPushRequest.of(labels, timestamp, line));
        } catch (JsonProcessingException e) {
            throw new LokiPushException("failed to marshal Loki payload", e);
        }

        try {
            sender.send(body);
        } catch (UnexpectedStatusException e) {
            throw new LokiPushException("unexpected response from Loki: " + e.status(), e);
        } catch (IOException e) {
            throw new LokiPushException("failed to send request to Loki at " + settings.pushUrl(), e);
        } catch (IllegalArgumentException e) {
            // transports reject a malformed push URL only when building the request
            throw new LokiPushException("failed to create request for Loki at " + settings.pushUrl(), e);
        }
        log.trace("Pushed {} bytes to {}", body.length, settings.pushUrl());
    }

    @Override
    public void close() throws IOException {
        if (sender != null) sender.close();
    }
}
