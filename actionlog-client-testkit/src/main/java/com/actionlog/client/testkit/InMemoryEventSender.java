package com.actionlog.client.testkit;

import com.actionlog.client.transport.EventSender;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/** Test double that records payloads in memory. */
public class InMemoryEventSender implements EventSender {
    private final List<byte[]> payloads = new ArrayList<>();
    private final String endpoint;

    public InMemoryEventSender() {
        this("memory://loki/push");
    }

    public InMemoryEventSender(String endpoint) {
        this.endpoint = endpoint;
    }

    @Override
    public synchronized void send(byte[] body) throws IOException {
        payloads.add(body);
    }

    @Override
    public String endpoint() {
        return endpoint;
    }

    public synchronized List<byte[]> payloads() {
        return List.copyOf(payloads);
    }

    public synchronized List<String> payloadsAsText() {
        List<String> out = new ArrayList<>(payloads.size());
        for (byte[] p : payloads) out.add(new String(p, StandardCharsets.UTF_8));
        return out;
    }
}
