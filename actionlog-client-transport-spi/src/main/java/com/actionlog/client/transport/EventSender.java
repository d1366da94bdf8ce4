package com.actionlog.client.transport;

import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Minimal transport SPI: POST serialized JSON payloads to a push endpoint.
 *
 * <p>Implementations take the target URL, optional basic-auth credentials and the request timeout
 * from {@link TransportSettings}. A response other than {@link #isAccepted(int) accepted} is
 * reported as {@link UnexpectedStatusException}; connection problems surface as plain
 * {@link IOException}.
 */
public interface EventSender extends Closeable {
    String CONTENT_TYPE_JSON = "application/json";

    void send(byte[] body) throws IOException;

    /** The endpoint this sender posts to. */
    String endpoint();

    @Override
    default void close() throws IOException {
        /* no-op */
    }

    /** Loki answers 204 on success; some proxies in front of it answer 200. */
    static boolean isAccepted(int status) {
        return status == 200 || status == 204;
    }

    static byte[] requireBytes(String s) {
        return Objects.requireNonNull(s, "payload").getBytes(StandardCharsets.UTF_8);
    }
}
