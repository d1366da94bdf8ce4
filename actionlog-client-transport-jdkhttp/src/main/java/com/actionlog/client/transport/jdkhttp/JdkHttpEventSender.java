package com.actionlog.client.transport.jdkhttp;

import com.actionlog.client.transport.EventSender;
import com.actionlog.client.transport.TransportSettings;
import com.actionlog.client.transport.UnexpectedStatusException;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Objects;

/** JDK11+ HttpClient sender (zero external deps). */
public class JdkHttpEventSender implements EventSender {
    private final TransportSettings settings;
    private final URI uri;
    private final HttpClient client;

    public JdkHttpEventSender(TransportSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.uri = URI.create(settings.endpoint());
        this.client = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(settings.timeout())
                .build();
    }

    @Override
    public String endpoint() {
        return settings.endpoint();
    }

    @Override
    public void send(byte[] body) throws IOException {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(settings.timeout())
                .header("Content-Type", CONTENT_TYPE_JSON)
                .POST(HttpRequest.BodyPublishers.ofByteArray(body));
        if (settings.hasCredentials()) {
            builder.header("Authorization", settings.basicAuthorization());
        }
        try {
            HttpResponse<String> resp = client.send(builder.build(), HttpResponse.BodyHandlers.ofString());
            if (!EventSender.isAccepted(resp.statusCode())) {
                throw new UnexpectedStatusException(resp.statusCode(), resp.body());
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IOException("interrupted", ie);
        }
    }
}
