package com.actionlog.client.transport.okhttp;

import com.actionlog.client.transport.EventSender;
import com.actionlog.client.transport.TransportSettings;
import com.actionlog.client.transport.UnexpectedStatusException;
import java.io.IOException;
import java.util.Objects;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** OkHttp-based sender; the default transport for Loki pushes. */
public class OkHttpEventSender implements EventSender {
    private static final Logger log = LoggerFactory.getLogger(OkHttpEventSender.class);
    private static final MediaType JSON = MediaType.parse(CONTENT_TYPE_JSON);

    private final TransportSettings settings;
    private final OkHttpClient client;

    public OkHttpEventSender(TransportSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.client = new OkHttpClient.Builder()
                .callTimeout(settings.timeout())
                .retryOnConnectionFailure(false)
                .build();
    }

    @Override
    public String endpoint() {
        return settings.endpoint();
    }

    @Override
    public void send(byte[] body) throws IOException {
        Request.Builder builder = new Request.Builder()
                .url(settings.endpoint())
                .post(RequestBody.create(body, JSON));
        if (settings.hasCredentials()) {
            builder.header("Authorization", settings.basicAuthorization());
        }
        Request req = builder.build();
        try (Response r = client.newCall(req).execute()) {
            if (!EventSender.isAccepted(r.code())) {
                String responseBody = r.body() != null ? r.body().string() : "";
                log.debug("Push {} {} rejected with status {} and body: {}", req.method(), endpoint(), r.code(), responseBody);
                throw new UnexpectedStatusException(r.code(), responseBody);
            }
            if (log.isTraceEnabled()) {
                log.trace("Push {} {} accepted with status {}", req.method(), endpoint(), r.code());
            }
        }
    }

    @Override
    public void close() {
        client.dispatcher().executorService().shutdown();
        client.connectionPool().evictAll();
    }
}
