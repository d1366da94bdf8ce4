package com.actionlog.client.transport.jdkhttp;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.actionlog.client.transport.EventSender;
import com.actionlog.client.transport.TransportSettings;
import com.actionlog.client.transport.UnexpectedStatusException;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JdkHttpEventSenderTest {
    private HttpServer server;
    private final AtomicInteger status = new AtomicInteger(204);
    private final List<String> authHeaders = new CopyOnWriteArrayList<>();
    private final List<String> contentTypes = new CopyOnWriteArrayList<>();

    @BeforeEach
    void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/push", exchange -> {
            exchange.getRequestBody().readAllBytes();
            authHeaders.add(String.valueOf(exchange.getRequestHeaders().getFirst("Authorization")));
            contentTypes.add(String.valueOf(exchange.getRequestHeaders().getFirst("Content-Type")));
            byte[] reply = "nope".getBytes(StandardCharsets.UTF_8);
            if (status.get() == 204) {
                exchange.sendResponseHeaders(204, -1);
                exchange.close();
                return;
            }
            exchange.sendResponseHeaders(status.get(), reply.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(reply);
            }
        });
        server.start();
    }

    @AfterEach
    void stop() {
        server.stop(0);
    }

    private String url() {
        return "http://127.0.0.1:" + server.getAddress().getPort() + "/push";
    }

    @Test
    void posts_json_with_basic_auth() throws Exception {
        var sender = new JdkHttpEventSender(new TransportSettings(url(), "u", "p", Duration.ofSeconds(2)));

        sender.send(EventSender.requireBytes("{}"));

        assertThat(contentTypes).containsExactly("application/json");
        assertThat(authHeaders).containsExactly("Basic dTpw");
    }

    @Test
    void ok_is_accepted_too() throws Exception {
        status.set(200);
        var sender = new JdkHttpEventSender(TransportSettings.of(url()));

        sender.send(EventSender.requireBytes("{}"));

        assertThat(authHeaders).containsExactly("null");
    }

    @Test
    void server_error_is_reported_with_body() {
        status.set(500);
        var sender = new JdkHttpEventSender(TransportSettings.of(url()));

        assertThatThrownBy(() -> sender.send(EventSender.requireBytes("{}")))
                .isInstanceOf(UnexpectedStatusException.class)
                .hasMessage("HTTP 500 - nope");
    }

    @Test
    void unreachable_endpoint_fails_with_io_error() throws IOException {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }
        var sender = new JdkHttpEventSender(TransportSettings.of("http://127.0.0.1:" + port + "/push"));

        assertThatThrownBy(() -> sender.send(EventSender.requireBytes("{}")))
                .isInstanceOf(IOException.class)
                .isNotInstanceOf(UnexpectedStatusException.class);
    }
}
