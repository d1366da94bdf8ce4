package com.actionlog.client.transport;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.Objects;

/**
 * Connection settings shared by every {@link EventSender} implementation.
 *
 * @param endpoint absolute push URL
 * @param username basic-auth user, may be blank
 * @param password basic-auth password, may be blank
 * @param timeout upper bound for one request, connect through response
 */
public record TransportSettings(String endpoint, String username, String password, Duration timeout) {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    public TransportSettings {
        Objects.requireNonNull(endpoint, "endpoint");
        username = username == null ? "" : username;
        password = password == null ? "" : password;
        timeout = timeout == null ? DEFAULT_TIMEOUT : timeout;
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be > 0");
        }
    }

    public static TransportSettings of(String endpoint) {
        return new TransportSettings(endpoint, "", "", DEFAULT_TIMEOUT);
    }

    /** Credentials are only sent when both parts are present. */
    public boolean hasCredentials() {
        return !username.isEmpty() && !password.isEmpty();
    }

    /** Value for the {@code Authorization} header, or {@code null} without credentials. */
    public String basicAuthorization() {
        if (!hasCredentials()) return null;
        String token = username + ":" + password;
        return "Basic " + Base64.getEncoder().encodeToString(token.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public String toString() {
        return "TransportSettings[endpoint=" + endpoint + ", username=" + username + ", password="
                + (password.isEmpty() ? "" : "****") + ", timeout=" + timeout + "]";
    }
}
