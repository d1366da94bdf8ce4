package com.actionlog.core.loki;

import com.actionlog.client.transport.TransportSettings;
import java.time.Duration;
import java.util.function.UnaryOperator;

/**
 * Loki push configuration. Each key is read from a system property first, then from the
 * environment:
 *
 * <ul>
 *   <li>{@code actionlog.loki.enabled} / {@code LOKI_ENABLED} (default false)
 *   <li>{@code actionlog.loki.push-url} / {@code LOKI_PUSH_URL}
 *   <li>{@code actionlog.loki.username} / {@code LOKI_USERNAME}
 *   <li>{@code actionlog.loki.password} / {@code LOKI_PASSWORD}
 *   <li>{@code actionlog.loki.job} / {@code LOKI_JOB}
 *   <li>{@code actionlog.loki.timeout-ms} / {@code LOKI_TIMEOUT_MS} (default 10000)
 * </ul>
 */
public record LokiSettings(
        boolean enabled, String pushUrl, String username, String password, String job, Duration timeout) {

    public static final String PROP_ENABLED = "actionlog.loki.enabled";
    public static final String PROP_PUSH_URL = "actionlog.loki.push-url";
    public static final String PROP_USERNAME = "actionlog.loki.username";
    public static final String PROP_PASSWORD = "actionlog.loki.password";
    public static final String PROP_JOB = "actionlog.loki.job";
    public static final String PROP_TIMEOUT_MS = "actionlog.loki.timeout-ms";

    public static final String ENV_ENABLED = "LOKI_ENABLED";
    public static final String ENV_PUSH_URL = "LOKI_PUSH_URL";
    public static final String ENV_USERNAME = "LOKI_USERNAME";
    public static final String ENV_PASSWORD = "LOKI_PASSWORD";
    public static final String ENV_JOB = "LOKI_JOB";
    public static final String ENV_TIMEOUT_MS = "LOKI_TIMEOUT_MS";

    public LokiSettings {
        pushUrl = pushUrl == null ? "" : pushUrl.trim();
        username = username == null ? "" : username;
        password = password == null ? "" : password;
        job = job == null ? "" : job;
        timeout = timeout == null ? TransportSettings.DEFAULT_TIMEOUT : timeout;
    }

    public static LokiSettings disabled() {
        return new LokiSettings(false, "", "", "", "", TransportSettings.DEFAULT_TIMEOUT);
    }

    public static LokiSettings fromEnvironment() {
        return fromEnvironment(System::getProperty, System::getenv);
    }

    static LokiSettings fromEnvironment(UnaryOperator<String> properties, UnaryOperator<String> env) {
        Lookup lookup = new Lookup(properties, env);
        return new LokiSettings(
                parseBool(lookup.get(PROP_ENABLED, ENV_ENABLED)),
                lookup.get(PROP_PUSH_URL, ENV_PUSH_URL),
                lookup.get(PROP_USERNAME, ENV_USERNAME),
                lookup.get(PROP_PASSWORD, ENV_PASSWORD),
                lookup.get(PROP_JOB, ENV_JOB),
                parseTimeout(lookup.get(PROP_TIMEOUT_MS, ENV_TIMEOUT_MS)));
    }

    /** True when pushes would actually leave the process. */
    public boolean active() {
        return enabled && !pushUrl.isEmpty();
    }

    public TransportSettings transport() {
        return new TransportSettings(pushUrl, username, password, timeout);
    }

    /** Accepts the spellings {@code 1 t T TRUE true True} and their false counterparts; anything else is false. */
    static boolean parseBool(String value) {
        if (value == null) return false;
        switch (value) {
            case "1":
            case "t":
            case "T":
            case "TRUE":
            case "true":
            case "True":
                return true;
            default:
                return false;
        }
    }

    static Duration parseTimeout(String value) {
        if (value == null || value.isBlank()) return TransportSettings.DEFAULT_TIMEOUT;
        try {
            long ms = Long.parseLong(value.trim());
            return ms > 0 ? Duration.ofMillis(ms) : TransportSettings.DEFAULT_TIMEOUT;
        } catch (NumberFormatException e) {
            return TransportSettings.DEFAULT_TIMEOUT;
        }
    }

    @Override
    public String toString() {
        return "LokiSettings[enabled=" + enabled + ", pushUrl=" + pushUrl + ", username=" + username + ", job=" + job
                + ", timeout=" + timeout + "]";
    }

    private static final class Lookup {
        private final UnaryOperator<String> properties;
        private final UnaryOperator<String> env;

        Lookup(UnaryOperator<String> properties, UnaryOperator<String> env) {
            this.properties = properties;
            this.env = env;
        }

        String get(String property, String variable) {
            String sys = properties.apply(property);
            if (sys != null && !sys.isBlank()) return sys;
            String value = env.apply(variable);
            return value == null ? "" : value;
        }
    }
}
