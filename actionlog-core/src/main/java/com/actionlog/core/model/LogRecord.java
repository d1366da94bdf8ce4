package com.actionlog.core.model;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One timestamped log event ready for emission.
 *
 * <p>Message, type, level and timestamp are fixed at creation. Additional fields and the optional
 * error text can still be appended afterwards. Instances are not thread-safe: a record belongs to
 * the producing thread until it is handed to the dispatcher, and to the dispatch worker after that.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonAutoDetect(
        fieldVisibility = JsonAutoDetect.Visibility.NONE,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
@JsonPropertyOrder({"message", "error", "type", "level", "additional_data", "timestamp"})
public final class LogRecord {
    private final String message;
    private final String type;
    private final Severity level;
    private final Instant timestamp;
    private Map<String, Object> additionalData; // allocated on first addField
    private String error;

    public LogRecord(String message, String type, Severity level, Map<String, Object> fields, Instant timestamp) {
        this.message = message == null ? "" : message;
        this.type = type == null ? "" : type;
        this.level = Objects.requireNonNull(level, "level");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.additionalData = fields == null ? null : new LinkedHashMap<>(fields);
    }

    @JsonProperty("message")
    public String message() {
        return message;
    }

    /** Classification tag, upper-cased; also the {@code type} label of the Loki stream. */
    @JsonProperty("type")
    public String type() {
        return type;
    }

    @JsonProperty("level")
    public Severity level() {
        return level;
    }

    @JsonProperty("timestamp")
    public Instant timestamp() {
        return timestamp;
    }

    @JsonProperty("additional_data")
    public Map<String, Object> fields() {
        return additionalData == null ? Map.of() : Collections.unmodifiableMap(additionalData);
    }

    @JsonProperty("error")
    public String error() {
        return error;
    }

    public LogRecord addField(String key, Object value) {
        Objects.requireNonNull(key, "key");
        if (additionalData == null) additionalData = new LinkedHashMap<>();
        additionalData.put(key, value);
        return this;
    }

    public LogRecord addError(Throwable t) {
        this.error = t == null ? null : String.valueOf(t.getMessage() != null ? t.getMessage() : t);
        return this;
    }

    @Override
    public String toString() {
        return "LogRecord[" + level + " " + type + " '" + message + "' at " + timestamp + "]";
    }
}
