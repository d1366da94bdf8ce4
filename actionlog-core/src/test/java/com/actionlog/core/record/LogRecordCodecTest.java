package com.actionlog.core.record;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.actionlog.core.model.LogRecord;
import com.actionlog.core.model.Severity;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.Test;

class LogRecordCodecTest {
    private final LogRecordCodec codec = new LogRecordCodec();
    private final ObjectMapper om = new ObjectMapper();

    @Test
    void writes_record_shape() throws Exception {
        LogRecord record = new LogRecord(
                "Action event (call) recorded",
                "PHONE_ACTION",
                Severity.WARN,
                Map.of("customer_id", "c-9"),
                Instant.parse("2025-09-24T08:30:00Z"));

        JsonNode root = om.readTree(codec.toJson(record));

        assertThat(root.path("message").asText()).isEqualTo("Action event (call) recorded");
        assertThat(root.path("type").asText()).isEqualTo("PHONE_ACTION");
        assertThat(root.path("level").asText()).isEqualTo("warning");
        assertThat(root.path("timestamp").asText()).isEqualTo("2025-09-24T08:30:00Z");
        assertThat(root.path("additional_data").path("customer_id").asText()).isEqualTo("c-9");
        assertThat(root.has("error")).isFalse();
    }

    @Test
    void omits_empty_fields_and_includes_error() throws Exception {
        LogRecord record = new LogRecord("m", "T", Severity.ERROR, null, Instant.EPOCH);
        record.addError(new RuntimeException("nope"));

        JsonNode root = om.readTree(codec.toJson(record));

        assertThat(root.has("additional_data")).isFalse();
        assertThat(root.path("error").asText()).isEqualTo("nope");
    }

    @Test
    void unserializable_field_is_reported() {
        LogRecord record = new LogRecord("m", "T", Severity.INFO, null, Instant.EPOCH);
        record.addField("self", new SelfReferencing());

        assertThatThrownBy(() -> codec.toJson(record)).isInstanceOf(RecordSerializationException.class);
    }

    static final class SelfReferencing {
        public SelfReferencing getSelf() {
            return this;
        }
    }
}
