package com.actionlog.core.record;

import com.actionlog.core.model.LogRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/** JSON line form of a {@link LogRecord}, as stored in the Loki stream value. */
public final class LogRecordCodec {
    private final ObjectMapper json;

    public LogRecordCodec() {
        this(defaultMapper());
    }

    public LogRecordCodec(ObjectMapper json) {
        this.json = json;
    }

    public static ObjectMapper defaultMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    }

    public String toJson(LogRecord record) throws RecordSerializationException {
        try {
            return json.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new RecordSerializationException("Error serializing log " + record, e);
        }
    }
}
