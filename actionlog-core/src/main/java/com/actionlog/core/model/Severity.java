package com.actionlog.core.model;

import com.fasterxml.jackson.annotation.JsonValue;
import org.slf4j.event.Level;

/** Severity of a {@link LogRecord}; wire names match what Loki dashboards already query. */
public enum Severity {
    DEBUG("debug", Level.DEBUG),
    INFO("info", Level.INFO),
    WARN("warning", Level.WARN),
    ERROR("error", Level.ERROR);

    private final String wireName;
    private final Level slf4jLevel;

    Severity(String wireName, Level slf4jLevel) {
        this.wireName = wireName;
        this.slf4jLevel = slf4jLevel;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public Level slf4jLevel() {
        return slf4jLevel;
    }
}
