package com.actionlog.core.record;

/** A {@link com.actionlog.core.model.LogRecord} could not be turned into its JSON line. */
public class RecordSerializationException extends Exception {
    public RecordSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
