package com.actionlog.core.loki;

/** A push to Loki did not go through; the record is not retried. */
public class LokiPushException extends Exception {
    public LokiPushException(String message, Throwable cause) {
        super(message, cause);
    }
}
