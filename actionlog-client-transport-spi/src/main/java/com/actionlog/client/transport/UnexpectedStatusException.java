package com.actionlog.client.transport;

import java.io.IOException;

/** The push endpoint answered, but not with a success status. */
public class UnexpectedStatusException extends IOException {
    private final int status;

    public UnexpectedStatusException(int status, String responseBody) {
        super("HTTP " + status + (responseBody == null || responseBody.isBlank() ? "" : " - " + responseBody));
        this.status = status;
    }

    public int status() {
        return status;
    }
}
