package com.actionlog.core.console;

import com.actionlog.core.model.LogRecord;

/** Writes a record to the local structured stream, synchronously on the caller's thread. */
@FunctionalInterface
public interface LocalEmitter {
    LocalEmitter NOOP = record -> {};

    void emit(LogRecord record);
}
