package com.actionlog.core.template;

/** A message template could not be rendered with the supplied arguments. */
public class TemplateFormatException extends IllegalArgumentException {
    private final String format;

    public TemplateFormatException(String format, Throwable cause) {
        super("Cannot render template '" + format + "': " + cause.getMessage(), cause);
        this.format = format;
    }

    public String format() {
        return format;
    }
}
