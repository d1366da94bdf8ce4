package com.actionlog.core.record;

import com.actionlog.core.model.LogRecord;
import com.actionlog.core.model.Severity;
import com.actionlog.core.template.TemplateFormatException;
import com.actionlog.core.template.TemplateResolver;
import java.time.Clock;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds {@link LogRecord}s from a template name and positional arguments.
 *
 * <p>Building never fails because of a template: when the arguments do not fit the format string
 * the raw format string becomes the message and the problem is attached as the
 * {@value #TEMPLATE_ERROR_FIELD} field.
 */
public final class LogRecordFactory {
    private static final Logger log = LoggerFactory.getLogger(LogRecordFactory.class);

    public static final String TEMPLATE_ERROR_FIELD = "template_error";

    private final TemplateResolver templates;
    private final Clock clock;

    public LogRecordFactory(TemplateResolver templates) {
        this(templates, Clock.systemUTC());
    }

    public LogRecordFactory(TemplateResolver templates, Clock clock) {
        this.templates = Objects.requireNonNull(templates, "templates");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public LogRecord buildLog(
            String classification, String templateName, Severity level, Map<String, Object> fields, Object... args) {
        String message;
        String templateError = null;
        try {
            message = templates.resolve(templateName, args);
        } catch (TemplateFormatException e) {
            log.warn("Template {} does not fit its {} argument(s): {}", templateName, args == null ? 0 : args.length, e.getMessage());
            message = e.format();
            templateError = e.getCause() != null ? e.getCause().toString() : e.getMessage();
        }
        String type = classification == null ? "" : classification.toUpperCase(Locale.ROOT);
        LogRecord record = new LogRecord(message, type, level, fields, clock.instant());
        if (templateError != null) record.addField(TEMPLATE_ERROR_FIELD, templateError);
        return record;
    }
}
