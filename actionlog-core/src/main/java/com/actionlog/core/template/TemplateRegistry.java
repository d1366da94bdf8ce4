package com.actionlog.core.template;

import java.util.IllegalFormatException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Name to format-string mapping with case-insensitive lookup.
 *
 * <p>Populate at startup, then {@link #freeze()} before the dispatch worker begins; the frozen view
 * is immutable and safe to share between producer threads. The registry itself is not
 * synchronized.
 */
public final class TemplateRegistry implements TemplateResolver {
    private final Map<String, String> templates = new LinkedHashMap<>();
    private boolean frozen;

    /** Stores {@code format} under the upper-cased {@code name}; a later call for the same name wins. */
    public TemplateRegistry addTemplate(String name, String format) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(format, "format");
        if (frozen) throw new IllegalStateException("Template registry is frozen; cannot add " + name);
        templates.put(key(name), format);
        return this;
    }

    public TemplateRegistry loadDefaults() {
        addTemplate("GenericError", "An error occurred: %s");
        addTemplate("UnexpectedError", "Unexpected error: %s");
        addTemplate("UnhandledException", "Unhandled exception: %s");
        return this;
    }

    @Override
    public Optional<String> lookup(String name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(templates.get(key(name)));
    }

    public int size() {
        return templates.size();
    }

    public boolean isFrozen() {
        return frozen;
    }

    /** Stops further registrations and returns an immutable snapshot. */
    public TemplateResolver freeze() {
        frozen = true;
        return new Snapshot(Map.copyOf(templates));
    }

    static String format(String format, Object... args) {
        if (format == null) return "";
        try {
            return String.format(Locale.ROOT, format, args);
        } catch (IllegalFormatException e) {
            throw new TemplateFormatException(format, e);
        }
    }

    private static String key(String name) {
        return name.toUpperCase(Locale.ROOT);
    }

    private static final class Snapshot implements TemplateResolver {
        private final Map<String, String> templates;

        Snapshot(Map<String, String> templates) {
            this.templates = templates;
        }

        @Override
        public Optional<String> lookup(String name) {
            if (name == null) return Optional.empty();
            return Optional.ofNullable(templates.get(key(name)));
        }

        @Override
        public String toString() {
            return "TemplateResolver" + templates.keySet();
        }
    }
}
