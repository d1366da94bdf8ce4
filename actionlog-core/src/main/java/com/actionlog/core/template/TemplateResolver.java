package com.actionlog.core.template;

import java.util.Optional;

/** Read side of the template registry. */
public interface TemplateResolver {

    /** Format string registered under {@code name}, compared case-insensitively. */
    Optional<String> lookup(String name);

    /**
     * Renders the template registered under {@code name} with positional {@link String#format}
     * arguments. An unknown name is used as the format string itself.
     *
     * @throws TemplateFormatException if the format string and the arguments do not fit together
     */
    default String resolve(String name, Object... args) {
        String format = lookup(name).orElse(name);
        return TemplateRegistry.format(format, args);
    }
}
