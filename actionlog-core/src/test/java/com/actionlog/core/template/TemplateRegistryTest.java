package com.actionlog.core.template;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Locale;
import org.junit.jupiter.api.Test;

class TemplateRegistryTest {

    @Test
    void lookup_ignores_case() {
        TemplateRegistry registry = new TemplateRegistry().addTemplate("foo", "value is %s");

        assertThat(registry.lookup("FOO")).contains("value is %s");
        assertThat(registry.lookup("Foo")).contains("value is %s");
        assertThat(registry.lookup("foo")).contains("value is %s");
        assertThat(registry.resolve("fOo", 7)).isEqualTo("value is 7");
    }

    @Test
    void later_registration_wins_across_casing() {
        TemplateRegistry registry = new TemplateRegistry()
                .addTemplate("Greeting", "hello %s")
                .addTemplate("GREETING", "hi %s");

        assertThat(registry.size()).isEqualTo(1);
        assertThat(registry.resolve("greeting", "bob")).isEqualTo("hi bob");
    }

    @Test
    void unknown_name_is_used_as_format_string() {
        TemplateRegistry registry = new TemplateRegistry().loadDefaults();

        assertThat(registry.resolve("X_UNKNOWN", 1, 2)).isEqualTo(String.format(Locale.ROOT, "X_UNKNOWN", 1, 2));
        assertThat(registry.resolve("Action event (%s) recorded for customer %s", "call_started", "c-1"))
                .isEqualTo("Action event (call_started) recorded for customer c-1");
    }

    @Test
    void defaults_are_registered() {
        TemplateRegistry registry = new TemplateRegistry().loadDefaults();

        assertThat(registry.resolve("genericerror", "disk full")).isEqualTo("An error occurred: disk full");
        assertThat(registry.resolve("UnexpectedError", "x")).isEqualTo("Unexpected error: x");
        assertThat(registry.resolve("UNHANDLEDEXCEPTION", "npe")).isEqualTo("Unhandled exception: npe");
    }

    @Test
    void missing_argument_is_reported() {
        TemplateRegistry registry = new TemplateRegistry().addTemplate("pair", "%s and %s");

        assertThatThrownBy(() -> registry.resolve("pair", "one"))
                .isInstanceOf(TemplateFormatException.class)
                .satisfies(e -> assertThat(((TemplateFormatException) e).format()).isEqualTo("%s and %s"));
    }

    @Test
    void surplus_arguments_are_ignored() {
        TemplateRegistry registry = new TemplateRegistry().addTemplate("one", "only %s");

        assertThat(registry.resolve("one", "a", "b")).isEqualTo("only a");
    }

    @Test
    void frozen_registry_rejects_writes_and_snapshot_keeps_entries() {
        TemplateRegistry registry = new TemplateRegistry().addTemplate("a", "A=%d");
        TemplateResolver frozen = registry.freeze();

        assertThat(registry.isFrozen()).isTrue();
        assertThatThrownBy(() -> registry.addTemplate("b", "B")).isInstanceOf(IllegalStateException.class);
        assertThat(frozen.resolve("A", 3)).isEqualTo("A=3");
        assertThat(frozen.lookup("b")).isEmpty();
    }
}
