package org.neuralchilli.juglans.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StringFunctionsTest {

    private final StringFunctions strings = new StringFunctions();

    @Test
    void shouldSlugify() {
        assertThat(strings.slugify("Customer Support Agent")).isEqualTo("customer-support-agent");
        assertThat(strings.slugify("  Hello, World!  ")).isEqualTo("hello-world");
        assertThat(strings.slugify("--a -- b--")).isEqualTo("a-b");
        assertThat(strings.slugify(null)).isEmpty();
    }

    @Test
    void shouldTruncateWithEllipsis() {
        assertThat(strings.truncate("short", 10)).isEqualTo("short");
        assertThat(strings.truncate("a longer sentence", 8)).isEqualTo("a lon...");
        assertThat(strings.truncate("abcdef", 2)).isEqualTo("ab");
        assertThat(strings.truncate("abc", 0)).isEmpty();
    }

    @Test
    void shouldStripCodeFences() {
        assertThat(strings.stripCodeFences("```json\n{\"a\": 1}\n```")).isEqualTo("{\"a\": 1}");
        assertThat(strings.stripCodeFences("```\nplain\n```")).isEqualTo("plain");
        assertThat(strings.stripCodeFences("  no fence ")).isEqualTo("no fence");
    }

    @Test
    void shouldGenerateDistinctUuids() {
        assertThat(strings.uuid()).isNotEqualTo(strings.uuid());
        assertThat(strings.isBlank("  ")).isTrue();
        assertThat(strings.isBlank("x")).isFalse();
    }
}
