package org.neuralchilli.juglans.core;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CollectionFunctionsTest {

    private final CollectionFunctions fn = new CollectionFunctions();

    @Test
    void shouldMeasureLength() {
        assertThat(fn.len(List.of(1, 2, 3))).isEqualTo(3);
        assertThat(fn.len(Map.of("a", 1))).isEqualTo(1);
        assertThat(fn.len("abcd")).isEqualTo(4);
        assertThat(fn.len(null)).isZero();
    }

    @Test
    void shouldCompareNumbersLoosely() {
        assertThat(fn.contains(List.of(1, 2), 2.0)).isTrue();
        assertThat(fn.contains("refund request", "refund")).isTrue();
        assertThat(fn.contains(Map.of("sku", "a"), "sku")).isTrue();
        assertThat(fn.contains(null, "x")).isFalse();
    }

    @Test
    void shouldPluckAndFilterByField() {
        List<Object> items = List.of(
                Map.of("sku", "a", "active", true),
                Map.of("sku", "b", "active", false));

        assertThat(fn.map(items, "sku")).containsExactly("a", "b");
        assertThat(fn.filter(items, "active")).hasSize(1);
        assertThat(fn.filter(items, "sku", "b")).containsExactly(items.get(1));
    }

    @Test
    void shouldBuildNewLists() {
        List<Object> original = List.of("a");

        assertThat(fn.append(original, "b")).containsExactly("a", "b");
        assertThat(fn.append(null, "x")).containsExactly("x");
        assertThat(original).containsExactly("a");
        assertThat(fn.first(List.of(1, 2))).isEqualTo(1);
        assertThat(fn.last(List.of(1, 2))).isEqualTo(2);
        assertThat(fn.first(List.of())).isNull();
        assertThat(fn.join(List.of("a", "b"), "-")).isEqualTo("a-b");
    }

    @Test
    void shouldConvertJson() {
        assertThat(fn.json(Map.of("a", 1))).isEqualTo("{\"a\":1}");
        assertThat(fn.parse("[1,2]")).isEqualTo(List.of(1L, 2L));
        assertThat(fn.parse("plain")).isEqualTo("plain");
    }
}
