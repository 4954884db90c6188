package com.ryuqq.statetree.core.model;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Entry record tests.
 *
 * @author StateTree Team
 * @since 1.0.0
 */
class EntryTest {

    @Test
    void of_RecordWithKey_KeepsAllFields() {
        // When
        Entry entry = Entry.of(Map.of("key", "console", "val", "true", "value", true));

        // Then
        assertThat(entry.key()).isEqualTo("console");
        assertThat(entry.get("val")).isEqualTo("true");
        assertThat(entry.get("value")).isEqualTo(true);
        assertThat(entry.fields()).containsEntry("key", "console");
    }

    @Test
    void of_MissingKey_ThrowsException() {
        assertThatThrownBy(() -> Entry.of(Map.of("val", "true")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("key must be a string");
    }

    @Test
    void constructor_MismatchedKeyField_ThrowsException() {
        assertThatThrownBy(() -> new Entry("a", Map.of("key", "b")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("does not match");
    }

    @Test
    void fields_AreDetachedFromSource() {
        // Given
        Map<String, Object> source = new LinkedHashMap<>();
        source.put("key", "console");
        source.put("val", "true");
        Entry entry = Entry.of(source);

        // When
        source.put("val", "false");

        // Then
        assertThat(entry.get("val")).isEqualTo("true");
        assertThatThrownBy(() -> entry.fields().put("val", "x"))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void contentEquals_ComparesStructurally() {
        Entry a = Entry.of(Map.of("key", "n", "value", 30));
        Entry b = Entry.of(Map.of("key", "n", "value", 30L));
        Entry c = Entry.of(Map.of("key", "n", "value", 31));

        assertThat(a.contentEquals(b)).isTrue();
        assertThat(a.contentEquals(c)).isFalse();
        assertThat(a.contentEquals(null)).isFalse();
    }
}
