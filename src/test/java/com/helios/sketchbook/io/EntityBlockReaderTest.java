package com.helios.sketchbook.io;

import com.helios.sketchbook.core.error.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Entity block reader")
class EntityBlockReaderTest {

    private EntityBlockReader reader;

    @BeforeEach
    void setUp() {
        reader = new EntityBlockReader();
    }

    @Test
    @DisplayName("Entities are grouped by type and sorted by id")
    void testGroupingAndOrder() {
        reader.accept("#!variable: B: #`{\"id\": \"B\"}`#");
        reader.accept("#!variable: A: #`{\"id\": \"A\"}`#");
        reader.accept("#!dataset: d1: plain");

        assertThat(reader.entities("variable")).containsOnlyKeys("A", "B");
        assertThat(reader.entities("variable").firstKey()).isEqualTo("A");
        assertThat(reader.entities("variable").get("B")).isEqualTo("{\"id\": \"B\"}");
        assertThat(reader.entities("dataset")).containsEntry("d1", "plain");
        assertThat(reader.entities("missing")).isEmpty();
        assertThat(reader.allEntities()).containsOnlyKeys("variable", "dataset");
    }

    @Test
    @DisplayName("Formatted blocks are accepted back")
    void testFormatBlock() {
        String block = EntityBlockReader.formatBlock("sketch", "annotation", "\"text: with colon\"");

        assertThat(block).isEqualTo("#!sketch: annotation: #`\"text: with colon\"`#");
        assertThat(EntityBlockReader.isEntityBlock(block)).isTrue();
        reader.accept(block);
        assertThat(reader.entities("sketch")).containsEntry("annotation", "\"text: with colon\"");
    }

    @Test
    @DisplayName("The same id may not appear twice for a type")
    void testDuplicate() {
        reader.accept("#!variable: A: #`{}`#");
        reader.accept("#!dataset: A: #`{}`#");

        assertThatThrownBy(() -> reader.accept("#!variable: A: #`{\"name\": \"x\"}`#"))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Duplicate entity 'variable:A'");
    }

    @ParameterizedTest
    @ValueSource(strings = {"#!variable", "#!variable: 1A: x", "#! : A: x"})
    @DisplayName("Malformed headers are rejected")
    void testMalformed(String line) {
        assertThatThrownBy(() -> reader.accept(line))
                .isInstanceOf(ValidationException.class)
                .hasMessageStartingWith("Malformed entity block");
    }

    @Test
    @DisplayName("Nested, empty and unterminated values are rejected")
    void testInvalidValues() {
        assertThatThrownBy(() -> reader.accept("#!variable: A: name: #`x`#"))
                .hasMessageContaining("nested value");
        assertThatThrownBy(() -> reader.accept("#!variable: A: #` `#"))
                .hasMessageContaining("empty value");
        assertThatThrownBy(() -> reader.accept("#!variable: A:"))
                .hasMessageContaining("empty value");
        assertThatThrownBy(() -> reader.accept("#!variable: A: #`{\"id\": \"A\"}"))
                .hasMessageContaining("Unterminated value");
    }
}
