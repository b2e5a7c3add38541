package com.helios.sketchbook.io;

import com.helios.sketchbook.core.error.ValidationException;
import com.helios.sketchbook.model.Sketch;
import com.helios.sketchbook.model.ids.DynPropertyId;
import com.helios.sketchbook.model.ids.VarId;
import com.helios.sketchbook.model.network.Essentiality;
import com.helios.sketchbook.model.network.ModelState;
import com.helios.sketchbook.model.network.Monotonicity;
import com.helios.sketchbook.model.network.NodePosition;
import com.helios.sketchbook.model.network.Regulation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("AEON sketch format")
class AeonSketchFormatTest {

    private static final VarId A = VarId.of("A");
    private static final VarId B = VarId.of("B");

    private AeonSketchFormat format;

    @BeforeEach
    void setUp() {
        format = new AeonSketchFormat();
    }

    @Test
    @DisplayName("Should parse the model part of the reference sketch")
    void shouldParseReferenceModel() throws Exception {
        Sketch sketch = format.read(SketchJsonFormatTest.fixture("reference_sketch.aeon"));
        ModelState model = sketch.model();

        assertThat(model.variableIds()).containsExactly(A, B);
        assertThat(model.getVariable(B).annotation()).isEqualTo("Follows A");
        assertThat(model.regulations()).containsExactly(
                new Regulation(A, A, Monotonicity.UNKNOWN, Essentiality.UNKNOWN),
                new Regulation(B, A, Monotonicity.UNKNOWN, Essentiality.UNKNOWN),
                new Regulation(A, B, Monotonicity.ACTIVATION, Essentiality.TRUE));
        assertThat(model.position(B)).contains(new NodePosition(100.0, 50.0));
        assertThat(model.updateFunction(B).orElseThrow().asText()).isEqualTo("A");
        assertThat(sketch.properties().getDynamic(DynPropertyId.of("steady_fixed_points")).getName())
                .isEqualTo("Steady states are fixed points");
        assertThat(sketch.annotation()).isEqualTo("Two-variable reference sketch");
    }

    static Stream<Arguments> regulationLines() {
        return Stream.of(
                Arguments.of("A -> B", Monotonicity.ACTIVATION, Essentiality.TRUE),
                Arguments.of("A -| B", Monotonicity.INHIBITION, Essentiality.TRUE),
                Arguments.of("A -*? B", Monotonicity.DUAL, Essentiality.UNKNOWN),
                Arguments.of("A -|! B", Monotonicity.INHIBITION, Essentiality.FALSE),
                Arguments.of("  A -?   B  ", Monotonicity.UNKNOWN, Essentiality.TRUE)
        );
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("regulationLines")
    @DisplayName("Should read the arrow and suffix of a regulation")
    void shouldParseRegulation(String line, Monotonicity monotonicity, Essentiality essentiality) {
        ModelState model = format.read(line).model();

        assertThat(model.getRegulation(A, B))
                .contains(new Regulation(A, B, monotonicity, essentiality));
    }

    @Test
    @DisplayName("Should collect variables from every kind of line, sorted")
    void shouldCollectVariables() {
        String text = String.join("\n",
                "# a comment",
                "#position:Z:1,2",
                "C -> A",
                "C -| B",
                "$B: !C",
                "",
                "#!variable: D: #`{\"annotation\": \"only declared\"}`#");

        ModelState model = format.read(text).model();

        assertThat(model.variableIds()).extracting(VarId::asStr).containsExactly("A", "B", "C", "D", "Z");
        assertThat(model.getVariable(VarId.of("D")).annotation()).isEqualTo("only declared");
    }

    @Test
    @DisplayName("Should write text that reads back to the same sketch")
    void shouldRoundTrip() throws Exception {
        Sketch sketch = format.read(SketchJsonFormatTest.fixture("reference_sketch.aeon"));

        String written = format.write(sketch);

        assertThat(written)
                .contains("A -?? A")
                .contains("A -> B")
                .contains("$B: A")
                .contains("#position:B:100.0,50.0");
        assertThat(format.read(written)).isEqualTo(sketch);
    }

    @Test
    @DisplayName("Should report the line that cannot be parsed")
    void shouldRejectUnknownLine() {
        assertThatThrownBy(() -> format.read("A -> B\nA => B"))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Line 2: cannot parse 'A => B'");
    }

    @Test
    @DisplayName("Should reject a second update function for the same variable")
    void shouldRejectDuplicateUpdateFunction() {
        assertThatThrownBy(() -> format.read("$A: B\n$A: !B"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("duplicate update function of 'A'");
    }

    @Test
    @DisplayName("Should reject entity values whose id differs from the block")
    void shouldRejectMismatchedEntityId() {
        assertThatThrownBy(() -> format.read("#!variable: A: #`{\"id\": \"B\"}`#"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("declares a different id 'B'");
    }

    @Test
    @DisplayName("Should reject invalid entity JSON")
    void shouldRejectInvalidEntityJson() {
        assertThatThrownBy(() -> format.read("#!dataset: d: #`{\"variables\": `#"))
                .isInstanceOf(ValidationException.class)
                .hasMessageStartingWith("Invalid JSON in entity 'dataset:d'");
    }

    @Test
    @DisplayName("Should use the block id as the default property name")
    void shouldDefaultPropertyName() {
        Sketch sketch = format.read(String.join("\n",
                "A -> A",
                "#!dynamic_property: count: #`{\"variant\": \"AttractorCount\", \"minimal_count\": 1, "
                        + "\"maximal_count\": 2}`#"));

        assertThat(sketch.properties().getDynamic(DynPropertyId.of("count")).getName()).isEqualTo("count");
    }

    @Test
    @DisplayName("Should ignore blocks of unknown type")
    void shouldIgnoreUnknownBlocks() {
        Sketch sketch = format.read("A -> A\n#!layout: main: #`{}`#");

        assertThat(sketch.model().numVars()).isEqualTo(1);
    }
}
