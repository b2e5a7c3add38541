package com.helios.sketchbook.model.network;

import com.helios.sketchbook.core.error.ReferenceException;
import com.helios.sketchbook.core.error.ValidationException;
import com.helios.sketchbook.model.ids.VarId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Model state")
class ModelStateTest {

    private static final VarId A = VarId.of("A");
    private static final VarId B = VarId.of("B");
    private static final VarId C = VarId.of("C");

    private ModelState model;

    @BeforeEach
    void setUp() {
        model = new ModelState();
        model.addVariableByStr("C");
        model.addVariableByStr("A");
        model.addVariableByStr("B");
    }

    @Test
    @DisplayName("Variables and regulations are kept in a canonical order")
    void testOrdering() {
        model.addRegulation(C, B, Monotonicity.ACTIVATION, Essentiality.TRUE);
        model.addRegulation(A, B, Monotonicity.INHIBITION, Essentiality.FALSE);
        model.addRegulation(B, A, Monotonicity.UNKNOWN, Essentiality.UNKNOWN);

        assertThat(model.variableIds()).containsExactly(A, B, C);
        assertThat(model.regulations()).extracting(Regulation::toString)
                .containsExactly("B -?? A", "A -|! B", "C -> B");
        assertThat(model.regulators(B)).containsExactly(A, C);
    }

    @Test
    @DisplayName("Duplicate variables and regulations are rejected")
    void testDuplicates() {
        model.addRegulation(A, B, Monotonicity.ACTIVATION, Essentiality.TRUE);

        assertThatThrownBy(() -> model.addVariableByStr("A"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("already exists");
        assertThatThrownBy(() -> model.addRegulation(A, B, Monotonicity.INHIBITION, Essentiality.TRUE))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("Regulations between unknown variables are rejected")
    void testUnknownVariable() {
        assertThatThrownBy(() -> model.addRegulation(VarId.of("X"), A, Monotonicity.ACTIVATION, Essentiality.TRUE))
                .isInstanceOf(ReferenceException.class);
        assertThatThrownBy(() -> model.getVariable(VarId.of("X")))
                .isInstanceOf(ReferenceException.class);
    }

    @Test
    @DisplayName("Update functions may only use regulators of their target")
    void testUpdateFunctionInputs() {
        model.addRegulation(A, B, Monotonicity.ACTIVATION, Essentiality.TRUE);

        model.setUpdateFunction(B, "!A");
        assertThat(model.hasExplicitFunction(B)).isTrue();
        assertThat(model.updateFunction(B)).map(UpdateFunction::asText).contains("!A");

        assertThatThrownBy(() -> model.setUpdateFunction(B, "A & C"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("does not regulate");

        model.setUpdateFunction(B, "  ");
        assertThat(model.hasExplicitFunction(B)).isFalse();
    }

    @Test
    @DisplayName("Conversion to a Boolean network keeps variable order and explicit functions")
    void testToBooleanNetwork() {
        model.addRegulation(A, B, Monotonicity.ACTIVATION, Essentiality.TRUE);
        model.setUpdateFunction(B, "A");

        BooleanNetwork network = model.toBooleanNetwork();

        assertThat(network.variables()).containsExactly(A, B, C);
        assertThat(network.indexOf(C)).isEqualTo(2);
        assertThat(network.isImplicit(A)).isTrue();
        assertThat(network.explicitFunction(B)).isPresent();
        assertThat(network.regulation(A, B)).map(Regulation::monotonicity).contains(Monotonicity.ACTIVATION);
        assertThatThrownBy(() -> network.indexOf(VarId.of("X"))).isInstanceOf(ReferenceException.class);
    }

    @Test
    @DisplayName("An empty model cannot be converted to a network")
    void testEmptyModel() {
        assertThatThrownBy(() -> new ModelState().toBooleanNetwork())
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("Annotations, names and layout are part of model equality")
    void testEquality() {
        ModelState other = new ModelState();
        other.addVariableByStr("A");
        other.addVariableByStr("B");
        other.addVariableByStr("C");
        assertThat(other).isEqualTo(model);

        model.setPosition(A, 1.5, -2.0);
        model.setVariableAnnotation(B, "note");
        assertThat(other).isNotEqualTo(model);
        assertThat(model.position(A)).contains(new NodePosition(1.5, -2.0));
        assertThat(model.getVariable(B).annotation()).isEqualTo("note");
    }
}
