package com.helios.sketchbook.engine.explicit;

import com.helios.sketchbook.ReferenceSketches;
import com.helios.sketchbook.core.error.ExternalEngineException;
import com.helios.sketchbook.engine.ColorSet;
import com.helios.sketchbook.engine.PartialState;
import com.helios.sketchbook.engine.TransitionGraph;
import com.helios.sketchbook.engine.UpdatePredicate;
import com.helios.sketchbook.infra.config.InferenceConfig;
import com.helios.sketchbook.model.ids.VarId;
import com.helios.sketchbook.model.network.BooleanNetwork;
import com.helios.sketchbook.model.network.Essentiality;
import com.helios.sketchbook.model.network.ModelState;
import com.helios.sketchbook.model.network.Monotonicity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.stream.Stream;

import static com.helios.sketchbook.ReferenceSketches.A;
import static com.helios.sketchbook.ReferenceSketches.B;
import static com.helios.sketchbook.ReferenceSketches.partial;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Colour counts on the two-variable reference network. A's truth table has rows
 * (A,B) = 00, 10, 01, 11; B always copies A.
 */
@DisplayName("Explicit engine")
class ExplicitEngineTest {

    private static final InferenceConfig CONFIG = InferenceConfig.defaults();

    private TransitionGraph graph;

    @BeforeEach
    void setUp() {
        graph = new ExplicitEngine(CONFIG).buildGraph(ReferenceSketches.model().toBooleanNetwork());
    }

    private static long count(ColorSet colors) {
        return colors.exactCardinality().longValueExact();
    }

    private static List<PartialState> states(String... values) {
        return Arrays.stream(values).map(ReferenceSketches::partial).toList();
    }

    @Test
    @DisplayName("Every function of A is admissible when its regulations are unconstrained")
    void testUnitColors() {
        ColorSet unit = graph.mkUnitColors();

        assertThat(unit.exactCardinality()).isEqualTo(BigInteger.valueOf(16));
        assertThat(unit.approxCardinality()).isEqualTo(16.0);
        assertThat(graph.mkConstant(false).isEmpty()).isTrue();
        assertThat(graph.countUpdateFunctions(A, unit)).isEqualTo(16);
        assertThat(graph.countUpdateFunctions(B, unit)).isEqualTo(1);
    }

    @Test
    @DisplayName("Random picks exhaust a colour set and render one function per variable")
    void testWitnessFunctions() {
        UpdatePredicate fA = graph.mkUpdateFunctionTrue(A);
        ColorSet remaining = graph.mkActivation(fA, A).intersect(graph.mkInhibition(fA, A));
        Random random = new Random(3L);
        Set<String> functionsOfA = new HashSet<>();

        while (!remaining.isEmpty()) {
            ColorSet picked = graph.pickRandomColor(remaining, random);
            assertThat(count(picked)).isEqualTo(1);
            functionsOfA.add(graph.witnessFunctions(picked).get(A).render());
            assertThat(graph.witnessFunctions(picked).get(B).render()).isEqualTo("A");
            remaining = remaining.minus(picked);
        }

        assertThat(functionsOfA).containsExactlyInAnyOrder(
                "false", "true", "((!A & B) | (A & B))", "((!A & !B) | (A & !B))");
        ColorSet exhausted = remaining;
        assertThatThrownBy(() -> graph.pickRandomColor(exhausted, random))
                .isInstanceOf(ExternalEngineException.class);
        assertThatThrownBy(() -> graph.witnessFunctions(graph.mkUnitColors()))
                .isInstanceOf(ExternalEngineException.class)
                .hasMessageContaining("16");
    }

    @Test
    @DisplayName("Regulation constraints restrict A's truth table")
    void testRegulationConstraints() {
        UpdatePredicate fA = graph.mkUpdateFunctionTrue(A);

        assertThat(count(graph.mkActivation(fA, A))).isEqualTo(9);
        assertThat(count(graph.mkInhibition(fA, A))).isEqualTo(9);
        assertThat(count(graph.mkObservability(fA, A))).isEqualTo(12);
        assertThat(count(graph.mkActivation(fA, B))).isEqualTo(9);
        assertThat(count(graph.mkActivation(fA, A).intersect(graph.mkInhibition(fA, A)))).isEqualTo(4);
    }

    @Test
    @DisplayName("A variable that does not regulate the target yields no colours")
    void testNonRegulator() {
        UpdatePredicate fB = graph.mkUpdateFunctionTrue(B);

        assertThat(graph.mkObservability(fB, B).isEmpty()).isTrue();
        assertThat(count(graph.mkObservability(fB, A))).isEqualTo(16);
    }

    static Stream<Arguments> provideFixedPoints() {
        return Stream.of(
                Arguments.of(new String[]{"00"}, 8),
                Arguments.of(new String[]{"11"}, 8),
                Arguments.of(new String[]{"00", "11"}, 4),
                Arguments.of(new String[]{"1*"}, 8),
                Arguments.of(new String[]{"10"}, 0)
        );
    }

    @ParameterizedTest(name = "[{index}] fixed points {0}")
    @MethodSource("provideFixedPoints")
    void shouldCountFixedPointColors(String[] observations, int expected) {
        assertThat(count(graph.fixedPointColors(states(observations)))).isEqualTo(expected);
    }

    @Test
    @DisplayName("Attractor membership and attractor counts")
    void testAttractors() {
        assertThat(count(graph.attractorCountColors(1, 1))).isEqualTo(12);
        assertThat(count(graph.attractorCountColors(2, 2))).isEqualTo(4);
        assertThat(count(graph.attractorCountColors(1, 2))).isEqualTo(16);
        assertThat(count(graph.attractorCountColors(3, 4))).isZero();

        assertThat(count(graph.attractorColors(states("11")))).isEqualTo(12);
        assertThat(count(graph.attractorColors(states("01")))).isEqualTo(4);
    }

    static Stream<Arguments> provideTrapSpaces() {
        return Stream.of(
                Arguments.of("1*", false, false, 4),
                Arguments.of("1*", true, false, 0),
                Arguments.of("1*", false, true, 0),
                Arguments.of("11", true, false, 8),
                Arguments.of("0*", false, false, 4),
                Arguments.of("0*", true, false, 0),
                Arguments.of("**", false, false, 16)
        );
    }

    @ParameterizedTest(name = "[{index}] trap space {0} minimal={1} nonpercolable={2}")
    @MethodSource("provideTrapSpaces")
    void shouldCountTrapSpaceColors(String space, boolean minimal, boolean nonpercolable, int expected) {
        ColorSet colors = graph.trapSpaceColors(List.of(partial(space)), minimal, nonpercolable);

        assertThat(count(colors)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Trajectories must visit the observations in order")
    void testTrajectories() {
        // 00 -> 10 needs f_A(0,0) = 1; 11 -> 01 needs f_A(1,1) = 0.
        assertThat(count(graph.trajectoryColors(states("00", "11")))).isEqualTo(8);
        assertThat(count(graph.trajectoryColors(states("11", "00")))).isEqualTo(8);
        assertThat(count(graph.trajectoryColors(states("00", "11", "00")))).isEqualTo(4);
        assertThat(count(graph.trajectoryColors(List.of()))).isEqualTo(16);
    }

    @Test
    @DisplayName("Generic formulas need a model checker")
    void testHctlWithoutChecker() {
        assertThatThrownBy(() -> graph.evalHctl("AG EF true"))
                .isInstanceOf(ExternalEngineException.class)
                .hasMessageContaining("No HCTL model checker");
    }

    @Test
    @DisplayName("Model checker results are restricted to the unit set and its failures are wrapped")
    void testHctlWithChecker() {
        TransitionGraph checked = new ExplicitEngine(CONFIG, (g, formula, wildCards) ->
                formula.equals("fail") ? failing() : g.fixedPointColors(List.of(partial("00"))))
                .buildGraph(ReferenceSketches.model().toBooleanNetwork());

        assertThat(count(checked.evalHctl("3{x}: @{x}: AX x"))).isEqualTo(8);
        assertThatThrownBy(() -> checked.evalHctl("fail"))
                .isInstanceOf(ExternalEngineException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    private static ColorSet failing() {
        throw new IllegalStateException("checker crashed");
    }

    @Test
    @DisplayName("Colour sets of different graphs cannot be combined")
    void testForeignColorSets() {
        TransitionGraph other = new ExplicitEngine(CONFIG).buildGraph(ReferenceSketches.model().toBooleanNetwork());

        assertThatThrownBy(() -> graph.mkUnitColors().intersect(other.mkUnitColors()))
                .isInstanceOf(ExternalEngineException.class);
    }

    @Test
    @DisplayName("An explicit function violating its regulations leaves no colours")
    void testInconsistentExplicitFunction() {
        ModelState model = ReferenceSketches.model();
        model.setUpdateFunction(B, "!A");

        TransitionGraph inconsistent = new ExplicitEngine(CONFIG).buildGraph(model.toBooleanNetwork());

        assertThat(inconsistent.mkUnitColors().isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Configured limits are enforced")
    void testLimits() {
        BooleanNetwork network = ReferenceSketches.model().toBooleanNetwork();

        assertThatThrownBy(() -> new ExplicitEngine(CONFIG.toBuilder().maxColors(8).build()).buildGraph(network))
                .isInstanceOf(ExternalEngineException.class);
        assertThatThrownBy(() -> new ExplicitEngine(CONFIG.toBuilder().maxVariables(1).build()).buildGraph(network))
                .isInstanceOf(ExternalEngineException.class);
    }

    @Test
    @DisplayName("Implicit variables with too many regulators are rejected")
    void testImplicitArity() {
        ModelState model = new ModelState();
        for (String id : List.of("T", "R1", "R2", "R3", "R4", "R5")) {
            model.addVariableByStr(id);
        }
        for (String id : List.of("R1", "R2", "R3", "R4", "R5")) {
            model.addRegulation(VarId.of(id), VarId.of("T"), Monotonicity.ACTIVATION, Essentiality.UNKNOWN);
        }

        assertThatThrownBy(() -> new ExplicitEngine(CONFIG).buildGraph(model.toBooleanNetwork()))
                .isInstanceOf(ExternalEngineException.class);
    }
}
