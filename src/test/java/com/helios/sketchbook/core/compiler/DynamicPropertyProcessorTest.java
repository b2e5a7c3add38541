package com.helios.sketchbook.core.compiler;

import com.helios.sketchbook.ReferenceSketches;
import com.helios.sketchbook.core.compiler.CompiledDynamicProperty.AttractorCountRange;
import com.helios.sketchbook.core.compiler.CompiledDynamicProperty.FixedPoints;
import com.helios.sketchbook.core.compiler.CompiledDynamicProperty.HctlFormula;
import com.helios.sketchbook.core.compiler.CompiledDynamicProperty.TrapSpaces;
import com.helios.sketchbook.core.error.ReferenceException;
import com.helios.sketchbook.engine.PartialState;
import com.helios.sketchbook.engine.TransitionGraph;
import com.helios.sketchbook.engine.explicit.ExplicitEngine;
import com.helios.sketchbook.infra.config.InferenceConfig;
import com.helios.sketchbook.model.ids.DatasetId;
import com.helios.sketchbook.model.ids.ObservationId;
import com.helios.sketchbook.model.ids.VarId;
import com.helios.sketchbook.model.network.BooleanNetwork;
import com.helios.sketchbook.model.observations.Dataset;
import com.helios.sketchbook.model.observations.Observation;
import com.helios.sketchbook.model.observations.ObservationManager;
import com.helios.sketchbook.model.properties.DynProperty;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.helios.sketchbook.ReferenceSketches.A;
import static com.helios.sketchbook.ReferenceSketches.B;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Dynamic property processor")
class DynamicPropertyProcessorTest {

    private static final DatasetId STEADY = DatasetId.of("steady");

    private BooleanNetwork network;
    private ObservationManager observations;
    private DynamicPropertyProcessor processor;

    @BeforeEach
    void setUp() {
        network = ReferenceSketches.model().toBooleanNetwork();
        observations = new ObservationManager();
        observations.addDataset(ReferenceSketches.dataset("steady", "00", "11"));
        processor = new DynamicPropertyProcessor(observations, network);
    }

    @Test
    @DisplayName("A template without an observation selects the whole dataset")
    void testWholeDataset() {
        CompiledDynamicProperty compiled = processor.process(DynProperty.mkFixedPoint("fp", STEADY, null));

        assertThat(compiled).isEqualTo(new FixedPoints(List.of(
                new PartialState(Map.of(A, false, B, false)),
                new PartialState(Map.of(A, true, B, true)))));
    }

    @Test
    @DisplayName("Dataset variables are mapped by id, not by position")
    void testVariableOrder() {
        Dataset reversed = new Dataset(DatasetId.of("reversed"), null, List.of(B, A),
                List.of(Observation.fromValueString("o", "1*")));

        PartialState state = processor.toPartialState(reversed, reversed.observations().get(0));

        assertThat(state.values()).containsExactly(Map.entry(B, true));
        assertThat(state.isFixed(A)).isFalse();
    }

    @Test
    @DisplayName("Compiled templates evaluate on the transition graph")
    void testEvaluation() {
        TransitionGraph graph = new ExplicitEngine(InferenceConfig.defaults()).buildGraph(network);

        CompiledDynamicProperty fixedPoints = processor.process(DynProperty.mkFixedPoint("fp", STEADY, null));
        CompiledDynamicProperty trapSpace = processor.process(
                DynProperty.mkTrapSpace("ts", STEADY, ObservationId.of("o1"), true, false));
        CompiledDynamicProperty count = processor.process(DynProperty.tryMkAttractorCount("c", 2, 2));

        assertThat(fixedPoints.evaluate(graph).exactCardinality().intValue()).isEqualTo(4);
        assertThat(trapSpace).isInstanceOf(TrapSpaces.class);
        assertThat(trapSpace.evaluate(graph).exactCardinality().intValue()).isEqualTo(8);
        assertThat(count).isEqualTo(new AttractorCountRange(2, 2));
        assertThat(count.evaluate(graph).exactCardinality().intValue()).isEqualTo(4);
    }

    @Test
    @DisplayName("Generic formulas keep their canonical text and wildcards")
    void testGeneric() {
        CompiledDynamicProperty compiled = processor.process(
                DynProperty.tryMkGeneric("g", "3{x}: @{x}: %steady/o0% & AG %fixed_points(steady)%"));

        assertThat(compiled).isInstanceOf(HctlFormula.class);
        HctlFormula formula = (HctlFormula) compiled;
        assertThat(formula.formula()).isEqualTo("3{x}: @{x}: %observation_steady_o0% & AG %fixed_points_steady_all%");
        assertThat(formula.wildCards()).hasSize(2);
    }

    @Test
    @DisplayName("Missing datasets, observations and variables are reported")
    void testMissingReferences() {
        assertThatThrownBy(() -> processor.process(DynProperty.mkFixedPoint("fp", null, null)))
                .isInstanceOf(ReferenceException.class)
                .hasMessageContaining("does not reference a dataset");
        assertThatThrownBy(() -> processor.process(DynProperty.mkHasAttractor("ha", DatasetId.of("nope"), null)))
                .isInstanceOf(ReferenceException.class);
        assertThatThrownBy(() -> processor.process(
                DynProperty.mkHasAttractor("ha", STEADY, ObservationId.of("nope"))))
                .isInstanceOf(ReferenceException.class);
        assertThatThrownBy(() -> processor.process(DynProperty.tryMkGeneric("g", "EF %steady/nope%")))
                .isInstanceOf(ReferenceException.class)
                .hasMessageContaining("unknown observation");

        Dataset foreign = new Dataset(DatasetId.of("foreign"), null, List.of(VarId.of("Z")),
                List.of(Observation.fromValueString("o", "1")));
        assertThatThrownBy(() -> processor.toPartialState(foreign, foreign.observations().get(0)))
                .isInstanceOf(ReferenceException.class);
    }
}
