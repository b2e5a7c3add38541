package com.helios.sketchbook.core.compiler;

import com.helios.sketchbook.engine.ColorSet;
import com.helios.sketchbook.engine.PartialState;
import com.helios.sketchbook.engine.TransitionGraph;
import com.helios.sketchbook.model.properties.wildcard.WildCardProposition;

import java.util.List;

/**
 * A dynamic property with its data references resolved into state sub-spaces, ready for evaluation.
 */
public interface CompiledDynamicProperty {

    ColorSet evaluate(TransitionGraph graph);

    record HctlFormula(String formula, List<WildCardProposition> wildCards) implements CompiledDynamicProperty {
        @Override
        public ColorSet evaluate(TransitionGraph graph) {
            return graph.evalHctl(formula, wildCards);
        }
    }

    record FixedPoints(List<PartialState> observations) implements CompiledDynamicProperty {
        @Override
        public ColorSet evaluate(TransitionGraph graph) {
            return graph.fixedPointColors(observations);
        }
    }

    record Attractors(List<PartialState> observations) implements CompiledDynamicProperty {
        @Override
        public ColorSet evaluate(TransitionGraph graph) {
            return graph.attractorColors(observations);
        }
    }

    record TrapSpaces(List<PartialState> observations, boolean minimal, boolean nonpercolable)
            implements CompiledDynamicProperty {
        @Override
        public ColorSet evaluate(TransitionGraph graph) {
            return graph.trapSpaceColors(observations, minimal, nonpercolable);
        }
    }

    record Trajectory(List<PartialState> observations) implements CompiledDynamicProperty {
        @Override
        public ColorSet evaluate(TransitionGraph graph) {
            return graph.trajectoryColors(observations);
        }
    }

    record AttractorCountRange(int minimal, int maximal) implements CompiledDynamicProperty {
        @Override
        public ColorSet evaluate(TransitionGraph graph) {
            return graph.attractorCountColors(minimal, maximal);
        }
    }
}
