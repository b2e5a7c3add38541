package com.helios.sketchbook.model.properties;

import com.helios.sketchbook.model.ids.FunctionId;
import com.helios.sketchbook.model.ids.VarId;
import com.helios.sketchbook.model.network.Essentiality;
import com.helios.sketchbook.model.network.Monotonicity;

import java.util.Objects;

/**
 * Variant payload of a {@link StatProperty}.
 */
public interface StatPropertyType {

    StatPropertyKind kind();

    /** Variants constraining a regulation {@code input -> target} of the model. */
    interface RegulationTemplate extends StatPropertyType {
        VarId input();

        VarId target();
    }

    /** Variants constraining one input of an uninterpreted function symbol. */
    interface FnInputTemplate extends StatPropertyType {
        Integer inputIndex();

        FunctionId target();
    }

    /** Variants that only hold within a logical context. */
    interface Contextual extends StatPropertyType {
        String context();
    }

    record GenericStatProp(String rawFormula, String processedFormula) implements StatPropertyType {
        public GenericStatProp {
            Objects.requireNonNull(rawFormula, "Formula cannot be null");
            Objects.requireNonNull(processedFormula, "Processed formula cannot be null");
        }

        @Override
        public StatPropertyKind kind() {
            return StatPropertyKind.GENERIC;
        }
    }

    record RegulationEssential(VarId input, VarId target, Essentiality value) implements RegulationTemplate {
        public RegulationEssential {
            value = value != null ? value : Essentiality.TRUE;
        }

        @Override
        public StatPropertyKind kind() {
            return StatPropertyKind.REGULATION_ESSENTIAL;
        }
    }

    record RegulationEssentialContext(VarId input, VarId target, Essentiality value, String context)
            implements RegulationTemplate, Contextual {
        public RegulationEssentialContext {
            value = value != null ? value : Essentiality.TRUE;
            context = context != null ? context : "";
        }

        @Override
        public StatPropertyKind kind() {
            return StatPropertyKind.REGULATION_ESSENTIAL_CONTEXT;
        }
    }

    record RegulationMonotonic(VarId input, VarId target, Monotonicity value) implements RegulationTemplate {
        public RegulationMonotonic {
            value = value != null ? value : Monotonicity.ACTIVATION;
        }

        @Override
        public StatPropertyKind kind() {
            return StatPropertyKind.REGULATION_MONOTONIC;
        }
    }

    record RegulationMonotonicContext(VarId input, VarId target, Monotonicity value, String context)
            implements RegulationTemplate, Contextual {
        public RegulationMonotonicContext {
            value = value != null ? value : Monotonicity.ACTIVATION;
            context = context != null ? context : "";
        }

        @Override
        public StatPropertyKind kind() {
            return StatPropertyKind.REGULATION_MONOTONIC_CONTEXT;
        }
    }

    record FnInputEssential(Integer inputIndex, FunctionId target, Essentiality value) implements FnInputTemplate {
        public FnInputEssential {
            value = value != null ? value : Essentiality.TRUE;
        }

        @Override
        public StatPropertyKind kind() {
            return StatPropertyKind.FN_INPUT_ESSENTIAL;
        }
    }

    record FnInputEssentialContext(Integer inputIndex, FunctionId target, Essentiality value, String context)
            implements FnInputTemplate, Contextual {
        public FnInputEssentialContext {
            value = value != null ? value : Essentiality.TRUE;
            context = context != null ? context : "";
        }

        @Override
        public StatPropertyKind kind() {
            return StatPropertyKind.FN_INPUT_ESSENTIAL_CONTEXT;
        }
    }

    record FnInputMonotonic(Integer inputIndex, FunctionId target, Monotonicity value) implements FnInputTemplate {
        public FnInputMonotonic {
            value = value != null ? value : Monotonicity.ACTIVATION;
        }

        @Override
        public StatPropertyKind kind() {
            return StatPropertyKind.FN_INPUT_MONOTONIC;
        }
    }

    record FnInputMonotonicContext(Integer inputIndex, FunctionId target, Monotonicity value, String context)
            implements FnInputTemplate, Contextual {
        public FnInputMonotonicContext {
            value = value != null ? value : Monotonicity.ACTIVATION;
            context = context != null ? context : "";
        }

        @Override
        public StatPropertyKind kind() {
            return StatPropertyKind.FN_INPUT_MONOTONIC_CONTEXT;
        }
    }
}
