package com.helios.sketchbook.model.properties;

import com.helios.sketchbook.core.error.ValidationException;
import com.helios.sketchbook.core.error.VariantMismatchException;
import com.helios.sketchbook.engine.FormulaSyntax;
import com.helios.sketchbook.model.ids.FunctionId;
import com.helios.sketchbook.model.ids.VarId;
import com.helios.sketchbook.model.network.Essentiality;
import com.helios.sketchbook.model.network.Monotonicity;
import com.helios.sketchbook.model.properties.StatPropertyType.FnInputEssential;
import com.helios.sketchbook.model.properties.StatPropertyType.FnInputEssentialContext;
import com.helios.sketchbook.model.properties.StatPropertyType.FnInputMonotonic;
import com.helios.sketchbook.model.properties.StatPropertyType.FnInputMonotonicContext;
import com.helios.sketchbook.model.properties.StatPropertyType.FnInputTemplate;
import com.helios.sketchbook.model.properties.StatPropertyType.GenericStatProp;
import com.helios.sketchbook.model.properties.StatPropertyType.RegulationEssential;
import com.helios.sketchbook.model.properties.StatPropertyType.RegulationEssentialContext;
import com.helios.sketchbook.model.properties.StatPropertyType.RegulationMonotonic;
import com.helios.sketchbook.model.properties.StatPropertyType.RegulationMonotonicContext;
import com.helios.sketchbook.model.properties.StatPropertyType.RegulationTemplate;

import java.util.Objects;

/**
 * A named static property: a requirement on the update functions themselves.
 *
 * <p>As with {@link DynProperty}, each mutator lists the variants it applies to and throws
 * {@link VariantMismatchException} for any other variant.
 */
public class StatProperty {

    private String name;
    private String annotation;
    private StatPropertyType variant;

    private StatProperty(String name, String annotation, StatPropertyType variant) {
        this.name = requireName(name);
        this.annotation = annotation != null ? annotation : "";
        this.variant = Objects.requireNonNull(variant, "Variant cannot be null");
    }

    public static StatProperty of(String name, String annotation, StatPropertyType variant) {
        return new StatProperty(name, annotation, variant);
    }

    // ==================== Factories ====================

    /**
     * @throws ValidationException if the formula is not syntactically valid.
     */
    public static StatProperty tryMkGeneric(String name, String rawFormula) {
        return tryMkGeneric(name, rawFormula, FormulaSyntax.structural());
    }

    public static StatProperty tryMkGeneric(String name, String rawFormula, FormulaSyntax syntax) {
        return new StatProperty(name, "", processFormula(rawFormula, syntax));
    }

    public static StatProperty mkRegulationEssential(String name, VarId input, VarId target, Essentiality value) {
        return new StatProperty(name, "", new RegulationEssential(input, target, value));
    }

    public static StatProperty mkRegulationEssentialContext(String name, VarId input, VarId target,
                                                            Essentiality value, String context) {
        return new StatProperty(name, "", new RegulationEssentialContext(input, target, value, context));
    }

    public static StatProperty mkRegulationMonotonic(String name, VarId input, VarId target, Monotonicity value) {
        return new StatProperty(name, "", new RegulationMonotonic(input, target, value));
    }

    public static StatProperty mkRegulationMonotonicContext(String name, VarId input, VarId target,
                                                            Monotonicity value, String context) {
        return new StatProperty(name, "", new RegulationMonotonicContext(input, target, value, context));
    }

    public static StatProperty mkFnInputEssential(String name, Integer inputIndex, FunctionId target,
                                                  Essentiality value) {
        return new StatProperty(name, "", new FnInputEssential(inputIndex, target, value));
    }

    public static StatProperty mkFnInputEssentialContext(String name, Integer inputIndex, FunctionId target,
                                                         Essentiality value, String context) {
        return new StatProperty(name, "", new FnInputEssentialContext(inputIndex, target, value, context));
    }

    public static StatProperty mkFnInputMonotonic(String name, Integer inputIndex, FunctionId target,
                                                  Monotonicity value) {
        return new StatProperty(name, "", new FnInputMonotonic(inputIndex, target, value));
    }

    public static StatProperty mkFnInputMonotonicContext(String name, Integer inputIndex, FunctionId target,
                                                         Monotonicity value, String context) {
        return new StatProperty(name, "", new FnInputMonotonicContext(inputIndex, target, value, context));
    }

    public static StatProperty defaultOf(StatPropertyKind kind) {
        return switch (kind) {
            case GENERIC -> tryMkGeneric("Generic static property", "true");
            case REGULATION_ESSENTIAL -> mkRegulationEssential("Essential regulation", null, null, Essentiality.TRUE);
            case REGULATION_ESSENTIAL_CONTEXT -> mkRegulationEssentialContext("Essential regulation in context",
                    null, null, Essentiality.TRUE, "true");
            case REGULATION_MONOTONIC -> mkRegulationMonotonic("Monotonic regulation", null, null,
                    Monotonicity.ACTIVATION);
            case REGULATION_MONOTONIC_CONTEXT -> mkRegulationMonotonicContext("Monotonic regulation in context",
                    null, null, Monotonicity.ACTIVATION, "true");
            case FN_INPUT_ESSENTIAL -> mkFnInputEssential("Essential function input", null, null,
                    Essentiality.TRUE);
            case FN_INPUT_ESSENTIAL_CONTEXT -> mkFnInputEssentialContext("Essential function input in context",
                    null, null, Essentiality.TRUE, "true");
            case FN_INPUT_MONOTONIC -> mkFnInputMonotonic("Monotonic function input", null, null,
                    Monotonicity.ACTIVATION);
            case FN_INPUT_MONOTONIC_CONTEXT -> mkFnInputMonotonicContext("Monotonic function input in context",
                    null, null, Monotonicity.ACTIVATION, "true");
        };
    }

    // ==================== Accessors ====================

    public String getName() {
        return name;
    }

    public String getAnnotation() {
        return annotation;
    }

    public StatPropertyType getVariant() {
        return variant;
    }

    public StatPropertyKind kind() {
        return variant.kind();
    }

    public boolean isGeneric() {
        return variant instanceof GenericStatProp;
    }

    // ==================== Mutators ====================

    public void setName(String name) {
        this.name = requireName(name);
    }

    public void setAnnotation(String annotation) {
        this.annotation = annotation != null ? annotation : "";
    }

    /**
     * Returns an updated copy with a new annotation; this property is left unchanged.
     */
    public StatProperty withAnnotation(String annotation) {
        return new StatProperty(name, annotation, variant);
    }

    public StatProperty copy() {
        return new StatProperty(name, annotation, variant);
    }

    /** Applicable to: GenericStatProp. */
    public void setFormula(String rawFormula) {
        if (!(variant instanceof GenericStatProp)) {
            throw mismatch("formula");
        }
        variant = processFormula(rawFormula, FormulaSyntax.structural());
    }

    /** Applicable to: the four regulation variants. */
    public void setInputVar(VarId input) {
        if (!(variant instanceof RegulationTemplate t)) {
            throw mismatch("input variable");
        }
        variant = withRegulation(t, input, t.target());
    }

    /** Applicable to: the four regulation variants. */
    public void setTargetVar(VarId target) {
        if (!(variant instanceof RegulationTemplate t)) {
            throw mismatch("target variable");
        }
        variant = withRegulation(t, t.input(), target);
    }

    /** Applicable to: the four function-input variants. */
    public void setInputIndex(Integer inputIndex) {
        if (!(variant instanceof FnInputTemplate t)) {
            throw mismatch("input index");
        }
        variant = withFnInput(t, inputIndex, t.target());
    }

    /** Applicable to: the four function-input variants. */
    public void setTargetFn(FunctionId target) {
        if (!(variant instanceof FnInputTemplate t)) {
            throw mismatch("target function");
        }
        variant = withFnInput(t, t.inputIndex(), target);
    }

    /** Applicable to: RegulationEssential(Context), FnInputEssential(Context). */
    public void setEssentiality(Essentiality value) {
        if (variant instanceof RegulationEssential v) {
            variant = new RegulationEssential(v.input(), v.target(), value);
        } else if (variant instanceof RegulationEssentialContext v) {
            variant = new RegulationEssentialContext(v.input(), v.target(), value, v.context());
        } else if (variant instanceof FnInputEssential v) {
            variant = new FnInputEssential(v.inputIndex(), v.target(), value);
        } else if (variant instanceof FnInputEssentialContext v) {
            variant = new FnInputEssentialContext(v.inputIndex(), v.target(), value, v.context());
        } else {
            throw mismatch("essentiality");
        }
    }

    /** Applicable to: RegulationMonotonic(Context), FnInputMonotonic(Context). */
    public void setMonotonicity(Monotonicity value) {
        if (variant instanceof RegulationMonotonic v) {
            variant = new RegulationMonotonic(v.input(), v.target(), value);
        } else if (variant instanceof RegulationMonotonicContext v) {
            variant = new RegulationMonotonicContext(v.input(), v.target(), value, v.context());
        } else if (variant instanceof FnInputMonotonic v) {
            variant = new FnInputMonotonic(v.inputIndex(), v.target(), value);
        } else if (variant instanceof FnInputMonotonicContext v) {
            variant = new FnInputMonotonicContext(v.inputIndex(), v.target(), value, v.context());
        } else {
            throw mismatch("monotonicity");
        }
    }

    /** Applicable to: the four context variants. */
    public void setContext(String context) {
        if (variant instanceof RegulationEssentialContext v) {
            variant = new RegulationEssentialContext(v.input(), v.target(), v.value(), context);
        } else if (variant instanceof RegulationMonotonicContext v) {
            variant = new RegulationMonotonicContext(v.input(), v.target(), v.value(), context);
        } else if (variant instanceof FnInputEssentialContext v) {
            variant = new FnInputEssentialContext(v.inputIndex(), v.target(), v.value(), context);
        } else if (variant instanceof FnInputMonotonicContext v) {
            variant = new FnInputMonotonicContext(v.inputIndex(), v.target(), v.value(), context);
        } else {
            throw mismatch("context");
        }
    }

    // ==================== Helpers ====================

    private static StatPropertyType withRegulation(RegulationTemplate t, VarId input, VarId target) {
        if (t instanceof RegulationEssential v) {
            return new RegulationEssential(input, target, v.value());
        } else if (t instanceof RegulationEssentialContext v) {
            return new RegulationEssentialContext(input, target, v.value(), v.context());
        } else if (t instanceof RegulationMonotonic v) {
            return new RegulationMonotonic(input, target, v.value());
        }
        RegulationMonotonicContext v = (RegulationMonotonicContext) t;
        return new RegulationMonotonicContext(input, target, v.value(), v.context());
    }

    private static StatPropertyType withFnInput(FnInputTemplate t, Integer inputIndex, FunctionId target) {
        if (t instanceof FnInputEssential v) {
            return new FnInputEssential(inputIndex, target, v.value());
        } else if (t instanceof FnInputEssentialContext v) {
            return new FnInputEssentialContext(inputIndex, target, v.value(), v.context());
        } else if (t instanceof FnInputMonotonic v) {
            return new FnInputMonotonic(inputIndex, target, v.value());
        }
        FnInputMonotonicContext v = (FnInputMonotonicContext) t;
        return new FnInputMonotonicContext(inputIndex, target, v.value(), v.context());
    }

    private static GenericStatProp processFormula(String rawFormula, FormulaSyntax syntax) {
        if (rawFormula == null || rawFormula.isBlank()) {
            throw new ValidationException("Formula cannot be empty");
        }
        String canonical = rawFormula.trim();
        syntax.validate(canonical);
        return new GenericStatProp(rawFormula, canonical);
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Property name cannot be empty");
        }
        return name;
    }

    private VariantMismatchException mismatch(String field) {
        return new VariantMismatchException("Cannot set " + field + " of a " + variant.kind().tag() + " property");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StatProperty other)) return false;
        return name.equals(other.name) && annotation.equals(other.annotation) && variant.equals(other.variant);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, annotation, variant);
    }

    @Override
    public String toString() {
        return "StatProperty{name='" + name + "', variant=" + variant + "}";
    }
}
