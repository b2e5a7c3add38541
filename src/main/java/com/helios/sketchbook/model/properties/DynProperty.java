package com.helios.sketchbook.model.properties;

import com.helios.sketchbook.core.error.ValidationException;
import com.helios.sketchbook.core.error.VariantMismatchException;
import com.helios.sketchbook.engine.FormulaSyntax;
import com.helios.sketchbook.model.ids.DatasetId;
import com.helios.sketchbook.model.ids.ObservationId;
import com.helios.sketchbook.model.properties.DynPropertyType.AttractorCount;
import com.helios.sketchbook.model.properties.DynPropertyType.ExistsFixedPoint;
import com.helios.sketchbook.model.properties.DynPropertyType.ExistsTrajectory;
import com.helios.sketchbook.model.properties.DynPropertyType.ExistsTrapSpace;
import com.helios.sketchbook.model.properties.DynPropertyType.GenericDynProp;
import com.helios.sketchbook.model.properties.DynPropertyType.HasAttractor;
import com.helios.sketchbook.model.properties.wildcard.ProcessedFormula;
import com.helios.sketchbook.model.properties.wildcard.WildCardProcessor;

import java.util.Objects;

/**
 * A named dynamic property: a requirement on the asynchronous dynamics of every admissible network.
 *
 * <p>Mutators are gated by variant. A mutator applied to a variant it does not support throws
 * {@link VariantMismatchException} and leaves the property unchanged.
 */
public class DynProperty {

    private String name;
    private String annotation;
    private DynPropertyType variant;

    private DynProperty(String name, String annotation, DynPropertyType variant) {
        this.name = requireName(name);
        this.annotation = annotation != null ? annotation : "";
        this.variant = Objects.requireNonNull(variant, "Variant cannot be null");
    }

    public static DynProperty of(String name, String annotation, DynPropertyType variant) {
        return new DynProperty(name, annotation, variant);
    }

    // ==================== Factories ====================

    /**
     * Creates a generic property from a raw formula, resolving its wildcard propositions.
     *
     * @throws ValidationException if the formula or one of its wildcards is malformed.
     * @throws com.helios.sketchbook.core.error.ReferenceException if a wildcard form is unknown.
     */
    public static DynProperty tryMkGeneric(String name, String rawFormula) {
        return tryMkGeneric(name, rawFormula, FormulaSyntax.structural());
    }

    public static DynProperty tryMkGeneric(String name, String rawFormula, FormulaSyntax syntax) {
        return new DynProperty(name, "", processFormula(rawFormula, syntax));
    }

    public static DynProperty mkFixedPoint(String name, DatasetId dataset, ObservationId observation) {
        return new DynProperty(name, "", new ExistsFixedPoint(dataset, observation));
    }

    public static DynProperty mkTrapSpace(String name, DatasetId dataset, ObservationId observation,
                                          boolean minimal, boolean nonpercolable) {
        return new DynProperty(name, "", new ExistsTrapSpace(dataset, observation, minimal, nonpercolable));
    }

    public static DynProperty mkTrajectory(String name, DatasetId dataset) {
        return new DynProperty(name, "", new ExistsTrajectory(dataset));
    }

    /**
     * @throws ValidationException if {@code minimal > maximal} or either bound is not positive.
     */
    public static DynProperty tryMkAttractorCount(String name, int minimal, int maximal) {
        return new DynProperty(name, "", new AttractorCount(minimal, maximal));
    }

    public static DynProperty mkHasAttractor(String name, DatasetId dataset, ObservationId observation) {
        return new DynProperty(name, "", new HasAttractor(dataset, observation));
    }

    /**
     * Default instance of a variant, as created by an editor before it is filled in.
     */
    public static DynProperty defaultOf(DynPropertyKind kind) {
        return switch (kind) {
            case GENERIC -> tryMkGeneric("Generic dynamic property", "true");
            case EXISTS_FIXED_POINT -> mkFixedPoint("Fixed point", null, null);
            case EXISTS_TRAP_SPACE -> mkTrapSpace("Trap space", null, null, false, false);
            case EXISTS_TRAJECTORY -> mkTrajectory("Trajectory", null);
            case ATTRACTOR_COUNT -> tryMkAttractorCount("Attractor count", 1, 1);
            case HAS_ATTRACTOR -> mkHasAttractor("Has attractor", null, null);
        };
    }

    // ==================== Accessors ====================

    public String getName() {
        return name;
    }

    public String getAnnotation() {
        return annotation;
    }

    public DynPropertyType getVariant() {
        return variant;
    }

    public DynPropertyKind kind() {
        return variant.kind();
    }

    public boolean isGeneric() {
        return variant instanceof GenericDynProp;
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
    public DynProperty withAnnotation(String annotation) {
        return new DynProperty(name, annotation, variant);
    }

    public DynProperty copy() {
        return new DynProperty(name, annotation, variant);
    }

    /** Applicable to: GenericDynProp. */
    public void setFormula(String rawFormula) {
        if (!(variant instanceof GenericDynProp)) {
            throw mismatch("formula");
        }
        this.variant = processFormula(rawFormula, FormulaSyntax.structural());
    }

    /**
     * Applicable to: ExistsFixedPoint, ExistsTrapSpace, ExistsTrajectory, HasAttractor.
     * Switching to a different dataset clears the observation.
     */
    public void setDataset(DatasetId dataset) {
        if (variant instanceof ExistsFixedPoint v) {
            variant = new ExistsFixedPoint(dataset, keepObservation(v.dataset(), dataset, v.observation()));
        } else if (variant instanceof ExistsTrapSpace v) {
            variant = new ExistsTrapSpace(dataset, keepObservation(v.dataset(), dataset, v.observation()),
                    v.minimal(), v.nonpercolable());
        } else if (variant instanceof ExistsTrajectory) {
            variant = new ExistsTrajectory(dataset);
        } else if (variant instanceof HasAttractor v) {
            variant = new HasAttractor(dataset, keepObservation(v.dataset(), dataset, v.observation()));
        } else {
            throw mismatch("dataset");
        }
    }

    /**
     * Applicable to: ExistsFixedPoint, ExistsTrapSpace, HasAttractor.
     *
     * @throws ValidationException if an observation is given while no dataset is selected.
     */
    public void setObservation(ObservationId observation) {
        if (variant instanceof ExistsFixedPoint v) {
            variant = new ExistsFixedPoint(v.dataset(), requireDataset(v.dataset(), observation));
        } else if (variant instanceof ExistsTrapSpace v) {
            variant = new ExistsTrapSpace(v.dataset(), requireDataset(v.dataset(), observation),
                    v.minimal(), v.nonpercolable());
        } else if (variant instanceof HasAttractor v) {
            variant = new HasAttractor(v.dataset(), requireDataset(v.dataset(), observation));
        } else {
            throw mismatch("observation");
        }
    }

    /** Applicable to: ExistsFixedPoint, ExistsTrapSpace, ExistsTrajectory, HasAttractor. */
    public void removeDataset() {
        setDataset(null);
    }

    /** Applicable to: AttractorCount. Bounds are re-validated. */
    public void setAttractorCountMinimal(int minimal) {
        if (!(variant instanceof AttractorCount v)) {
            throw mismatch("minimal attractor count");
        }
        variant = new AttractorCount(minimal, v.maximal());
    }

    /** Applicable to: AttractorCount. Bounds are re-validated. */
    public void setAttractorCountMaximal(int maximal) {
        if (!(variant instanceof AttractorCount v)) {
            throw mismatch("maximal attractor count");
        }
        variant = new AttractorCount(v.minimal(), maximal);
    }

    /** Applicable to: ExistsTrapSpace. */
    public void setTrapSpaceMinimal(boolean minimal) {
        if (!(variant instanceof ExistsTrapSpace v)) {
            throw mismatch("trap space minimality");
        }
        variant = new ExistsTrapSpace(v.dataset(), v.observation(), minimal, v.nonpercolable());
    }

    /** Applicable to: ExistsTrapSpace. */
    public void setTrapSpaceNonpercolable(boolean nonpercolable) {
        if (!(variant instanceof ExistsTrapSpace v)) {
            throw mismatch("trap space percolability");
        }
        variant = new ExistsTrapSpace(v.dataset(), v.observation(), v.minimal(), nonpercolable);
    }

    // ==================== Helpers ====================

    private static GenericDynProp processFormula(String rawFormula, FormulaSyntax syntax) {
        if (rawFormula == null || rawFormula.isBlank()) {
            throw new ValidationException("Formula cannot be empty");
        }
        ProcessedFormula processed = WildCardProcessor.process(rawFormula);
        syntax.validate(processed.canonical());
        return new GenericDynProp(rawFormula, processed.canonical(), processed.wildCards());
    }

    private static ObservationId keepObservation(DatasetId current, DatasetId next, ObservationId observation) {
        return Objects.equals(current, next) ? observation : null;
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Property name cannot be empty");
        }
        return name;
    }

    private ObservationId requireDataset(DatasetId dataset, ObservationId observation) {
        if (observation != null && dataset == null) {
            throw new ValidationException("Cannot set observation '" + observation + "' of property '" + name
                    + "' before a dataset is selected");
        }
        return observation;
    }

    private VariantMismatchException mismatch(String field) {
        return new VariantMismatchException("Cannot set " + field + " of a " + variant.kind().tag() + " property");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DynProperty other)) return false;
        return name.equals(other.name) && annotation.equals(other.annotation) && variant.equals(other.variant);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, annotation, variant);
    }

    @Override
    public String toString() {
        return "DynProperty{name='" + name + "', variant=" + variant + "}";
    }
}
