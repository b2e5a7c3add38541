package com.helios.sketchbook.model.properties;

import com.helios.sketchbook.core.error.ValidationException;
import com.helios.sketchbook.model.ids.DatasetId;
import com.helios.sketchbook.model.ids.ObservationId;
import com.helios.sketchbook.model.properties.wildcard.WildCardProposition;

import java.util.List;
import java.util.Objects;

/**
 * Variant payload of a {@link DynProperty}.
 *
 * Dataset and observation references of the templates are optional (null) while a
 * sketch is being edited; the consistency checker reports missing ones.
 */
public interface DynPropertyType {

    DynPropertyKind kind();

    /**
     * A temporal formula with wildcard propositions replaced by canonical tokens.
     */
    record GenericDynProp(String rawFormula, String processedFormula, List<WildCardProposition> wildCards)
            implements DynPropertyType {
        public GenericDynProp {
            Objects.requireNonNull(rawFormula, "Formula cannot be null");
            Objects.requireNonNull(processedFormula, "Processed formula cannot be null");
            wildCards = List.copyOf(wildCards);
        }

        @Override
        public DynPropertyKind kind() {
            return DynPropertyKind.GENERIC;
        }
    }

    /** Observations (one, or all of a dataset) must be fixed points. */
    record ExistsFixedPoint(DatasetId dataset, ObservationId observation) implements DynPropertyType {
        @Override
        public DynPropertyKind kind() {
            return DynPropertyKind.EXISTS_FIXED_POINT;
        }
    }

    /** Observations must be trap spaces, optionally minimal and/or non-percolable ones. */
    record ExistsTrapSpace(DatasetId dataset, ObservationId observation, boolean minimal, boolean nonpercolable)
            implements DynPropertyType {
        @Override
        public DynPropertyKind kind() {
            return DynPropertyKind.EXISTS_TRAP_SPACE;
        }
    }

    /** Observations of a dataset, in order, must lie on a trajectory. */
    record ExistsTrajectory(DatasetId dataset) implements DynPropertyType {
        @Override
        public DynPropertyKind kind() {
            return DynPropertyKind.EXISTS_TRAJECTORY;
        }
    }

    /** The number of attractors must lie within {@code [minimal, maximal]}. */
    record AttractorCount(int minimal, int maximal) implements DynPropertyType {
        public AttractorCount {
            if (minimal > maximal) {
                throw new ValidationException("`minimal` attractor count cannot be larger than `maximal`.");
            }
            if (minimal <= 0 || maximal <= 0) {
                throw new ValidationException("Attractor count must be larger than 0.");
            }
        }

        @Override
        public DynPropertyKind kind() {
            return DynPropertyKind.ATTRACTOR_COUNT;
        }
    }

    /** Observations (one, or all of a dataset) must be part of an attractor. */
    record HasAttractor(DatasetId dataset, ObservationId observation) implements DynPropertyType {
        @Override
        public DynPropertyKind kind() {
            return DynPropertyKind.HAS_ATTRACTOR;
        }
    }
}
