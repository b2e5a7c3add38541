package com.helios.sketchbook.model.properties.wildcard;

import com.helios.sketchbook.core.error.ValidationException;
import com.helios.sketchbook.model.ids.DatasetId;
import com.helios.sketchbook.model.ids.ObservationId;

import java.util.Objects;
import java.util.Optional;

/**
 * The data a wildcard proposition points to.
 *
 * Each kind renders a canonical token that is a valid identifier, so the token can
 * stand in place of the {@code %...%} text inside a formula.
 */
public interface WildCardReference {

    /**
     * Canonical token substituted into the processed formula.
     */
    String canonical();

    /**
     * Dataset this reference depends on, if any.
     */
    default Optional<DatasetId> dataset() {
        return Optional.empty();
    }

    /**
     * Observation this reference depends on, if any.
     */
    default Optional<ObservationId> observation() {
        return Optional.empty();
    }

    /** A single observation, written {@code dataset/observation}. */
    record ObservationReference(DatasetId datasetId, ObservationId observationId) implements WildCardReference {
        public ObservationReference {
            Objects.requireNonNull(datasetId, "Dataset cannot be null");
            Objects.requireNonNull(observationId, "Observation cannot be null");
        }

        @Override
        public String canonical() {
            return "observation_" + datasetId + "_" + observationId;
        }

        @Override
        public Optional<DatasetId> dataset() {
            return Optional.of(datasetId);
        }

        @Override
        public Optional<ObservationId> observation() {
            return Optional.of(observationId);
        }
    }

    /** A whole dataset interpreted as a trajectory, written {@code trajectory(dataset)}. */
    record TrajectoryReference(DatasetId datasetId) implements WildCardReference {
        @Override
        public String canonical() {
            return "trajectory_" + datasetId;
        }

        @Override
        public Optional<DatasetId> dataset() {
            return Optional.of(datasetId);
        }
    }

    /** Kinds of state-set queries over a dataset that optionally narrow to one observation. */
    enum StateSetKind {
        ATTRACTORS("attractors"),
        FIXED_POINTS("fixed_points"),
        TRAP_SPACES("trap_spaces");

        private final String keyword;

        StateSetKind(String keyword) {
            this.keyword = keyword;
        }

        public String keyword() {
            return keyword;
        }
    }

    /**
     * {@code attractors(d[, o])}, {@code fixed_points(d[, o])} or {@code trap_spaces(d[, o])}.
     * A null observation selects every observation of the dataset.
     */
    record StateSetReference(StateSetKind kind, DatasetId datasetId, ObservationId observationId)
            implements WildCardReference {
        public StateSetReference {
            Objects.requireNonNull(kind, "Kind cannot be null");
            Objects.requireNonNull(datasetId, "Dataset cannot be null");
        }

        @Override
        public String canonical() {
            return kind.keyword() + "_" + datasetId + "_" + (observationId != null ? observationId.asStr() : "all");
        }

        @Override
        public Optional<DatasetId> dataset() {
            return Optional.of(datasetId);
        }

        @Override
        public Optional<ObservationId> observation() {
            return Optional.ofNullable(observationId);
        }
    }

    /** Bounds on the number of attractors, written {@code attractor_count(min, max)}. */
    record AttractorCountReference(int minimal, int maximal) implements WildCardReference {
        public AttractorCountReference {
            if (minimal > maximal) {
                throw new ValidationException("`minimal` attractor count cannot be larger than `maximal`.");
            }
            if (minimal <= 0 || maximal <= 0) {
                throw new ValidationException("Attractor count must be larger than 0.");
            }
        }

        @Override
        public String canonical() {
            return "attractor_count_" + minimal + "_" + maximal;
        }
    }
}
