package com.helios.sketchbook.model.observations;

import com.helios.sketchbook.core.error.ReferenceException;
import com.helios.sketchbook.core.error.ValidationException;
import com.helios.sketchbook.model.ids.DatasetId;
import com.helios.sketchbook.model.ids.ObservationId;
import com.helios.sketchbook.model.ids.VarId;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * An ordered list of observations over a fixed list of variables.
 */
public record Dataset(DatasetId id, String name, List<VarId> variables, List<Observation> observations) {

    public Dataset {
        Objects.requireNonNull(id, "Dataset id cannot be null");
        name = name != null ? name : id.asStr();
        variables = List.copyOf(variables);
        observations = List.copyOf(observations);

        if (new HashSet<>(variables).size() != variables.size()) {
            throw new ValidationException("Dataset '" + id + "' lists a variable more than once");
        }
        Set<ObservationId> seen = new HashSet<>();
        for (Observation observation : observations) {
            if (!seen.add(observation.id())) {
                throw new ValidationException("Dataset '" + id + "' contains duplicate observation '"
                        + observation.id() + "'");
            }
            if (observation.values().size() != variables.size()) {
                throw new ValidationException("Observation '" + observation.id() + "' has "
                        + observation.values().size() + " values, dataset '" + id + "' has "
                        + variables.size() + " variables");
            }
        }
    }

    public Optional<Observation> findObservation(ObservationId observationId) {
        return observations.stream().filter(o -> o.id().equals(observationId)).findFirst();
    }

    public Observation getObservation(ObservationId observationId) {
        return findObservation(observationId).orElseThrow(() -> new ReferenceException(
                "Observation '" + observationId + "' does not exist in dataset '" + id + "'"));
    }

    public boolean isEmpty() {
        return observations.isEmpty();
    }
}
