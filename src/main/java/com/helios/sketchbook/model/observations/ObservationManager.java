package com.helios.sketchbook.model.observations;

import com.helios.sketchbook.core.error.ReferenceException;
import com.helios.sketchbook.core.error.ValidationException;
import com.helios.sketchbook.model.ids.DatasetId;
import com.helios.sketchbook.model.ids.ObservationId;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Collection of datasets keyed by id.
 */
public class ObservationManager {

    private final Map<DatasetId, Dataset> datasets = new TreeMap<>();

    public void addDataset(Dataset dataset) {
        if (datasets.containsKey(dataset.id())) {
            throw new ValidationException("Dataset '" + dataset.id() + "' already exists");
        }
        datasets.put(dataset.id(), dataset);
    }

    public Dataset getDataset(DatasetId id) {
        Dataset dataset = datasets.get(id);
        if (dataset == null) {
            throw new ReferenceException("Dataset '" + id + "' does not exist");
        }
        return dataset;
    }

    public boolean isValidDataset(DatasetId id) {
        return datasets.containsKey(id);
    }

    public boolean isValidObservation(DatasetId datasetId, ObservationId observationId) {
        Dataset dataset = datasets.get(datasetId);
        return dataset != null && dataset.findObservation(observationId).isPresent();
    }

    public void removeDataset(DatasetId id) {
        if (datasets.remove(id) == null) {
            throw new ReferenceException("Dataset '" + id + "' does not exist");
        }
    }

    /**
     * Datasets sorted by id.
     */
    public List<Dataset> datasets() {
        return List.copyOf(datasets.values());
    }

    public int numDatasets() {
        return datasets.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ObservationManager other)) return false;
        return datasets.equals(other.datasets);
    }

    @Override
    public int hashCode() {
        return Objects.hash(datasets);
    }
}
