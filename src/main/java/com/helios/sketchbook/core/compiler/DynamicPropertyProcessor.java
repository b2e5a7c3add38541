package com.helios.sketchbook.core.compiler;

import com.helios.sketchbook.core.compiler.CompiledDynamicProperty.AttractorCountRange;
import com.helios.sketchbook.core.compiler.CompiledDynamicProperty.Attractors;
import com.helios.sketchbook.core.compiler.CompiledDynamicProperty.FixedPoints;
import com.helios.sketchbook.core.compiler.CompiledDynamicProperty.HctlFormula;
import com.helios.sketchbook.core.compiler.CompiledDynamicProperty.TrapSpaces;
import com.helios.sketchbook.core.compiler.CompiledDynamicProperty.Trajectory;
import com.helios.sketchbook.core.error.ReferenceException;
import com.helios.sketchbook.engine.PartialState;
import com.helios.sketchbook.model.ids.DatasetId;
import com.helios.sketchbook.model.ids.ObservationId;
import com.helios.sketchbook.model.ids.VarId;
import com.helios.sketchbook.model.network.BooleanNetwork;
import com.helios.sketchbook.model.observations.Dataset;
import com.helios.sketchbook.model.observations.Observation;
import com.helios.sketchbook.model.observations.ObservationManager;
import com.helios.sketchbook.model.observations.VarValue;
import com.helios.sketchbook.model.properties.DynProperty;
import com.helios.sketchbook.model.properties.DynPropertyType;
import com.helios.sketchbook.model.properties.wildcard.WildCardProposition;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Resolves dynamic properties against the datasets of a sketch.
 *
 * A template without an observation selects every observation of its dataset.
 */
public class DynamicPropertyProcessor {

    private final ObservationManager observations;
    private final BooleanNetwork network;

    public DynamicPropertyProcessor(ObservationManager observations, BooleanNetwork network) {
        this.observations = observations;
        this.network = network;
    }

    /**
     * @throws ReferenceException if the property references a missing dataset, observation or variable.
     */
    public CompiledDynamicProperty process(DynProperty property) {
        DynPropertyType variant = property.getVariant();
        if (variant instanceof DynPropertyType.GenericDynProp v) {
            for (WildCardProposition wildCard : v.wildCards()) {
                checkWildCard(property, wildCard);
            }
            return new HctlFormula(v.processedFormula(), v.wildCards());
        } else if (variant instanceof DynPropertyType.ExistsFixedPoint v) {
            return new FixedPoints(select(property, v.dataset(), v.observation()));
        } else if (variant instanceof DynPropertyType.HasAttractor v) {
            return new Attractors(select(property, v.dataset(), v.observation()));
        } else if (variant instanceof DynPropertyType.ExistsTrapSpace v) {
            return new TrapSpaces(select(property, v.dataset(), v.observation()), v.minimal(), v.nonpercolable());
        } else if (variant instanceof DynPropertyType.ExistsTrajectory v) {
            return new Trajectory(select(property, v.dataset(), null));
        } else if (variant instanceof DynPropertyType.AttractorCount v) {
            return new AttractorCountRange(v.minimal(), v.maximal());
        }
        throw new IllegalArgumentException("Unknown dynamic property variant: " + variant);
    }

    /**
     * Converts an observation of a dataset into a sub-space; unspecified values stay free.
     */
    public PartialState toPartialState(Dataset dataset, Observation observation) {
        Map<VarId, Boolean> values = new LinkedHashMap<>();
        for (int i = 0; i < dataset.variables().size(); i++) {
            VarId var = dataset.variables().get(i);
            if (!network.hasVariable(var)) {
                throw new ReferenceException("Dataset '" + dataset.id() + "' references unknown variable '" + var + "'");
            }
            VarValue value = observation.values().get(i);
            if (value != VarValue.ANY) {
                values.put(var, value == VarValue.TRUE);
            }
        }
        return new PartialState(values);
    }

    private List<PartialState> select(DynProperty property, DatasetId datasetId, ObservationId observationId) {
        if (datasetId == null) {
            throw new ReferenceException("Property '" + property.getName() + "' does not reference a dataset");
        }
        if (!observations.isValidDataset(datasetId)) {
            throw new ReferenceException("Property '" + property.getName() + "' references unknown dataset '"
                    + datasetId + "'");
        }
        Dataset dataset = observations.getDataset(datasetId);
        if (observationId != null) {
            return List.of(toPartialState(dataset, dataset.getObservation(observationId)));
        }
        return dataset.observations().stream()
                .map(o -> toPartialState(dataset, o))
                .collect(Collectors.toCollection(ArrayList::new));
    }

    private void checkWildCard(DynProperty property, WildCardProposition wildCard) {
        wildCard.reference().dataset().ifPresent(datasetId -> {
            if (!observations.isValidDataset(datasetId)) {
                throw new ReferenceException("Wild-card proposition %" + wildCard.origStr() + "% of property '"
                        + property.getName() + "' references unknown dataset '" + datasetId + "'");
            }
            wildCard.reference().observation().ifPresent(observationId -> {
                if (!observations.isValidObservation(datasetId, observationId)) {
                    throw new ReferenceException("Wild-card proposition %" + wildCard.origStr() + "% of property '"
                            + property.getName() + "' references unknown observation '" + observationId + "'");
                }
            });
        });
    }
}
