package com.helios.sketchbook.io;

import com.helios.sketchbook.core.error.ValidationException;
import com.helios.sketchbook.io.SketchData.DatasetData;
import com.helios.sketchbook.io.SketchData.DynPropertyData;
import com.helios.sketchbook.io.SketchData.LayoutNodeData;
import com.helios.sketchbook.io.SketchData.ModelData;
import com.helios.sketchbook.io.SketchData.ObservationData;
import com.helios.sketchbook.io.SketchData.RegulationData;
import com.helios.sketchbook.io.SketchData.StatPropertyData;
import com.helios.sketchbook.io.SketchData.UpdateFnData;
import com.helios.sketchbook.io.SketchData.VariableData;
import com.helios.sketchbook.model.Sketch;
import com.helios.sketchbook.model.ids.DatasetId;
import com.helios.sketchbook.model.ids.DynPropertyId;
import com.helios.sketchbook.model.ids.FunctionId;
import com.helios.sketchbook.model.ids.ObservationId;
import com.helios.sketchbook.model.ids.StatPropertyId;
import com.helios.sketchbook.model.ids.VarId;
import com.helios.sketchbook.model.network.Essentiality;
import com.helios.sketchbook.model.network.ModelState;
import com.helios.sketchbook.model.network.Monotonicity;
import com.helios.sketchbook.model.network.Regulation;
import com.helios.sketchbook.model.network.Variable;
import com.helios.sketchbook.model.observations.Dataset;
import com.helios.sketchbook.model.observations.Observation;
import com.helios.sketchbook.model.observations.ObservationManager;
import com.helios.sketchbook.model.properties.DynProperty;
import com.helios.sketchbook.model.properties.DynPropertyKind;
import com.helios.sketchbook.model.properties.DynPropertyType;
import com.helios.sketchbook.model.properties.PropertyManager;
import com.helios.sketchbook.model.properties.StatProperty;
import com.helios.sketchbook.model.properties.StatPropertyKind;
import com.helios.sketchbook.model.properties.StatPropertyType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Converts between the sketch model and its {@link SketchData} transfer objects.
 *
 * Everything exported is ordered by id, so equal sketches produce equal documents.
 */
public final class SketchDataMapper {

    private SketchDataMapper() {
    }

    // ==================== Import ====================

    /**
     * Builds a sketch from its transfer object.
     *
     * <p>Components are added in dependency order:
     * 1. Variables, then regulations, then update functions and layout.
     * 2. Datasets.
     * 3. Dynamic and static properties.
     *
     * @throws ValidationException if a value is malformed or a component is duplicated.
     * @throws com.helios.sketchbook.core.error.ReferenceException if a component names a missing variable.
     */
    public static Sketch toSketch(SketchData data) {
        Sketch sketch = new Sketch();
        if (data.model() != null) {
            fillModel(sketch.model(), data.model());
        }
        for (DatasetData dataset : data.datasets()) {
            sketch.observations().addDataset(toDataset(dataset));
        }
        PropertyManager properties = sketch.properties();
        for (DynPropertyData property : data.dynProperties()) {
            properties.addDynamic(DynPropertyId.of(requireField(property.id(), "dynamic property id")),
                    toDynProperty(property));
        }
        for (StatPropertyData property : data.statProperties()) {
            properties.addStatic(StatPropertyId.of(requireField(property.id(), "static property id")),
                    toStatProperty(property));
        }
        sketch.setAnnotation(data.annotation());
        return sketch;
    }

    static void fillModel(ModelState model, ModelData data) {
        for (VariableData variable : data.variables()) {
            addVariable(model, variable);
        }
        for (RegulationData regulation : data.regulations()) {
            model.addRegulation(
                    VarId.of(requireField(regulation.regulator(), "regulator")),
                    VarId.of(requireField(regulation.target(), "regulation target")),
                    parseEnum(regulation.sign(), Monotonicity::fromString, Monotonicity.UNKNOWN, "sign"),
                    parseEnum(regulation.essential(), Essentiality::fromString, Essentiality.UNKNOWN, "essential"));
        }
        for (UpdateFnData function : data.updateFunctions()) {
            model.setUpdateFunction(VarId.of(requireField(function.variable(), "update function variable")),
                    function.expression());
        }
        for (LayoutNodeData node : data.layout()) {
            model.setPosition(VarId.of(requireField(node.variable(), "layout variable")), node.px(), node.py());
        }
    }

    static void addVariable(ModelState model, VariableData data) {
        VarId id = VarId.of(requireField(data.id(), "variable id"));
        model.addVariable(id, data.name() != null ? data.name() : id.asStr());
        if (data.annotation() != null) {
            model.setVariableAnnotation(id, data.annotation());
        }
    }

    public static Dataset toDataset(DatasetData data) {
        DatasetId id = DatasetId.of(requireField(data.id(), "dataset id"));
        List<VarId> variables = data.variables().stream().map(VarId::of).toList();
        List<Observation> observations = new ArrayList<>();
        for (ObservationData observation : data.observations()) {
            Observation parsed = Observation.fromValueString(
                    requireField(observation.id(), "observation id"),
                    requireField(observation.values(), "observation values"));
            String name = observation.name() != null ? observation.name() : parsed.name();
            observations.add(new Observation(parsed.id(), name, parsed.values()));
        }
        return new Dataset(id, data.name(), variables, observations);
    }

    public static DynProperty toDynProperty(DynPropertyData data) {
        return toDynProperty(data, data.id());
    }

    /**
     * @param defaultName name used when the data carries none
     */
    public static DynProperty toDynProperty(DynPropertyData data, String defaultName) {
        DynPropertyKind kind = DynPropertyKind.fromString(data.variant());
        if (kind == null) {
            throw new ValidationException("Unknown dynamic property variant: " + data.variant());
        }
        String name = data.name() != null ? data.name() : defaultName;
        DatasetId dataset = optionalId(data.dataset(), DatasetId::of);
        ObservationId observation = optionalId(data.observation(), ObservationId::of);
        DynProperty property = switch (kind) {
            case GENERIC -> DynProperty.tryMkGeneric(name, requireField(data.formula(), "formula"));
            case EXISTS_FIXED_POINT -> DynProperty.mkFixedPoint(name, dataset, observation);
            case EXISTS_TRAP_SPACE -> DynProperty.mkTrapSpace(name, dataset, observation,
                    Boolean.TRUE.equals(data.minimal()), Boolean.TRUE.equals(data.nonpercolable()));
            case EXISTS_TRAJECTORY -> DynProperty.mkTrajectory(name, dataset);
            case ATTRACTOR_COUNT -> DynProperty.tryMkAttractorCount(name,
                    requireField(data.minimalCount(), "minimal_count"),
                    requireField(data.maximalCount(), "maximal_count"));
            case HAS_ATTRACTOR -> DynProperty.mkHasAttractor(name, dataset, observation);
        };
        property.setAnnotation(data.annotation());
        return property;
    }

    public static StatProperty toStatProperty(StatPropertyData data) {
        return toStatProperty(data, data.id());
    }

    public static StatProperty toStatProperty(StatPropertyData data, String defaultName) {
        StatPropertyKind kind = StatPropertyKind.fromString(data.variant());
        if (kind == null) {
            throw new ValidationException("Unknown static property variant: " + data.variant());
        }
        String name = data.name() != null ? data.name() : defaultName;
        if (kind == StatPropertyKind.GENERIC) {
            StatProperty property = StatProperty.tryMkGeneric(name, requireField(data.formula(), "formula"));
            property.setAnnotation(data.annotation());
            return property;
        }
        VarId input = optionalId(data.input(), VarId::of);
        VarId target = optionalId(data.target(), VarId::of);
        FunctionId function = optionalId(data.target(), FunctionId::of);
        StatPropertyType variant = switch (kind) {
            case REGULATION_ESSENTIAL -> new StatPropertyType.RegulationEssential(input, target, essentiality(data));
            case REGULATION_ESSENTIAL_CONTEXT -> new StatPropertyType.RegulationEssentialContext(
                    input, target, essentiality(data), data.context());
            case REGULATION_MONOTONIC -> new StatPropertyType.RegulationMonotonic(input, target, monotonicity(data));
            case REGULATION_MONOTONIC_CONTEXT -> new StatPropertyType.RegulationMonotonicContext(
                    input, target, monotonicity(data), data.context());
            case FN_INPUT_ESSENTIAL -> new StatPropertyType.FnInputEssential(
                    data.inputIndex(), function, essentiality(data));
            case FN_INPUT_ESSENTIAL_CONTEXT -> new StatPropertyType.FnInputEssentialContext(
                    data.inputIndex(), function, essentiality(data), data.context());
            case FN_INPUT_MONOTONIC -> new StatPropertyType.FnInputMonotonic(
                    data.inputIndex(), function, monotonicity(data));
            case FN_INPUT_MONOTONIC_CONTEXT -> new StatPropertyType.FnInputMonotonicContext(
                    data.inputIndex(), function, monotonicity(data), data.context());
            case GENERIC -> throw new IllegalStateException("unreachable");
        };
        return StatProperty.of(name, data.annotation(), variant);
    }

    // ==================== Export ====================

    public static SketchData fromSketch(Sketch sketch) {
        List<DatasetData> datasets = sketch.observations().datasets().stream()
                .map(SketchDataMapper::fromDataset)
                .toList();
        List<DynPropertyData> dynProperties = new ArrayList<>();
        for (Map.Entry<DynPropertyId, DynProperty> entry : sketch.properties().sortedDynProps()) {
            dynProperties.add(fromDynProperty(entry.getKey(), entry.getValue()));
        }
        List<StatPropertyData> statProperties = new ArrayList<>();
        for (Map.Entry<StatPropertyId, StatProperty> entry : sketch.properties().sortedStatProps()) {
            statProperties.add(fromStatProperty(entry.getKey(), entry.getValue()));
        }
        return new SketchData(fromModel(sketch.model()), datasets, dynProperties, statProperties,
                sketch.annotation());
    }

    static ModelData fromModel(ModelState model) {
        List<VariableData> variables = new ArrayList<>();
        List<UpdateFnData> functions = new ArrayList<>();
        List<LayoutNodeData> layout = new ArrayList<>();
        for (Variable variable : model.variables()) {
            variables.add(fromVariable(variable));
            model.updateFunction(variable.id()).ifPresent(
                    fn -> functions.add(new UpdateFnData(variable.id().asStr(), fn.asText())));
            model.position(variable.id()).ifPresent(
                    pos -> layout.add(new LayoutNodeData(variable.id().asStr(), pos.x(), pos.y())));
        }
        List<RegulationData> regulations = new ArrayList<>();
        for (Regulation regulation : model.regulations()) {
            regulations.add(new RegulationData(regulation.regulator().asStr(), regulation.target().asStr(),
                    regulation.monotonicity().name(), regulation.essentiality().name()));
        }
        return new ModelData(variables, regulations, functions, layout);
    }

    static VariableData fromVariable(Variable variable) {
        return new VariableData(variable.id().asStr(), variable.name(), variable.annotation());
    }

    public static DatasetData fromDataset(Dataset dataset) {
        List<ObservationData> observations = dataset.observations().stream()
                .map(o -> new ObservationData(o.id().asStr(), o.name(), o.valueString()))
                .toList();
        List<String> variables = dataset.variables().stream().map(VarId::asStr).toList();
        return new DatasetData(dataset.id().asStr(), dataset.name(), variables, observations);
    }

    public static DynPropertyData fromDynProperty(DynPropertyId id, DynProperty property) {
        DynPropertyType variant = property.getVariant();
        String formula = null;
        DatasetId dataset = null;
        ObservationId observation = null;
        Boolean minimal = null;
        Boolean nonpercolable = null;
        Integer minimalCount = null;
        Integer maximalCount = null;
        if (variant instanceof DynPropertyType.GenericDynProp v) {
            formula = v.rawFormula();
        } else if (variant instanceof DynPropertyType.ExistsFixedPoint v) {
            dataset = v.dataset();
            observation = v.observation();
        } else if (variant instanceof DynPropertyType.ExistsTrapSpace v) {
            dataset = v.dataset();
            observation = v.observation();
            minimal = v.minimal();
            nonpercolable = v.nonpercolable();
        } else if (variant instanceof DynPropertyType.ExistsTrajectory v) {
            dataset = v.dataset();
        } else if (variant instanceof DynPropertyType.AttractorCount v) {
            minimalCount = v.minimal();
            maximalCount = v.maximal();
        } else if (variant instanceof DynPropertyType.HasAttractor v) {
            dataset = v.dataset();
            observation = v.observation();
        }
        return new DynPropertyData(id.asStr(), property.getName(), property.getAnnotation(),
                variant.kind().tag(), formula, idString(dataset), idString(observation),
                minimal, nonpercolable, minimalCount, maximalCount);
    }

    public static StatPropertyData fromStatProperty(StatPropertyId id, StatProperty property) {
        StatPropertyType variant = property.getVariant();
        String formula = null;
        String input = null;
        Integer inputIndex = null;
        String target = null;
        String value = null;
        String context = null;
        if (variant instanceof StatPropertyType.GenericStatProp v) {
            formula = v.rawFormula();
        } else if (variant instanceof StatPropertyType.RegulationTemplate v) {
            input = idString(v.input());
            target = idString(v.target());
        } else if (variant instanceof StatPropertyType.FnInputTemplate v) {
            inputIndex = v.inputIndex();
            target = idString(v.target());
        }
        if (variant instanceof StatPropertyType.RegulationEssential v) {
            value = v.value().name();
        } else if (variant instanceof StatPropertyType.RegulationEssentialContext v) {
            value = v.value().name();
        } else if (variant instanceof StatPropertyType.RegulationMonotonic v) {
            value = v.value().name();
        } else if (variant instanceof StatPropertyType.RegulationMonotonicContext v) {
            value = v.value().name();
        } else if (variant instanceof StatPropertyType.FnInputEssential v) {
            value = v.value().name();
        } else if (variant instanceof StatPropertyType.FnInputEssentialContext v) {
            value = v.value().name();
        } else if (variant instanceof StatPropertyType.FnInputMonotonic v) {
            value = v.value().name();
        } else if (variant instanceof StatPropertyType.FnInputMonotonicContext v) {
            value = v.value().name();
        }
        if (variant instanceof StatPropertyType.Contextual v) {
            context = v.context();
        }
        return new StatPropertyData(id.asStr(), property.getName(), property.getAnnotation(),
                variant.kind().tag(), formula, input, inputIndex, target, value, context);
    }

    // ==================== Helpers ====================

    private static Essentiality essentiality(StatPropertyData data) {
        return parseEnum(data.value(), Essentiality::fromString, Essentiality.TRUE, "value");
    }

    private static Monotonicity monotonicity(StatPropertyData data) {
        return parseEnum(data.value(), Monotonicity::fromString, Monotonicity.ACTIVATION, "value");
    }

    private static <E> E parseEnum(String text, Function<String, E> parser, E fallback, String field) {
        if (text == null) {
            return fallback;
        }
        E value = parser.apply(text);
        if (value == null) {
            throw new ValidationException("Invalid value '" + text + "' of field '" + field + "'");
        }
        return value;
    }

    private static <T> T optionalId(String text, Function<String, T> factory) {
        return text == null || text.isBlank() ? null : factory.apply(text);
    }

    private static String idString(Object id) {
        return id != null ? id.toString() : null;
    }

    private static <T> T requireField(T value, String field) {
        if (value == null) {
            throw new ValidationException("Missing required field '" + field + "'");
        }
        return value;
    }
}
