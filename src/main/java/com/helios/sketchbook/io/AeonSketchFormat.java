package com.helios.sketchbook.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.helios.sketchbook.core.error.ValidationException;
import com.helios.sketchbook.io.SketchData.DatasetData;
import com.helios.sketchbook.io.SketchData.DynPropertyData;
import com.helios.sketchbook.io.SketchData.StatPropertyData;
import com.helios.sketchbook.io.SketchData.VariableData;
import com.helios.sketchbook.model.Sketch;
import com.helios.sketchbook.model.ids.DynPropertyId;
import com.helios.sketchbook.model.ids.StatPropertyId;
import com.helios.sketchbook.model.ids.VarId;
import com.helios.sketchbook.model.network.Essentiality;
import com.helios.sketchbook.model.network.ModelState;
import com.helios.sketchbook.model.network.Monotonicity;
import com.helios.sketchbook.model.network.Regulation;
import com.helios.sketchbook.model.network.Variable;
import com.helios.sketchbook.model.observations.Dataset;
import com.helios.sketchbook.model.properties.DynProperty;
import com.helios.sketchbook.model.properties.StatProperty;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads and writes sketches in the annotated AEON text format.
 *
 * <pre>
 * A -> B                      regulation, essential
 * A -|? B                     inhibition of unknown essentiality ('!' marks a non-essential one)
 * $B: A &amp; !C                explicit update function
 * #position:A:10.0,20.5       layout
 * #!dataset: d1: #`{...}`#    entity block holding a JSON object
 * </pre>
 *
 * Entity block types are {@code variable}, {@code dataset}, {@code dynamic_property},
 * {@code static_property} and {@code sketch} (whose {@code annotation} entity holds a JSON string).
 * Other lines starting with {@code #} are comments.
 */
public class AeonSketchFormat {
    private static final Logger logger = Logger.getLogger(AeonSketchFormat.class.getName());

    static final String VARIABLE_BLOCK = "variable";
    static final String DATASET_BLOCK = "dataset";
    static final String DYNAMIC_BLOCK = "dynamic_property";
    static final String STATIC_BLOCK = "static_property";
    static final String SKETCH_BLOCK = "sketch";
    static final String ANNOTATION_ENTITY = "annotation";

    private static final String IDENT = "[a-zA-Z_][a-zA-Z0-9_]*";
    private static final Pattern REGULATION = Pattern.compile(
            "^\\s*(" + IDENT + ")\\s*(->|-\\||-\\*|-\\?)([?!]?)\\s*(" + IDENT + ")\\s*$");
    private static final Pattern UPDATE_FUNCTION = Pattern.compile("^\\s*\\$\\s*(" + IDENT + ")\\s*:(.*)$");
    private static final Pattern POSITION = Pattern.compile(
            "^\\s*#position:(" + IDENT + "):\\s*([-+0-9.eE]+)\\s*,\\s*([-+0-9.eE]+)\\s*$");

    private final ObjectMapper objectMapper;

    public AeonSketchFormat() {
        this.objectMapper = new ObjectMapper()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    // ==================== Import ====================

    /**
     * Parses a sketch.
     *
     * <p>Parsing happens in two passes:
     * 1. Every line is classified; variables are collected from all regulation, update, layout and
     *    variable-block lines.
     * 2. The model is assembled (variables, regulations, update functions, layout), followed by
     *    datasets, properties and the annotation.
     *
     * @throws ValidationException for malformed lines, blocks or values.
     */
    public Sketch read(String text) {
        EntityBlockReader blocks = new EntityBlockReader();
        List<Matcher> regulations = new ArrayList<>();
        Map<String, String> updateFunctions = new LinkedHashMap<>();
        List<Matcher> positions = new ArrayList<>();
        TreeSet<String> variableIds = new TreeSet<>();

        String[] lines = text.split("\\R");
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            if (line.isBlank()) {
                continue;
            }
            if (EntityBlockReader.isEntityBlock(line)) {
                blocks.accept(line);
                continue;
            }
            Matcher position = POSITION.matcher(line);
            if (position.matches()) {
                positions.add(position);
                variableIds.add(position.group(1));
                continue;
            }
            if (line.trim().startsWith("#")) {
                continue;
            }
            Matcher regulation = REGULATION.matcher(line);
            if (regulation.matches()) {
                regulations.add(regulation);
                variableIds.add(regulation.group(1));
                variableIds.add(regulation.group(4));
                continue;
            }
            Matcher function = UPDATE_FUNCTION.matcher(line);
            if (function.matches()) {
                if (updateFunctions.put(function.group(1), function.group(2).trim()) != null) {
                    throw new ValidationException("Line " + (i + 1) + ": duplicate update function of '"
                            + function.group(1) + "'");
                }
                variableIds.add(function.group(1));
                continue;
            }
            throw new ValidationException("Line " + (i + 1) + ": cannot parse '" + line.trim() + "'");
        }
        variableIds.addAll(blocks.entities(VARIABLE_BLOCK).keySet());

        Sketch sketch = new Sketch();
        ModelState model = sketch.model();
        for (String id : variableIds) {
            model.addVariableByStr(id);
        }
        for (Map.Entry<String, String> entry : blocks.entities(VARIABLE_BLOCK).entrySet()) {
            VariableData data = parseEntity(VARIABLE_BLOCK, entry, VariableData.class);
            checkEntityId(VARIABLE_BLOCK, entry.getKey(), data.id());
            VarId id = VarId.of(entry.getKey());
            if (data.name() != null) {
                model.setVariableName(id, data.name());
            }
            if (data.annotation() != null) {
                model.setVariableAnnotation(id, data.annotation());
            }
        }
        for (Matcher regulation : regulations) {
            model.addRegulation(VarId.of(regulation.group(1)), VarId.of(regulation.group(4)),
                    Monotonicity.fromArrow(regulation.group(2)), essentialityFromSuffix(regulation.group(3)));
        }
        for (Map.Entry<String, String> entry : updateFunctions.entrySet()) {
            model.setUpdateFunction(VarId.of(entry.getKey()), entry.getValue());
        }
        for (Matcher position : positions) {
            model.setPosition(VarId.of(position.group(1)), parseCoordinate(position.group(2)),
                    parseCoordinate(position.group(3)));
        }

        for (Map.Entry<String, String> entry : blocks.entities(DATASET_BLOCK).entrySet()) {
            DatasetData data = parseEntity(DATASET_BLOCK, entry, DatasetData.class);
            checkEntityId(DATASET_BLOCK, entry.getKey(), data.id());
            sketch.observations().addDataset(SketchDataMapper.toDataset(withId(data, entry.getKey())));
        }
        for (Map.Entry<String, String> entry : blocks.entities(DYNAMIC_BLOCK).entrySet()) {
            DynPropertyData data = parseEntity(DYNAMIC_BLOCK, entry, DynPropertyData.class);
            checkEntityId(DYNAMIC_BLOCK, entry.getKey(), data.id());
            DynProperty property = SketchDataMapper.toDynProperty(data, entry.getKey());
            sketch.properties().addDynamic(DynPropertyId.of(entry.getKey()), property);
        }
        for (Map.Entry<String, String> entry : blocks.entities(STATIC_BLOCK).entrySet()) {
            StatPropertyData data = parseEntity(STATIC_BLOCK, entry, StatPropertyData.class);
            checkEntityId(STATIC_BLOCK, entry.getKey(), data.id());
            StatProperty property = SketchDataMapper.toStatProperty(data, entry.getKey());
            sketch.properties().addStatic(StatPropertyId.of(entry.getKey()), property);
        }
        for (Map.Entry<String, String> entry : blocks.entities(SKETCH_BLOCK).entrySet()) {
            if (!entry.getKey().equals(ANNOTATION_ENTITY)) {
                throw new ValidationException("Unknown sketch entity '" + entry.getKey() + "'");
            }
            sketch.setAnnotation(parseEntity(SKETCH_BLOCK, entry, String.class));
        }
        for (String type : blocks.allEntities().keySet()) {
            if (!List.of(VARIABLE_BLOCK, DATASET_BLOCK, DYNAMIC_BLOCK, STATIC_BLOCK, SKETCH_BLOCK).contains(type)) {
                logger.warning("Ignoring entity blocks of unknown type '" + type + "'");
            }
        }

        logger.fine(() -> "Parsed AEON sketch: " + model.numVars() + " variables, "
                + model.regulations().size() + " regulations");
        return sketch;
    }

    public Sketch read(Path path) throws IOException {
        logger.info("Loading AEON sketch from " + path);
        return read(Files.readString(path));
    }

    // ==================== Export ====================

    public String write(Sketch sketch) {
        StringBuilder out = new StringBuilder();
        ModelState model = sketch.model();
        if (!sketch.annotation().isEmpty()) {
            appendBlock(out, SKETCH_BLOCK, ANNOTATION_ENTITY, sketch.annotation());
        }
        for (Variable variable : model.variables()) {
            appendBlock(out, VARIABLE_BLOCK, variable.id().asStr(), SketchDataMapper.fromVariable(variable));
        }
        for (Variable variable : model.variables()) {
            model.position(variable.id()).ifPresent(pos -> out.append("#position:").append(variable.id())
                    .append(':').append(pos.x()).append(',').append(pos.y()).append('\n'));
        }
        for (Regulation regulation : model.regulations()) {
            out.append(regulation).append('\n');
        }
        for (Variable variable : model.variables()) {
            model.updateFunction(variable.id()).ifPresent(fn -> out.append('$').append(variable.id())
                    .append(": ").append(fn.asText()).append('\n'));
        }
        for (Dataset dataset : sketch.observations().datasets()) {
            appendBlock(out, DATASET_BLOCK, dataset.id().asStr(), SketchDataMapper.fromDataset(dataset));
        }
        sketch.properties().sortedDynProps().forEach(e -> appendBlock(out, DYNAMIC_BLOCK, e.getKey().asStr(),
                SketchDataMapper.fromDynProperty(e.getKey(), e.getValue())));
        sketch.properties().sortedStatProps().forEach(e -> appendBlock(out, STATIC_BLOCK, e.getKey().asStr(),
                SketchDataMapper.fromStatProperty(e.getKey(), e.getValue())));
        return out.toString();
    }

    public void write(Sketch sketch, Path path) throws IOException {
        Files.writeString(path, write(sketch));
        logger.info("AEON sketch written to " + path);
    }

    // ==================== Helpers ====================

    private void appendBlock(StringBuilder out, String type, String id, Object value) {
        try {
            out.append(EntityBlockReader.formatBlock(type, id, objectMapper.writeValueAsString(value))).append('\n');
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize " + type + " '" + id + "'", e);
        }
    }

    private <T> T parseEntity(String type, Map.Entry<String, String> entry, Class<T> valueType) {
        try {
            T value = objectMapper.readValue(entry.getValue(), valueType);
            if (value == null) {
                throw new ValidationException("Entity '" + type + ":" + entry.getKey() + "' has an empty value");
            }
            return value;
        } catch (JsonProcessingException e) {
            throw new ValidationException("Invalid JSON in entity '" + type + ":" + entry.getKey() + "': "
                    + e.getOriginalMessage(), e);
        }
    }

    private static void checkEntityId(String type, String blockId, String dataId) {
        if (dataId != null && !dataId.equals(blockId)) {
            throw new ValidationException("Entity '" + type + ":" + blockId + "' declares a different id '"
                    + dataId + "'");
        }
    }

    private static DatasetData withId(DatasetData data, String id) {
        return new DatasetData(id, data.name(), data.variables(), data.observations());
    }

    private static Essentiality essentialityFromSuffix(String suffix) {
        return switch (suffix) {
            case "?" -> Essentiality.UNKNOWN;
            case "!" -> Essentiality.FALSE;
            default -> Essentiality.TRUE;
        };
    }

    private static double parseCoordinate(String text) {
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new ValidationException("Invalid layout coordinate '" + text + "'", e);
        }
    }
}
