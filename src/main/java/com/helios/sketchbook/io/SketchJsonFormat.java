package com.helios.sketchbook.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.helios.sketchbook.core.error.ValidationException;
import com.helios.sketchbook.model.Sketch;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * Reads and writes sketches as JSON documents.
 *
 * <pre>
 * { "model": { "variables", "regulations", "update_functions", "layout" },
 *   "datasets": [...], "dyn_properties": [...], "stat_properties": [...], "annotation": "..." }
 * </pre>
 */
public class SketchJsonFormat {
    private static final Logger logger = Logger.getLogger(SketchJsonFormat.class.getName());

    private final ObjectMapper objectMapper;

    public SketchJsonFormat() {
        this.objectMapper = new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * @throws ValidationException if the document is not valid JSON or describes an invalid sketch.
     */
    public Sketch read(String json) {
        SketchData data;
        try {
            data = objectMapper.readValue(json, SketchData.class);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Invalid sketch JSON: " + e.getOriginalMessage(), e);
        }
        if (data == null) {
            throw new ValidationException("Invalid sketch JSON: empty document");
        }
        Sketch sketch = SketchDataMapper.toSketch(data);
        logger.fine(() -> "Read sketch with " + sketch.model().numVars() + " variables");
        return sketch;
    }

    public Sketch read(Path path) throws IOException {
        logger.info("Loading sketch from " + path);
        return read(Files.readString(path));
    }

    public String write(Sketch sketch) {
        try {
            return objectMapper.writeValueAsString(SketchDataMapper.fromSketch(sketch));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize sketch", e);
        }
    }

    public void write(Sketch sketch, Path path) throws IOException {
        Files.writeString(path, write(sketch));
        logger.info("Sketch written to " + path);
    }
}
