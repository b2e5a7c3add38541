package com.helios.sketchbook.model.observations;

import com.helios.sketchbook.model.ids.ObservationId;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A single (possibly partial) observation of the network state.
 *
 * Values are positional and follow the variable order of the owning dataset.
 */
public record Observation(ObservationId id, String name, List<VarValue> values) {

    public Observation {
        Objects.requireNonNull(id, "Observation id cannot be null");
        name = name != null ? name : id.asStr();
        values = List.copyOf(values);
    }

    /**
     * Parses a value string such as {@code "10*"}.
     */
    public static Observation fromValueString(String id, String values) {
        List<VarValue> parsed = new ArrayList<>(values.length());
        for (char c : values.toCharArray()) {
            parsed.add(VarValue.fromChar(c));
        }
        return new Observation(ObservationId.of(id), id, parsed);
    }

    public String valueString() {
        StringBuilder sb = new StringBuilder(values.size());
        for (VarValue value : values) {
            sb.append(value.symbol());
        }
        return sb.toString();
    }

    public boolean isFullySpecified() {
        return values.stream().noneMatch(v -> v == VarValue.ANY);
    }
}
