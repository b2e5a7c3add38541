package com.helios.sketchbook.engine;

import com.helios.sketchbook.model.ids.VarId;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * A sub-space of network states: variables listed in {@code values} are fixed, the rest are free.
 */
public record PartialState(Map<VarId, Boolean> values) {

    public PartialState {
        values = Collections.unmodifiableMap(new TreeMap<>(values));
    }

    public boolean isFixed(VarId var) {
        return values.containsKey(var);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        values.forEach((k, v) -> sb.append(sb.length() > 1 ? ", " : "").append(k).append('=').append(v ? 1 : 0));
        return sb.append('}').toString();
    }
}
