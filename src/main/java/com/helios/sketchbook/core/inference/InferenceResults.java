package com.helios.sketchbook.core.inference;

import com.helios.sketchbook.model.ids.VarId;

import java.math.BigInteger;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Summary of a finished inference run.
 *
 * @param updateFunctionCounts number of distinct update functions each variable takes across the result
 */
public record InferenceResults(
        InferenceType type,
        BigInteger numSatNetworks,
        double approxSatNetworks,
        long totalTimeMs,
        String summary,
        List<InferenceStatusReport> progress,
        Map<VarId, Long> updateFunctionCounts
) {
    public InferenceResults {
        progress = List.copyOf(progress);
        updateFunctionCounts = Collections.unmodifiableMap(new TreeMap<>(updateFunctionCounts));
    }
}
