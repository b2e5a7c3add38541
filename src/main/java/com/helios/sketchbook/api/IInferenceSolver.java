package com.helios.sketchbook.api;

import com.helios.sketchbook.core.inference.InferenceResults;
import com.helios.sketchbook.core.inference.InferenceStatus;
import com.helios.sketchbook.model.Sketch;

/**
 * Contract for a single-use inference run over a sketch.
 */
public interface IInferenceSolver {

    /**
     * Runs the staged pipeline to completion.
     *
     * @param sketch sketch to evaluate
     * @return summary of the finished run
     * @throws com.helios.sketchbook.core.error.SketchException if any stage fails; the solver is then in ERROR
     */
    InferenceResults run(Sketch sketch);

    /**
     * Requests cancellation. Safe to call from any thread.
     */
    void cancel();

    InferenceStatus currentStatus();
}
