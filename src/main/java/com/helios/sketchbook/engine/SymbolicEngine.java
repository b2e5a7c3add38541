package com.helios.sketchbook.engine;

import com.helios.sketchbook.model.network.BooleanNetwork;

/**
 * Entry point of a symbolic engine.
 */
public interface SymbolicEngine {

    /**
     * @throws com.helios.sketchbook.core.error.ExternalEngineException if the network cannot be encoded.
     */
    TransitionGraph buildGraph(BooleanNetwork network);
}
