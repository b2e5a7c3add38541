package com.helios.sketchbook.engine.explicit;

import com.helios.sketchbook.core.error.ExternalEngineException;
import com.helios.sketchbook.engine.HctlModelChecker;
import com.helios.sketchbook.engine.SymbolicEngine;
import com.helios.sketchbook.engine.TransitionGraph;
import com.helios.sketchbook.infra.config.InferenceConfig;
import com.helios.sketchbook.model.network.BooleanNetwork;

import java.util.logging.Logger;

/**
 * Engine for small networks: enumerates every admissible parameterization and explores the
 * asynchronous state space of each one.
 *
 * <p>Limits:
 * <ul>
 *   <li>at most {@link InferenceConfig#getMaxVariables()} variables,</li>
 *   <li>at most {@link InferenceConfig#getMaxColors()} colours,</li>
 *   <li>at most four regulators per implicit variable and six per explicit one.</li>
 * </ul>
 * Temporal formulas are delegated to an optional {@link HctlModelChecker}.
 */
public class ExplicitEngine implements SymbolicEngine {
    private static final Logger logger = Logger.getLogger(ExplicitEngine.class.getName());

    private final InferenceConfig config;
    private final HctlModelChecker modelChecker;

    public ExplicitEngine(InferenceConfig config) {
        this(config, null);
    }

    public ExplicitEngine(InferenceConfig config, HctlModelChecker modelChecker) {
        this.config = config;
        this.modelChecker = modelChecker;
    }

    @Override
    public TransitionGraph buildGraph(BooleanNetwork network) {
        if (network.numVars() > config.getMaxVariables()) {
            throw new ExternalEngineException("Network has " + network.numVars()
                    + " variables; the explicit engine supports at most " + config.getMaxVariables());
        }
        ParameterSpace space = ParameterSpace.build(network, config.getMaxColors());
        logger.info(String.format("Built transition graph: variables=%d, states=%d, colours=%d",
                network.numVars(), 1L << network.numVars(), space.colorCount()));
        return new ExplicitTransitionGraph(network, space, modelChecker);
    }
}
