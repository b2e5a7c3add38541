package com.helios.sketchbook.core.compiler;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.helios.sketchbook.api.IConstraintCompiler;
import com.helios.sketchbook.core.compiler.StaticConstraint.EssentialityConstraint;
import com.helios.sketchbook.core.compiler.StaticConstraint.MonotonicityConstraint;
import com.helios.sketchbook.core.error.NotYetSupportedException;
import com.helios.sketchbook.core.error.ReferenceException;
import com.helios.sketchbook.engine.ColorSet;
import com.helios.sketchbook.engine.TransitionGraph;
import com.helios.sketchbook.engine.UpdatePredicate;
import com.helios.sketchbook.infra.config.InferenceConfig;
import com.helios.sketchbook.model.ids.VarId;
import com.helios.sketchbook.model.network.BooleanNetwork;
import com.helios.sketchbook.model.network.Monotonicity;
import com.helios.sketchbook.model.properties.StatProperty;
import com.helios.sketchbook.model.properties.StatPropertyType;
import com.helios.sketchbook.model.properties.StatPropertyType.RegulationEssential;
import com.helios.sketchbook.model.properties.StatPropertyType.RegulationMonotonic;

import java.util.logging.Logger;

/**
 * Translates static property templates into colour sets of one transition graph.
 *
 * <p>Translation happens in two steps:
 * 1. {@link #resolve} checks the variant is supported and its variables exist (no graph needed).
 * 2. {@link #compile(StaticConstraint)} builds the colour set, reusing the update predicate of each
 *    target variable across properties.
 */
public class StaticConstraintCompiler implements IConstraintCompiler {
    private static final Logger logger = Logger.getLogger(StaticConstraintCompiler.class.getName());

    private final BooleanNetwork network;
    private final TransitionGraph graph;
    private final Cache<VarId, UpdatePredicate> predicateCache;

    public StaticConstraintCompiler(BooleanNetwork network, TransitionGraph graph, InferenceConfig config) {
        this.network = network;
        this.graph = graph;
        this.predicateCache = Caffeine.newBuilder()
                .maximumSize(config.getPredicateCacheSize())
                .recordStats()
                .build();
    }

    /**
     * Resolves a static property into a constraint.
     *
     * @throws NotYetSupportedException for generic formulas, context variants, function-input variants
     *                                  and dual monotonicity
     * @throws ReferenceException if the input or target is missing or not a network variable
     */
    public static StaticConstraint resolve(StatProperty property, BooleanNetwork network) {
        StatPropertyType variant = property.getVariant();
        if (variant instanceof RegulationEssential v) {
            return new EssentialityConstraint(
                    requireVariable(property, v.input(), "input", network),
                    requireVariable(property, v.target(), "target", network),
                    v.value());
        }
        if (variant instanceof RegulationMonotonic v) {
            if (v.value() == Monotonicity.DUAL) {
                throw new NotYetSupportedException("Monotonicity of type `dual` is not yet supported "
                        + "(property '" + property.getName() + "')");
            }
            return new MonotonicityConstraint(
                    requireVariable(property, v.input(), "input", network),
                    requireVariable(property, v.target(), "target", network),
                    v.value());
        }
        throw new NotYetSupportedException("Static properties of type " + variant.kind().tag()
                + " are not yet supported (property '" + property.getName() + "')");
    }

    @Override
    public ColorSet compile(StatProperty property) {
        return compile(resolve(property, network));
    }

    public ColorSet compile(StaticConstraint constraint) {
        ColorSet result;
        if (constraint instanceof EssentialityConstraint c) {
            result = switch (c.value()) {
                case TRUE -> graph.mkObservability(updatePredicate(c.target()), c.input());
                case FALSE, UNKNOWN -> graph.mkConstant(true);
            };
        } else if (constraint instanceof MonotonicityConstraint c) {
            result = switch (c.value()) {
                case ACTIVATION -> graph.mkActivation(updatePredicate(c.target()), c.input());
                case INHIBITION -> graph.mkInhibition(updatePredicate(c.target()), c.input());
                case UNKNOWN -> graph.mkConstant(true);
                case DUAL -> throw new NotYetSupportedException("Monotonicity of type `dual` is not yet supported");
            };
        } else {
            throw new NotYetSupportedException("Unknown static constraint: " + constraint);
        }
        return result.intersect(graph.mkUnitColors());
    }

    public long cachedPredicateHits() {
        return predicateCache.stats().hitCount();
    }

    private UpdatePredicate updatePredicate(VarId target) {
        return predicateCache.get(target, var -> {
            logger.fine("Building update predicate for " + var);
            return graph.mkUpdateFunctionTrue(var);
        });
    }

    private static VarId requireVariable(StatProperty property, VarId var, String role, BooleanNetwork network) {
        if (var == null) {
            throw new ReferenceException("Property '" + property.getName() + "' has no " + role + " variable");
        }
        if (!network.hasVariable(var)) {
            throw new ReferenceException("Property '" + property.getName() + "' references unknown " + role
                    + " variable '" + var + "'");
        }
        return var;
    }
}
