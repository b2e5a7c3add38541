package com.helios.sketchbook.engine;

import com.helios.sketchbook.model.properties.wildcard.WildCardProposition;

import java.util.List;

/**
 * Evaluates a hybrid CTL formula over a transition graph.
 *
 * <p>The formula is already canonical: every wildcard proposition has been replaced by its token,
 * and the propositions are handed over so the checker can bind the tokens to state or colour sets.
 *
 * @see com.helios.sketchbook.model.properties.wildcard.WildCardProcessor
 */
@FunctionalInterface
public interface HctlModelChecker {

    /**
     * @return colours for which the formula holds in every state.
     * @throws com.helios.sketchbook.core.error.ExternalEngineException if the formula cannot be evaluated.
     */
    ColorSet check(TransitionGraph graph, String formula, List<WildCardProposition> wildCards);
}
