package com.helios.sketchbook.engine;

import com.helios.sketchbook.model.ids.VarId;
import com.helios.sketchbook.model.network.expr.FnExpr;
import com.helios.sketchbook.model.properties.wildcard.WildCardProposition;

import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Coloured asynchronous transition graph of a partially specified network.
 *
 * <p>Template evaluators receive the selected observations as {@link PartialState}s. Each returns the
 * colours for which the requirement holds for <b>every</b> given sub-space.
 */
public interface TransitionGraph {

    /** All admissible colours: every parameterization consistent with the regulation constraints. */
    ColorSet mkUnitColors();

    ColorSet mkConstant(boolean value);

    UpdatePredicate mkUpdateFunctionTrue(VarId var);

    /** Colours in which {@code regulator} has an observable effect on the function. */
    ColorSet mkObservability(UpdatePredicate predicate, VarId regulator);

    /** Colours in which the function is non-decreasing in {@code regulator}. */
    ColorSet mkActivation(UpdatePredicate predicate, VarId regulator);

    /** Colours in which the function is non-increasing in {@code regulator}. */
    ColorSet mkInhibition(UpdatePredicate predicate, VarId regulator);

    ColorSet evalHctl(String formula, List<WildCardProposition> wildCards);

    default ColorSet evalHctl(String formula) {
        return evalHctl(formula, List.of());
    }

    /** Every sub-space contains a fixed point. */
    ColorSet fixedPointColors(List<PartialState> observations);

    /** Every sub-space intersects an attractor. */
    ColorSet attractorColors(List<PartialState> observations);

    /** Every sub-space is a trap space, optionally also minimal and/or non-percolable. */
    ColorSet trapSpaceColors(List<PartialState> observations, boolean minimal, boolean nonpercolable);

    /** The sub-spaces can be visited in the given order along one path. */
    ColorSet trajectoryColors(List<PartialState> observations);

    /** The number of attractors lies in {@code [minimal, maximal]}. */
    ColorSet attractorCountColors(int minimal, int maximal);

    /**
     * Number of distinct update functions {@code var} takes across the given colours.
     */
    long countUpdateFunctions(VarId var, ColorSet colors);

    /**
     * Picks one colour of a non-empty set, uniformly at random.
     *
     * @return singleton set holding the picked colour
     */
    ColorSet pickRandomColor(ColorSet colors, Random random);

    /**
     * Update functions of the single colour in {@code color}, in network variable order.
     */
    Map<VarId, FnExpr> witnessFunctions(ColorSet color);
}
