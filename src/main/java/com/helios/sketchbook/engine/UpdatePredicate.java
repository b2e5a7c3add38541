package com.helios.sketchbook.engine;

import com.helios.sketchbook.model.ids.VarId;

/**
 * Symbolic representation of "the update function of {@link #target()} evaluates to true",
 * parameterized by colour.
 */
public interface UpdatePredicate {

    VarId target();
}
