package com.helios.sketchbook.engine.explicit;

import com.helios.sketchbook.engine.UpdatePredicate;
import com.helios.sketchbook.model.ids.VarId;

import java.util.List;

/**
 * Update function of one variable, read from the parameter space per colour.
 */
record ExplicitUpdatePredicate(VarId target, int varIndex, List<VarId> inputs) implements UpdatePredicate {
}
