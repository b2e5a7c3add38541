package com.helios.sketchbook.core.compiler;

import com.helios.sketchbook.model.ids.VarId;
import com.helios.sketchbook.model.network.Essentiality;
import com.helios.sketchbook.model.network.Monotonicity;

/**
 * A static property template with its references resolved against the network.
 */
public interface StaticConstraint {

    VarId input();

    VarId target();

    record EssentialityConstraint(VarId input, VarId target, Essentiality value) implements StaticConstraint {
    }

    record MonotonicityConstraint(VarId input, VarId target, Monotonicity value) implements StaticConstraint {
    }
}
