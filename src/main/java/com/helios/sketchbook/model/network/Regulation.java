package com.helios.sketchbook.model.network;

import com.helios.sketchbook.model.ids.VarId;

import java.util.Comparator;
import java.util.Objects;

/**
 * A directed influence of {@code regulator} on {@code target}.
 */
public record Regulation(VarId regulator, VarId target, Monotonicity monotonicity, Essentiality essentiality) {

    /** Orders by target first, then regulator. */
    public static final Comparator<Regulation> ORDER =
            Comparator.comparing(Regulation::target).thenComparing(Regulation::regulator);

    public Regulation {
        Objects.requireNonNull(regulator, "Regulator cannot be null");
        Objects.requireNonNull(target, "Target cannot be null");
        monotonicity = monotonicity != null ? monotonicity : Monotonicity.UNKNOWN;
        essentiality = essentiality != null ? essentiality : Essentiality.UNKNOWN;
    }

    @Override
    public String toString() {
        String suffix = switch (essentiality) {
            case TRUE -> "";
            case FALSE -> "!";
            case UNKNOWN -> "?";
        };
        return regulator + " " + monotonicity.arrow() + suffix + " " + target;
    }
}
