package com.helios.sketchbook.engine;

import java.math.BigInteger;

/**
 * An immutable set of parameterizations (colours) of a partially specified network.
 *
 * Sets produced by different {@link TransitionGraph} instances must not be mixed.
 */
public interface ColorSet {

    ColorSet intersect(ColorSet other);

    ColorSet minus(ColorSet other);

    boolean isEmpty();

    BigInteger exactCardinality();

    double approxCardinality();
}
