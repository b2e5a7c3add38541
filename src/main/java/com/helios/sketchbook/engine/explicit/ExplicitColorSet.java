package com.helios.sketchbook.engine.explicit;

import com.helios.sketchbook.core.error.ExternalEngineException;
import com.helios.sketchbook.engine.ColorSet;
import org.roaringbitmap.RoaringBitmap;

import java.math.BigInteger;

/**
 * Colour set backed by a bitmap of colour indices.
 */
final class ExplicitColorSet implements ColorSet {

    private final ParameterSpace space;
    private final RoaringBitmap colors;

    ExplicitColorSet(ParameterSpace space, RoaringBitmap colors) {
        this.space = space;
        this.colors = colors;
    }

    static ExplicitColorSet empty(ParameterSpace space) {
        return new ExplicitColorSet(space, new RoaringBitmap());
    }

    static ExplicitColorSet full(ParameterSpace space) {
        RoaringBitmap all = new RoaringBitmap();
        all.add(0L, (long) space.colorCount());
        return new ExplicitColorSet(space, all);
    }

    RoaringBitmap bitmap() {
        return colors;
    }

    @Override
    public ColorSet intersect(ColorSet other) {
        ExplicitColorSet that = cast(other);
        return new ExplicitColorSet(space, RoaringBitmap.and(colors, that.colors));
    }

    @Override
    public ColorSet minus(ColorSet other) {
        ExplicitColorSet that = cast(other);
        return new ExplicitColorSet(space, RoaringBitmap.andNot(colors, that.colors));
    }

    ExplicitColorSet cast(ColorSet other) {
        if (!(other instanceof ExplicitColorSet that) || that.space != space) {
            throw new ExternalEngineException("Colour sets of different transition graphs cannot be combined");
        }
        return that;
    }

    @Override
    public boolean isEmpty() {
        return colors.isEmpty();
    }

    @Override
    public BigInteger exactCardinality() {
        return BigInteger.valueOf(colors.getLongCardinality());
    }

    @Override
    public double approxCardinality() {
        return colors.getLongCardinality();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExplicitColorSet other)) return false;
        return space == other.space && colors.equals(other.colors);
    }

    @Override
    public int hashCode() {
        return colors.hashCode();
    }

    @Override
    public String toString() {
        return "ColorSet{cardinality=" + colors.getLongCardinality() + "}";
    }
}
