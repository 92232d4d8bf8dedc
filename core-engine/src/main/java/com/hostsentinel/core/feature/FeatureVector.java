package com.hostsentinel.core.feature;

import java.util.Arrays;
import java.util.Objects;

/**
 * Fixed-width numeric projection of one snapshot for one {@link FeatureFamily}.
 *
 * @since 1.0.0
 */
public final class FeatureVector {

    private final FeatureFamily family;
    private final double[] values;

    FeatureVector(FeatureFamily family, double[] values) {
        this.family = Objects.requireNonNull(family, "family must not be null");
        if (values.length != family.width()) {
            throw new IllegalArgumentException("Expected " + family.width()
                    + " values for " + family + ", got " + values.length);
        }
        this.values = values.clone();
    }

    public FeatureFamily getFamily() {
        return family;
    }

    /**
     * @return a copy of the values, in the family's field order
     */
    public double[] toArray() {
        return values.clone();
    }

    public double get(int position) {
        return values[position];
    }

    public int width() {
        return values.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FeatureVector that))
            return false;
        return family == that.family && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return 31 * family.hashCode() + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "FeatureVector{" + family + "=" + Arrays.toString(values) + '}';
    }
}
