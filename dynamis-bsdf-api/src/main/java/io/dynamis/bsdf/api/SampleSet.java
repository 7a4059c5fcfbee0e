package io.dynamis.bsdf.api;

import java.util.Arrays;
import java.util.Collection;

/**
 * Immutable, ordered, de-duplicated sequence of sample values.
 *
 * Used for incidence angles (radians) and wavelengths (nanometres).
 * Membership and de-duplication use exact double equality: samples are matched
 * against measurement values as recorded, never within a tolerance.
 */
public final class SampleSet {

    private final double[] values;

    private SampleSet(double[] values) {
        this.values = values;
    }

    /**
     * Sorts ascending and removes duplicates.
     * Used for wavelength sets.
     */
    public static SampleSet ascending(double... values) {
        double[] sorted = requireFinite(values).clone();
        Arrays.sort(sorted);
        return new SampleSet(dedupe(sorted));
    }

    public static SampleSet ascending(Collection<Double> values) {
        return ascending(toArray(values));
    }

    /**
     * Removes duplicates keeping the order of first occurrence.
     * Used for incidence sets resolved from measurements.
     */
    public static SampleSet inOrder(double... values) {
        return new SampleSet(dedupe(requireFinite(values)));
    }

    public static SampleSet inOrder(Collection<Double> values) {
        return inOrder(toArray(values));
    }

    public int size() { return values.length; }

    public boolean isEmpty() { return values.length == 0; }

    public double get(int index) { return values[index]; }

    public boolean contains(double value) {
        return indexOf(value) >= 0;
    }

    /** Index of the exactly equal sample, or -1. */
    public int indexOf(double value) {
        for (int i = 0; i < values.length; i++) {
            if (values[i] == value) {
                return i;
            }
        }
        return -1;
    }

    /** Defensive copy of the samples in order. */
    public double[] toArray() {
        return values.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SampleSet other)) {
            return false;
        }
        return Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "SampleSet" + Arrays.toString(values);
    }

    private static double[] dedupe(double[] values) {
        double[] out = new double[values.length];
        int count = 0;
        outer:
        for (double v : values) {
            for (int i = 0; i < count; i++) {
                if (out[i] == v) {
                    continue outer;
                }
            }
            // -0.0 + 0.0 == +0.0: stored samples carry no signed zero, so equals agrees with ==
            out[count++] = v + 0.0;
        }
        return Arrays.copyOf(out, count);
    }

    private static double[] requireFinite(double[] values) {
        if (values == null) {
            throw new NullPointerException("values must not be null");
        }
        for (double v : values) {
            if (!Double.isFinite(v)) {
                throw new IllegalArgumentException("sample must be finite; actual = " + v);
            }
        }
        return values;
    }

    private static double[] toArray(Collection<Double> values) {
        if (values == null) {
            throw new NullPointerException("values must not be null");
        }
        double[] out = new double[values.size()];
        int i = 0;
        for (Double v : values) {
            out[i++] = v;
        }
        return out;
    }
}
