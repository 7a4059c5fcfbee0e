package io.dynamis.bsdf.simulation;

import io.dynamis.bsdf.api.AngularProfile;
import io.dynamis.bsdf.api.Branch;

import java.util.Arrays;
import java.util.Comparator;

/**
 * Piecewise-linear angular profile with constant-slope extrapolation.
 *
 * Inside the sampled range the profile interpolates linearly between neighbouring samples.
 * Outside it continues the first (or last) segment's slope indefinitely, so the profile is
 * defined for any finite angle. The polar reconstruction relies on this: the blend evaluates
 * the profile at incidence +/- d, which routinely falls outside the measured scan.
 */
public final class PiecewiseLinearProfile implements AngularProfile {

    private final Branch branch;
    private final double[] x;
    private final double[] y;

    /**
     * @param x strictly ascending abscissae, at least two
     * @param y ordinates, same length as x
     */
    public PiecewiseLinearProfile(Branch branch, double[] x, double[] y) {
        if (branch == null) {
            throw new NullPointerException("branch must not be null");
        }
        if (x.length != y.length) {
            throw new IllegalArgumentException(
                "x and y lengths differ: " + x.length + " vs " + y.length);
        }
        if (x.length < 2) {
            throw new IllegalArgumentException(
                "a linear profile needs at least two samples; actual = " + x.length);
        }
        for (int i = 1; i < x.length; i++) {
            if (!(x[i] > x[i - 1])) {
                throw new IllegalArgumentException(
                    "abscissae must be strictly ascending at index " + i);
            }
        }
        this.branch = branch;
        this.x = x.clone();
        this.y = y.clone();
    }

    /**
     * Builds a profile from unordered samples. Samples are sorted by angle and samples sharing
     * the same angle are averaged.
     *
     * @throws IllegalArgumentException if fewer than two distinct angles remain
     */
    public static PiecewiseLinearProfile fromSamples(Branch branch, double[] thetas,
                                                     double[] values) {
        if (thetas.length != values.length) {
            throw new IllegalArgumentException("thetas and values lengths differ");
        }
        Integer[] order = new Integer[thetas.length];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }
        Arrays.sort(order, Comparator.comparingDouble(i -> thetas[i]));

        double[] xs = new double[thetas.length];
        double[] ys = new double[thetas.length];
        int count = 0;
        int i = 0;
        while (i < order.length) {
            double theta = thetas[order[i]];
            double sum = 0.0;
            int n = 0;
            while (i < order.length && thetas[order[i]] == theta) {
                sum += values[order[i]];
                n++;
                i++;
            }
            xs[count] = theta;
            ys[count] = sum / n;
            count++;
        }
        return new PiecewiseLinearProfile(branch,
            Arrays.copyOf(xs, count), Arrays.copyOf(ys, count));
    }

    /** Number of distinct angles in the given samples. */
    public static int distinctCount(double[] thetas) {
        double[] sorted = thetas.clone();
        Arrays.sort(sorted);
        int count = 0;
        for (int i = 0; i < sorted.length; i++) {
            if (i == 0 || sorted[i] != sorted[i - 1]) {
                count++;
            }
        }
        return count;
    }

    @Override
    public Branch branch() { return branch; }

    @Override
    public double valueAt(double theta) {
        int idx = Arrays.binarySearch(x, theta);
        if (idx >= 0) {
            return y[idx];
        }
        // segment left of the insertion point, pinned to the end segments outside the range
        int seg = Math.max(0, Math.min(x.length - 2, -idx - 2));
        double slope = (y[seg + 1] - y[seg]) / (x[seg + 1] - x[seg]);
        return y[seg] + slope * (theta - x[seg]);
    }

    @Override
    public double minTheta() { return x[0]; }

    @Override
    public double maxTheta() { return x[x.length - 1]; }

    /** Number of distinct samples. */
    public int sampleCount() { return x.length; }

    @Override
    public String toString() {
        return "PiecewiseLinearProfile{" + branch + ", samples=" + x.length
            + ", range=[" + x[0] + ", " + x[x.length - 1] + "]}";
    }
}
