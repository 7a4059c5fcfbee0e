package io.dynamis.bsdf.simulation;

import java.util.Arrays;

/**
 * Degree-1 tensor-product spline over a rectilinear grid.
 *
 * Evaluation outside the grid clamps to the nearest edge, so quadrature nodes that land on
 * the domain bounds (or a rounding step past them) are always defined.
 */
public final class BilinearSurface {

    private final double[] xs;
    private final double[] ys;
    private final double[][] z;

    /**
     * @param xs ascending first-axis samples, at least two
     * @param ys ascending second-axis samples, at least two
     * @param z  values [x][y]; not copied
     */
    public BilinearSurface(double[] xs, double[] ys, double[][] z) {
        if (xs.length < 2 || ys.length < 2) {
            throw new IllegalArgumentException("bilinear surface needs at least 2x2 samples");
        }
        int columns = z.length == 0 ? 0 : z[0].length;
        if (z.length != xs.length || columns != ys.length) {
            throw new IllegalArgumentException(
                "value grid is " + z.length + "x" + columns
                    + ", expected " + xs.length + "x" + ys.length);
        }
        this.xs = xs;
        this.ys = ys;
        this.z = z;
    }

    public double evaluate(double x, double y) {
        int i = cell(xs, x);
        int j = cell(ys, y);
        double tx = fraction(xs, i, x);
        double ty = fraction(ys, j, y);
        double z00 = z[i][j];
        double z10 = z[i + 1][j];
        double z01 = z[i][j + 1];
        double z11 = z[i + 1][j + 1];
        return (1.0 - tx) * ((1.0 - ty) * z00 + ty * z01)
            + tx * ((1.0 - ty) * z10 + ty * z11);
    }

    private static int cell(double[] axis, double v) {
        if (v <= axis[0]) {
            return 0;
        }
        if (v >= axis[axis.length - 1]) {
            return axis.length - 2;
        }
        int idx = Arrays.binarySearch(axis, v);
        if (idx >= 0) {
            return Math.min(idx, axis.length - 2);
        }
        return -idx - 2;
    }

    private static double fraction(double[] axis, int cell, double v) {
        double t = (v - axis[cell]) / (axis[cell + 1] - axis[cell]);
        return Math.max(0.0, Math.min(1.0, t));
    }
}
