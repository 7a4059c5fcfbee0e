package io.dynamis.bsdf.simulation;

import io.dynamis.bsdf.api.BsdfConstants;

import java.util.function.DoubleUnaryOperator;

/**
 * Adaptive Gauss-Kronrod (7-point Gauss, 15-point Kronrod) quadrature on a finite interval.
 *
 * Each panel is accepted when |K15 - G7| is within its share of the absolute tolerance;
 * otherwise it is bisected and each half gets half the tolerance. Bisection stops at
 * MAX_QUADRATURE_DEPTH, where the Kronrod estimate is accepted as is.
 *
 * Stateless.
 */
public final class AdaptiveQuadrature {

    // Kronrod abscissae on [-1, 1], positive half; odd indices are the Gauss nodes.
    private static final double[] XGK = {
        0.991455371120812639206854697526329,
        0.949107912342758524526189684047851,
        0.864864423359769072789712788640926,
        0.741531185599394439863864773280788,
        0.586087235467691130294144845693013,
        0.405845151377397166906606412076961,
        0.207784955007898467600689403773245,
        0.000000000000000000000000000000000
    };

    private static final double[] WGK = {
        0.022935322010529224963732008058970,
        0.063092092629978553290700663189204,
        0.104790010322250183839876322541518,
        0.140653259715525918745189590510238,
        0.169004726639267902826583426598550,
        0.190350578064785409913256402421014,
        0.204432940075298892414161999234649,
        0.209482141084727828012999174891714
    };

    // Gauss weights for XGK[1], XGK[3], XGK[5], XGK[7]
    private static final double[] WG = {
        0.129484966168869693270611432679082,
        0.279705391489276667901467771423780,
        0.381830050505118944950369775488975,
        0.417959183673469387755102040816327
    };

    private AdaptiveQuadrature() {}

    /**
     * Integrates f over [a, b].
     *
     * @param absTolerance absolute error target; must be positive
     */
    public static double integrate(DoubleUnaryOperator f, double a, double b,
                                   double absTolerance) {
        if (!(absTolerance > 0.0)) {
            throw new IllegalArgumentException(
                "absolute tolerance must be positive; actual = " + absTolerance);
        }
        if (a == b) {
            return 0.0;
        }
        return adapt(f, a, b, absTolerance, 0);
    }

    private static double adapt(DoubleUnaryOperator f, double a, double b,
                                double tolerance, int depth) {
        double[] panel = kronrod15(f, a, b);
        double kronrod = panel[0];
        double error = Math.abs(panel[0] - panel[1]);
        // a NaN error estimate is accepted; bisecting cannot recover it
        if (!(error > tolerance) || depth >= BsdfConstants.MAX_QUADRATURE_DEPTH) {
            return kronrod;
        }
        double mid = 0.5 * (a + b);
        return adapt(f, a, mid, 0.5 * tolerance, depth + 1)
            + adapt(f, mid, b, 0.5 * tolerance, depth + 1);
    }

    /** Returns {K15 estimate, G7 estimate} on [a, b]. */
    static double[] kronrod15(DoubleUnaryOperator f, double a, double b) {
        double center = 0.5 * (a + b);
        double halfLength = 0.5 * (b - a);
        double fc = f.applyAsDouble(center);
        double kronrod = fc * WGK[7];
        double gauss = fc * WG[3];
        for (int j = 0; j < 7; j++) {
            double dx = halfLength * XGK[j];
            double sum = f.applyAsDouble(center - dx) + f.applyAsDouble(center + dx);
            kronrod += WGK[j] * sum;
            if (j % 2 == 1) {
                gauss += WG[j / 2] * sum;
            }
        }
        return new double[] { kronrod * halfLength, gauss * halfLength };
    }
}
