package io.dynamis.bsdf.simulation;

import io.dynamis.bsdf.api.AngularGrid;
import io.dynamis.bsdf.api.BsdfConstants;
import io.dynamis.bsdf.api.PolarMap;

/**
 * Integrates a reconstructed polar map over the outgoing hemisphere.
 *
 *   R = integral over phi in [0, 2pi], theta in [0, pi/2] of (1/pi) * f(theta, phi) * sin(theta)
 *
 * sin(theta) is the solid-angle Jacobian; 1/pi is the normalisation of the exported
 * cosine-weighted values, so a map f = k cos(theta) integrates to k.
 *
 * The integrand is sampled on the grid, spanned by a bilinear surface, and integrated by
 * nested adaptive Gauss-Kronrod quadrature (theta inner, phi outer) with the same absolute
 * tolerance on each axis. The result is clipped to [0, MAX_HEMISPHERICAL_INTEGRAL].
 *
 * Stateless.
 */
public final class HemisphericalIntegrator {

    private HemisphericalIntegrator() {}

    /** Integrates with the default per-axis tolerance. */
    public static double integrate(AngularGrid grid, PolarMap map) {
        return integrate(grid, map.values(), BsdfConstants.DEFAULT_QUADRATURE_TOLERANCE);
    }

    public static double integrate(AngularGrid grid, PolarMap map, double tolerance) {
        return integrate(grid, map.values(), tolerance);
    }

    /**
     * @param grid      grid the values were sampled on
     * @param values    BSDF values [theta][phi], 1/sr
     * @param tolerance absolute quadrature tolerance per axis
     * @return hemispherical reflectance or transmittance in [0, 1]
     */
    public static double integrate(AngularGrid grid, double[][] values, double tolerance) {
        int thetaCount = grid.thetaCount();
        int phiCount = grid.phiCount();
        int columns = values.length == 0 ? 0 : values[0].length;
        if (values.length != thetaCount || columns != phiCount) {
            throw new IllegalArgumentException(
                "values are " + values.length + "x" + columns
                    + ", grid is " + thetaCount + "x" + phiCount);
        }

        double[][] integrand = new double[thetaCount][phiCount];
        for (int t = 0; t < thetaCount; t++) {
            if (values[t].length != phiCount) {
                throw new IllegalArgumentException(
                    "row " + t + " has " + values[t].length + " values, grid has " + phiCount);
            }
            double jacobian = Math.sin(grid.theta(t)) / Math.PI;
            for (int p = 0; p < phiCount; p++) {
                integrand[t][p] = values[t][p] * jacobian;
            }
        }
        BilinearSurface surface =
            new BilinearSurface(grid.thetaSamples(), grid.phiSamples(), integrand);

        double total = AdaptiveQuadrature.integrate(
            phi -> AdaptiveQuadrature.integrate(
                theta -> surface.evaluate(theta, phi),
                0.0, BsdfConstants.THETA_RANGE, tolerance),
            0.0, BsdfConstants.PHI_RANGE, tolerance);
        return clip(total);
    }

    private static double clip(double integral) {
        return Math.max(0.0, Math.min(BsdfConstants.MAX_HEMISPHERICAL_INTEGRAL, integral));
    }
}
