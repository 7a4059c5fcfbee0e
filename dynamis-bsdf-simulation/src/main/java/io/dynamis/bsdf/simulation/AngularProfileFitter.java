package io.dynamis.bsdf.simulation;

import io.dynamis.bsdf.api.AngularProfile;
import io.dynamis.bsdf.api.Branch;
import io.dynamis.bsdf.api.BsdfConstants;
import io.dynamis.bsdf.api.InsufficientDataException;
import io.dynamis.bsdf.api.MeasurementPoint;

import java.util.ArrayList;
import java.util.List;

/**
 * Fits continuous 1D angular profiles to the in-plane measurements of one
 * (incidence, wavelength) cell.
 *
 * PARTITION:
 *   |theta| <  pi/2  -> reflective, parameterised by the raw scan angle
 *   |theta| >= pi/2  -> transmissive, folded onto the deviation from the opposite normal:
 *       theta <= -pi/2  ->  |theta| - pi     (range [-pi/2, 0], runs reversed)
 *       theta >=  pi/2  ->  |theta - pi|     (range [0, pi/2], runs reversed)
 *   Both folded halves are joined into one ascending axis.
 *
 * Each branch becomes a PiecewiseLinearProfile with constant-slope extrapolation.
 * thetaMax is the largest raw reflective angle measured; the polar reconstruction uses it to
 * stop blending toward unmeasured directions.
 *
 * Pure: the fitter holds an immutable copy of the measurement set and never mutates it.
 */
public final class AngularProfileFitter {

    private final List<MeasurementPoint> points;

    public AngularProfileFitter(List<MeasurementPoint> points) {
        if (points == null) {
            throw new NullPointerException("points must not be null");
        }
        this.points = List.copyOf(points);
    }

    /**
     * Fits the profiles of the cell at exactly the given incidence and wavelength.
     *
     * @param incidence  incidence angle, radians; matched exactly
     * @param wavelength wavelength, nanometres; matched exactly
     * @throws InsufficientDataException if the cell has no points, fewer than two distinct
     *         reflective angles, or a transmissive branch with fewer than two distinct angles
     */
    public ProfileFit fit(double incidence, double wavelength) throws InsufficientDataException {
        List<MeasurementPoint> reflective = new ArrayList<>();
        List<MeasurementPoint> transmissive = new ArrayList<>();
        for (MeasurementPoint p : points) {
            if (!p.matches(incidence, wavelength)) {
                continue;
            }
            if (p.branch() == Branch.REFLECTIVE) {
                reflective.add(p);
            } else {
                transmissive.add(p);
            }
        }

        if (reflective.isEmpty() && transmissive.isEmpty()) {
            throw new InsufficientDataException(incidence, wavelength, Branch.REFLECTIVE,
                "no measurement points");
        }

        double[] rTheta = new double[reflective.size()];
        double[] rValue = new double[reflective.size()];
        double thetaMax = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < rTheta.length; i++) {
            MeasurementPoint p = reflective.get(i);
            rTheta[i] = p.theta();
            rValue[i] = p.value();
            thetaMax = Math.max(thetaMax, p.theta());
        }
        requireSamples(rTheta, incidence, wavelength, Branch.REFLECTIVE);
        AngularProfile reflectiveProfile =
            PiecewiseLinearProfile.fromSamples(Branch.REFLECTIVE, rTheta, rValue);

        AngularProfile transmissiveProfile = null;
        if (!transmissive.isEmpty()) {
            double[] tTheta = new double[transmissive.size()];
            double[] tValue = new double[transmissive.size()];
            for (int i = 0; i < tTheta.length; i++) {
                MeasurementPoint p = transmissive.get(i);
                tTheta[i] = foldTransmissive(p.theta());
                tValue[i] = p.value();
            }
            requireSamples(tTheta, incidence, wavelength, Branch.TRANSMISSIVE);
            transmissiveProfile =
                PiecewiseLinearProfile.fromSamples(Branch.TRANSMISSIVE, tTheta, tValue);
        }

        return new ProfileFit(reflectiveProfile, transmissiveProfile, thetaMax);
    }

    /**
     * Maps a raw transmissive scan angle onto the signed deviation from the opposite normal.
     * Exposed for testing.
     */
    public static double foldTransmissive(double theta) {
        if (theta <= -BsdfConstants.HEMISPHERE_BOUNDARY) {
            return Math.abs(theta) - Math.PI;
        }
        return Math.abs(theta - Math.PI);
    }

    private static void requireSamples(double[] thetas, double incidence, double wavelength,
                                       Branch branch) throws InsufficientDataException {
        if (thetas.length == 0) {
            throw new InsufficientDataException(incidence, wavelength, branch,
                "no measurement points");
        }
        int distinct = PiecewiseLinearProfile.distinctCount(thetas);
        if (distinct < BsdfConstants.MIN_PROFILE_SAMPLES) {
            throw new InsufficientDataException(incidence, wavelength, branch,
                distinct + " distinct angle(s), at least "
                    + BsdfConstants.MIN_PROFILE_SAMPLES + " required");
        }
    }
}
