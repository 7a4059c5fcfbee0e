package io.dynamis.bsdf.simulation;

import io.dynamis.bsdf.api.AngularProfile;

import java.util.Optional;

/**
 * Angular profiles fitted for one (incidence, wavelength) cell.
 *
 * @param reflective   reflective profile, always present
 * @param transmissive transmissive profile, or null when the cell has no transmissive points
 * @param thetaMax     largest reflective scan angle that was measured, radians
 */
public record ProfileFit(
    AngularProfile reflective,
    AngularProfile transmissive,
    double thetaMax
) {

    public ProfileFit {
        if (reflective == null) {
            throw new NullPointerException("reflective profile must not be null");
        }
    }

    public boolean hasTransmissive() {
        return transmissive != null;
    }

    public Optional<AngularProfile> transmissiveProfile() {
        return Optional.ofNullable(transmissive);
    }
}
