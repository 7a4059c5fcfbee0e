package io.dynamis.bsdf.io;

import io.dynamis.bsdf.api.MeasurementPoint;
import io.dynamis.bsdf.api.SampleSet;

import java.util.List;

/**
 * Parsed measurement table: the points (angles in radians) and the ascending WavelengthSet
 * declared by the header.
 */
public record MeasurementTable(
    List<MeasurementPoint> points,
    SampleSet wavelengths
) {

    public MeasurementTable {
        points = List.copyOf(points);
        if (wavelengths == null) {
            throw new NullPointerException("wavelengths must not be null");
        }
    }
}
