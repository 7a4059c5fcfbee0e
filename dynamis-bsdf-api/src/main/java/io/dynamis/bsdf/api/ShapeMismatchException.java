package io.dynamis.bsdf.api;

import java.util.Arrays;

/**
 * Thrown when an assembled tensor's dimensions disagree with the sample counts.
 * Always indicates an assembly defect or an inconsistent measurement set.
 */
public final class ShapeMismatchException extends BsdfBuildException {

    private final String tensor;
    private final int[] expected;
    private final int[] actual;

    public ShapeMismatchException(String tensor, int[] expected, int[] actual) {
        super("Shape of " + tensor + " is " + Arrays.toString(actual)
            + ", expected " + Arrays.toString(expected));
        this.tensor = tensor;
        this.expected = expected.clone();
        this.actual = actual.clone();
    }

    /** Name of the offending tensor, e.g. "brdf" or "transmittance". */
    public String tensor() { return tensor; }

    public int[] expected() { return expected.clone(); }

    public int[] actual() { return actual.clone(); }
}
