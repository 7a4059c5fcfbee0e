package io.dynamis.bsdf.api;

/**
 * Thrown when an entire reconstructed tensor is uniformly zero.
 *
 * Only raised for the reflective channel. An all-zero transmissive tensor is a legitimate
 * opaque material and is reported as a warning instead.
 */
public final class AllZeroDataException extends BsdfBuildException {

    private final Branch branch;

    public AllZeroDataException(Branch branch) {
        super("All values of the " + (branch == Branch.REFLECTIVE ? "brdf" : "btdf")
            + " tensor are zero; check measurement units and wiring");
        this.branch = branch;
    }

    public Branch branch() { return branch; }
}
