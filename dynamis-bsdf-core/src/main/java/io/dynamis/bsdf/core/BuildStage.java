package io.dynamis.bsdf.core;

/**
 * Progress of a BsdfVolumeBuilder through its single build.
 *
 * Stages advance strictly in declaration order up to READY. Any failure moves the builder to
 * FAILED, which is terminal: a failed build cannot be resumed or retried.
 */
public enum BuildStage {
    UNINITIALIZED,
    INCIDENCES_RESOLVED,
    PER_CELL_RECONSTRUCTED,
    RESHAPED,
    VALIDATED,
    READY,
    FAILED
}
