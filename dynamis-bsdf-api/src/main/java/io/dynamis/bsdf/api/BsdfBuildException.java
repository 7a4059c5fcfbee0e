package io.dynamis.bsdf.api;

/**
 * Base class of the failures that abort a BSDF volume build.
 *
 * A build is a pure computation: none of these failures is transient, and no partial
 * result survives them. The caller must fix the input and rebuild from scratch.
 */
public abstract class BsdfBuildException extends Exception {

    protected BsdfBuildException(String message) {
        super(message);
    }

    protected BsdfBuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
