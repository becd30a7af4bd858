package com.catalog.crossmatch.error;

/**
 * Thrown when a smooth-surface fit cannot be solved.
 */
public class SurfaceFitException extends CrossMatchException {

    private final String model;

    public SurfaceFitException(String model, String message) {
        super(ErrorKind.NUMERICAL, "[model=" + model + "] " + message);
        this.model = model;
    }

    public SurfaceFitException(String model, String message, Throwable cause) {
        super(ErrorKind.NUMERICAL, "[model=" + model + "] " + message, cause);
        this.model = model;
    }

    public String getModel() {
        return model;
    }
}
