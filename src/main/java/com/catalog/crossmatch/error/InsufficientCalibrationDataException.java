package com.catalog.crossmatch.error;

/**
 * Thrown when too few calibration pairs survive to fit a flux surface of the
 * requested degree.
 */
public class InsufficientCalibrationDataException extends CrossMatchException {

    private final int available;
    private final int required;
    private final int degree;

    public InsufficientCalibrationDataException(int available, int required, int degree) {
        super(ErrorKind.DATA_VALIDATION, String.format(
                "[parameter=fluxModelDegree] degree %d needs at least %d calibration pairs, found %d",
                degree, required, available));
        this.available = available;
        this.required = required;
        this.degree = degree;
    }

    public int getAvailable() {
        return available;
    }

    public int getRequired() {
        return required;
    }

    public int getDegree() {
        return degree;
    }
}
