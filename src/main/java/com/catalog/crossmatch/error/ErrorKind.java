package com.catalog.crossmatch.error;

/**
 * Classifies a {@link CrossMatchException} so callers can tell bad input apart
 * from numerical breakdown.
 */
public enum ErrorKind {
    /** A catalogue is missing a required column or carries unusable values. */
    DATA_VALIDATION,

    /** A run parameter is out of range or inconsistent with the inputs. */
    CONFIGURATION,

    /** A model fit failed numerically (singular or under-determined system). */
    NUMERICAL
}
