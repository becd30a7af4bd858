package com.catalog.crossmatch.correction;

/**
 * What to do when the flux-calibration surface cannot be fitted at the requested degree.
 */
public enum FluxModelFallback {
    /** Abort the run. */
    FAIL,
    /** Retry with the highest lower degree the calibration points support, else skip. */
    LOWER_DEGREE,
    /** Leave fluxes uncorrected. */
    SKIP
}
