package com.catalog.crossmatch.likelihood;

import com.catalog.crossmatch.core.model.SourceRecord;

/**
 * Derives per-source uncertainties and combines them for a source pair.
 *
 * <p>Positional sigma of a source is the quadrature sum of its beam semimajor axis
 * (arcsec, converted to degrees) and the larger of its RA/Dec measurement errors, so
 * the beam stands in for the measurement error when none is supplied. Flux sigma is
 * the quadrature sum of the peak-flux error and the local background noise. Terms
 * that are absent are zero.</p>
 */
public final class UncertaintyCombiner {

    private UncertaintyCombiner() {
        // Utility class
    }

    /**
     * Positional sigma of one source, in degrees.
     */
    public static double positionalSigma(SourceRecord source) {
        double beam = SkyGeometry.arcsecToDegrees(Math.abs(source.getPsfA()));
        double measurement = Math.max(Math.abs(source.getErrRa()), Math.abs(source.getErrDec()));
        return Math.hypot(beam, measurement);
    }

    /**
     * Flux sigma of one source.
     */
    public static double fluxSigma(SourceRecord source) {
        return Math.hypot(source.getErrPeakFlux(), source.getLocalRms());
    }

    /**
     * Combined positional sigma of a target/reference pair, in degrees.
     */
    public static double combinedPositionalSigma(SourceRecord target, SourceRecord reference) {
        return Math.hypot(positionalSigma(target), positionalSigma(reference));
    }

    /**
     * Combined flux sigma of a target/reference pair.
     */
    public static double combinedFluxSigma(SourceRecord target, SourceRecord reference) {
        return Math.hypot(fluxSigma(target), fluxSigma(reference));
    }

    /**
     * Signal-to-noise of a source: peak flux over local noise, falling back to the
     * peak-flux error. Returns positive infinity when neither noise term is known.
     */
    public static double signalToNoise(SourceRecord source) {
        double noise = source.getLocalRms() > 0.0 ? source.getLocalRms() : source.getErrPeakFlux();
        if (noise <= 0.0) {
            return Double.POSITIVE_INFINITY;
        }
        return source.getPeakFlux() / noise;
    }
}
