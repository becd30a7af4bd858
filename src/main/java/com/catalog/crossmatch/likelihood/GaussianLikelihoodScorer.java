package com.catalog.crossmatch.likelihood;

import com.catalog.crossmatch.core.model.SkyPosition;
import com.catalog.crossmatch.core.model.SourceRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Joint positional and flux likelihood.
 * Formula: L = exp(-sep^2 / (2 sigmaPos^2)) * exp(-dFlux^2 / (2 sigmaFlux^2))
 *
 * <p>Both terms are zero-mean Gaussians without the normalizing constant, so a pair at
 * identical position and flux scores exactly 1.0. With flux matching disabled the flux
 * term is skipped and the likelihood is purely positional.</p>
 */
public class GaussianLikelihoodScorer implements LikelihoodModel {
    private static final Logger log = LoggerFactory.getLogger(GaussianLikelihoodScorer.class);

    private final boolean fluxMatching;

    public GaussianLikelihoodScorer() {
        this(true);
    }

    public GaussianLikelihoodScorer(boolean fluxMatching) {
        this.fluxMatching = fluxMatching;
    }

    @Override
    public double likelihood(SourceRecord target, SkyPosition targetPosition, SourceRecord reference) {
        return computeWithBreakdown(target, targetPosition, reference).likelihood();
    }

    @Override
    public String getName() {
        return fluxMatching ? "Gaussian(position+flux)" : "Gaussian(position)";
    }

    public boolean isFluxMatching() {
        return fluxMatching;
    }

    /**
     * Computes the likelihood with each term exposed.
     */
    public LikelihoodBreakdown computeWithBreakdown(SourceRecord target, SkyPosition targetPosition,
                                                    SourceRecord reference) {
        double separation = SkyGeometry.separation(targetPosition, reference.position());
        double positionalSigma = UncertaintyCombiner.combinedPositionalSigma(target, reference);
        double positional = gaussian(separation, positionalSigma);

        double fluxDifference = reference.getPeakFlux() - target.getPeakFlux();
        double fluxSigma = Double.NaN;
        double flux = 1.0;
        if (fluxMatching) {
            fluxSigma = UncertaintyCombiner.combinedFluxSigma(target, reference);
            flux = gaussian(fluxDifference, fluxSigma);
        }

        double likelihood = positional * flux;
        if (log.isTraceEnabled()) {
            log.trace("Likelihood for '{}' vs '{}': sep={} sigmaPos={} dFlux={} sigmaFlux={} L={}",
                    target.getUuid(), reference.getUuid(), separation, positionalSigma,
                    fluxDifference, fluxSigma, likelihood);
        }
        return new LikelihoodBreakdown(separation, positionalSigma, positional,
                fluxDifference, fluxSigma, flux, likelihood);
    }

    /**
     * Unnormalized zero-mean Gaussian. A zero sigma only admits an exact coincidence.
     */
    static double gaussian(double x, double sigma) {
        if (sigma <= 0.0 || Double.isNaN(sigma)) {
            return x == 0.0 ? 1.0 : 0.0;
        }
        double z = x / sigma;
        return Math.exp(-0.5 * z * z);
    }

    /**
     * Detailed breakdown of the likelihood terms.
     */
    public record LikelihoodBreakdown(
            double separationDeg,
            double positionalSigmaDeg,
            double positionalTerm,
            double fluxDifference,
            double fluxSigma,
            double fluxTerm,
            double likelihood
    ) {
        @Override
        public String toString() {
            return String.format(
                    "LikelihoodBreakdown{sep=%.3f\" (sigma=%.3f\"), position=%.4f, dFlux=%.4g (sigma=%.4g), flux=%.4f, L=%.4f}",
                    separationDeg * SkyGeometry.ARCSEC_PER_DEGREE,
                    positionalSigmaDeg * SkyGeometry.ARCSEC_PER_DEGREE,
                    positionalTerm, fluxDifference, fluxSigma, fluxTerm, likelihood);
        }
    }
}
