package com.catalog.crossmatch.normalize;

import com.catalog.crossmatch.core.model.Catalogue;
import com.catalog.crossmatch.core.model.SourceRecord;
import com.catalog.crossmatch.error.CatalogueValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Predicate;

/**
 * Checks that the likelihood model has uncertainties to work with.
 *
 * <p>Positional uncertainty comes from {@code err_ra}/{@code err_dec} or, failing those,
 * the beam size {@code psf_a}; flux uncertainty from {@code err_peak_flux} or, failing that,
 * {@code local_rms}. At least one source across both catalogues must provide each
 * quantity; flux uncertainty is only needed when flux matching is on.</p>
 */
public final class UncertaintyValidator {
    private static final Logger log = LoggerFactory.getLogger(UncertaintyValidator.class);

    private static final Predicate<SourceRecord> HAS_POSITIONAL =
            s -> s.getErrRa() > 0.0 || s.getErrDec() > 0.0 || s.getPsfA() > 0.0;
    private static final Predicate<SourceRecord> HAS_FLUX =
            s -> s.getErrPeakFlux() > 0.0 || s.getLocalRms() > 0.0;

    private UncertaintyValidator() {
    }

    /**
     * @throws CatalogueValidationException if a needed uncertainty is absent from both catalogues
     */
    public static void validate(Catalogue target, Catalogue reference, boolean fluxMatching) {
        check(target, reference, HAS_POSITIONAL, "err_ra/err_dec/psf_a", "positional");
        if (fluxMatching) {
            check(target, reference, HAS_FLUX, "err_peak_flux/local_rms", "flux");
        }
    }

    private static void check(Catalogue target, Catalogue reference, Predicate<SourceRecord> present,
                              String columns, String quantity) {
        boolean inTarget = target.getSources().stream().anyMatch(present);
        boolean inReference = reference.getSources().stream().anyMatch(present);
        if (!inTarget && !inReference) {
            throw new CatalogueValidationException(target.getName() + "+" + reference.getName(), columns,
                    "no " + quantity + " uncertainty in either catalogue; the likelihood is undefined");
        }
        if (!inTarget || !inReference) {
            log.warn("uncertainty.partial quantity={} missingIn={}", quantity,
                    inTarget ? reference.getName() : target.getName());
        }
    }
}
