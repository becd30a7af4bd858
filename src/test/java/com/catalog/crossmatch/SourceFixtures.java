package com.catalog.crossmatch;

import com.catalog.crossmatch.core.model.Catalogue;
import com.catalog.crossmatch.core.model.CatalogueRole;
import com.catalog.crossmatch.core.model.SourceRecord;

import java.util.List;

/**
 * Shared builders for test sources and catalogues.
 */
public final class SourceFixtures {

    /** Beam of 36 arcsec, i.e. 0.01 degrees. */
    public static final double BEAM_ARCSEC = 36.0;

    private SourceFixtures() {
    }

    /**
     * A source with a 0.01 degree beam, 1 mJy-ish noise and the given peak flux.
     */
    public static SourceRecord source(String uuid, double ra, double dec, double peakFlux) {
        return SourceRecord.builder()
                .uuid(uuid)
                .ra(ra)
                .dec(dec)
                .psfA(BEAM_ARCSEC)
                .psfB(BEAM_ARCSEC)
                .a(BEAM_ARCSEC)
                .b(BEAM_ARCSEC)
                .peakFlux(peakFlux)
                .intFlux(peakFlux)
                .errPeakFlux(0.01 * peakFlux)
                .localRms(0.01 * peakFlux)
                .build();
    }

    public static SourceRecord source(String uuid, double ra, double dec) {
        return source(uuid, ra, dec, 1.0);
    }

    public static Catalogue target(List<SourceRecord> sources) {
        return new Catalogue("target", CatalogueRole.TARGET, sources);
    }

    public static Catalogue reference(List<SourceRecord> sources) {
        return new Catalogue("reference", CatalogueRole.REFERENCE, sources);
    }
}
