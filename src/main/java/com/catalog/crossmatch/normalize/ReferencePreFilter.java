package com.catalog.crossmatch.normalize;

import com.catalog.crossmatch.core.model.Catalogue;
import com.catalog.crossmatch.core.model.SourceRecord;
import com.catalog.crossmatch.likelihood.SkyGeometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Drops reference sources that cannot lie near any target source.
 *
 * <p>The kept region is the bounding box of the target catalogue widened by
 * {@code max(5 * edge, radius)}, where {@code edge} is the largest source size plus the
 * largest beam size of the target catalogue. The RA margin is stretched by the
 * declination so the box never cuts into the search radius of a target source.</p>
 */
public final class ReferencePreFilter {
    private static final Logger log = LoggerFactory.getLogger(ReferencePreFilter.class);

    private ReferencePreFilter() {
    }

    public static double edgeDeg(List<SourceRecord> targets) {
        double maxShape = 0.0;
        double maxBeam = 0.0;
        for (SourceRecord s : targets) {
            maxShape = Math.max(maxShape, Math.max(s.getA(), s.getB()));
            maxBeam = Math.max(maxBeam, Math.max(s.getPsfA(), s.getPsfB()));
        }
        return (maxShape + maxBeam) / SkyGeometry.ARCSEC_PER_DEGREE;
    }

    public static Catalogue filter(Catalogue target, Catalogue reference, double radiusDeg) {
        if (target.isEmpty() || reference.isEmpty()) {
            return reference;
        }
        double margin = Math.max(5.0 * edgeDeg(target.getSources()), radiusDeg);
        double minRa = Double.POSITIVE_INFINITY, maxRa = Double.NEGATIVE_INFINITY;
        double minDec = Double.POSITIVE_INFINITY, maxDec = Double.NEGATIVE_INFINITY;
        for (SourceRecord s : target.getSources()) {
            minRa = Math.min(minRa, s.getRa());
            maxRa = Math.max(maxRa, s.getRa());
            minDec = Math.min(minDec, s.getDec());
            maxDec = Math.max(maxDec, s.getDec());
        }
        double loDec = minDec - margin;
        double hiDec = maxDec + margin;
        double maxAbsDec = Math.max(Math.abs(loDec), Math.abs(hiDec));
        double cos = Math.cos(Math.toRadians(Math.min(90.0, maxAbsDec)));
        double raMargin = cos > 1e-6 ? margin / cos : Double.POSITIVE_INFINITY;
        boolean raUnbounded = maxAbsDec >= 89.0 || raMargin >= 180.0 || (maxRa - minRa) + 2 * raMargin >= 360.0;
        double loRa = minRa - raMargin;
        double hiRa = maxRa + raMargin;

        List<SourceRecord> kept = reference.getSources().stream()
                .filter(s -> s.getDec() >= loDec && s.getDec() <= hiDec)
                .filter(s -> raUnbounded || s.getRa() >= loRa && s.getRa() <= hiRa)
                .toList();
        log.info("reference.prefilter kept={} dropped={} marginDeg={}",
                kept.size(), reference.size() - kept.size(), margin);
        return reference.withSources(kept);
    }
}
