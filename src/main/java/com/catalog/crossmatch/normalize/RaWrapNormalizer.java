package com.catalog.crossmatch.normalize;

import com.catalog.crossmatch.core.model.Catalogue;
import com.catalog.crossmatch.core.model.SourceRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Makes a field that straddles RA 0/360 contiguous.
 *
 * <p>When the sources of both catalogues together have right ascensions below 10 degrees
 * as well as above 350 degrees, every RA above 180 degrees in both catalogues is shifted
 * by -360. Applying it to catalogues that do not straddle the boundary, including its own
 * output, changes nothing.</p>
 */
public final class RaWrapNormalizer {
    private static final Logger log = LoggerFactory.getLogger(RaWrapNormalizer.class);

    static final double LOW_EDGE = 10.0;
    static final double HIGH_EDGE = 350.0;

    private RaWrapNormalizer() {
    }

    public static boolean straddlesZero(List<SourceRecord> first, List<SourceRecord> second) {
        boolean low = false;
        boolean high = false;
        for (List<SourceRecord> sources : List.of(first, second)) {
            for (SourceRecord s : sources) {
                low |= s.getRa() < LOW_EDGE;
                high |= s.getRa() > HIGH_EDGE;
            }
        }
        return low && high;
    }

    public static Result normalize(Catalogue target, Catalogue reference) {
        if (!straddlesZero(target.getSources(), reference.getSources())) {
            return new Result(target, reference, false);
        }
        log.info("ra.wrap.applied target={} reference={}", target.getName(), reference.getName());
        return new Result(target.map(RaWrapNormalizer::unwrap), reference.map(RaWrapNormalizer::unwrap), true);
    }

    /**
     * Maps an RA back into [0, 360).
     */
    public static double toStandardRange(double ra) {
        double r = ra % 360.0;
        return r < 0.0 ? r + 360.0 : r;
    }

    private static SourceRecord unwrap(SourceRecord s) {
        return s.getRa() > 180.0 ? SourceRecord.builder(s).ra(s.getRa() - 360.0).build() : s;
    }

    /**
     * Catalogues after normalization, and whether RA values were shifted.
     */
    public record Result(Catalogue target, Catalogue reference, boolean wrapped) {}
}
