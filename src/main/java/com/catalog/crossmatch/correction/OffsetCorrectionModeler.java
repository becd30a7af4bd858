package com.catalog.crossmatch.correction;

import com.catalog.crossmatch.core.model.AcceptedMatch;
import com.catalog.crossmatch.core.model.SkyPosition;
import com.catalog.crossmatch.surface.ConstantSurface;
import com.catalog.crossmatch.surface.RadialBasisFitter;
import com.catalog.crossmatch.surface.SurfaceFitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Fits the offset-correction model from the cumulative accepted matches.
 *
 * <p>RA and Dec displacements are fitted separately as functions of the original target
 * position. A single match gives a constant translation; no matches give the identity.</p>
 */
public class OffsetCorrectionModeler {
    private static final Logger log = LoggerFactory.getLogger(OffsetCorrectionModeler.class);

    private final SurfaceFitter fitter;

    public OffsetCorrectionModeler(double smoothing) {
        this(new RadialBasisFitter(smoothing));
    }

    public OffsetCorrectionModeler(SurfaceFitter fitter) {
        this.fitter = fitter;
    }

    public SurfaceFitter getFitter() {
        return fitter;
    }

    public OffsetCorrectionModel fit(List<AcceptedMatch> matches) {
        if (matches.isEmpty()) {
            return OffsetCorrectionModel.IDENTITY;
        }
        List<SkyPosition> positions = matches.stream().map(m -> m.getTarget().position()).toList();
        double[] dRa = matches.stream().mapToDouble(AcceptedMatch::offsetRa).toArray();
        double[] dDec = matches.stream().mapToDouble(AcceptedMatch::offsetDec).toArray();

        if (matches.size() < fitter.minimumPoints()) {
            log.warn("offset.model.translationOnly matches={} required={}", matches.size(), fitter.minimumPoints());
            return new OffsetCorrectionModel(new ConstantSurface(mean(dRa)), new ConstantSurface(mean(dDec)),
                    matches.size());
        }
        OffsetCorrectionModel model = new OffsetCorrectionModel(
                fitter.fit(positions, dRa), fitter.fit(positions, dDec), matches.size());
        log.debug("offset.model.fitted matches={} fitter={}", matches.size(), fitter.getName());
        return model;
    }

    private static double mean(double[] values) {
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }
}
