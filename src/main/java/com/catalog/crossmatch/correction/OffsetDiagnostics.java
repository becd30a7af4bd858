package com.catalog.crossmatch.correction;

import com.catalog.crossmatch.core.model.AcceptedMatch;
import com.catalog.crossmatch.core.model.SkyPosition;
import com.catalog.crossmatch.likelihood.SkyGeometry;

import java.util.ArrayList;
import java.util.List;

/**
 * Measured versus modelled offsets at every match a refit was based on.
 *
 * @param round   round after which the model was fitted
 * @param samples one entry per accepted match
 */
public record OffsetDiagnostics(int round, List<Sample> samples) {

    public OffsetDiagnostics {
        samples = List.copyOf(samples);
    }

    public static OffsetDiagnostics of(int round, OffsetCorrectionModel model, List<AcceptedMatch> matches) {
        List<Sample> samples = new ArrayList<>(matches.size());
        for (AcceptedMatch m : matches) {
            SkyPosition p = m.getTarget().position();
            samples.add(new Sample(m.getTarget().getUuid(), p.ra(), p.dec(),
                    m.offsetRa(), m.offsetDec(), model.raOffsetAt(p), model.decOffsetAt(p)));
        }
        return new OffsetDiagnostics(round, samples);
    }

    /**
     * Root-mean-square of the residual (measured minus modelled) offsets, in arcseconds.
     */
    public double rmsResidualArcsec() {
        if (samples.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (Sample s : samples) {
            double r = Math.hypot(s.residualRa(), s.residualDec());
            sum += r * r;
        }
        return Math.sqrt(sum / samples.size()) * SkyGeometry.ARCSEC_PER_DEGREE;
    }

    /**
     * Offsets in degrees at an original target position.
     */
    public record Sample(String targetUuid, double ra, double dec,
                         double measuredRa, double measuredDec,
                         double modelledRa, double modelledDec) {

        public double residualRa() {
            return measuredRa - modelledRa;
        }

        public double residualDec() {
            return measuredDec - modelledDec;
        }
    }
}
