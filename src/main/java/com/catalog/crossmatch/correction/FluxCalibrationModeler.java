package com.catalog.crossmatch.correction;

import com.catalog.crossmatch.core.model.SkyPosition;
import com.catalog.crossmatch.core.model.SourceRecord;
import com.catalog.crossmatch.error.InsufficientCalibrationDataException;
import com.catalog.crossmatch.error.SurfaceFitException;
import com.catalog.crossmatch.likelihood.UncertaintyCombiner;
import com.catalog.crossmatch.search.SkyCellIndex;
import com.catalog.crossmatch.surface.PolynomialSurfaceFitter;
import com.catalog.crossmatch.surface.SurfaceModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builds the flux-calibration surface from a quick nearest-neighbour pre-match.
 *
 * <p>Only target sources with SNR at or above the cutoff take part. Each is paired with
 * the nearest reference source within the calibration radius, the ratio reference/target
 * of peak fluxes is taken, and a least-squares polynomial surface is fitted to the ratios
 * over target position.</p>
 */
public class FluxCalibrationModeler {
    private static final Logger log = LoggerFactory.getLogger(FluxCalibrationModeler.class);

    private final int degree;
    private final double snrCutoff;
    private final double radiusDeg;
    private final FluxModelFallback fallback;

    public FluxCalibrationModeler(int degree, double snrCutoff, double radiusDeg, FluxModelFallback fallback) {
        if (degree < PolynomialSurfaceFitter.MIN_DEGREE || degree > PolynomialSurfaceFitter.MAX_DEGREE) {
            throw new IllegalArgumentException("degree must be between 1 and 5");
        }
        this.degree = degree;
        this.snrCutoff = snrCutoff;
        this.radiusDeg = radiusDeg;
        this.fallback = fallback;
    }

    /**
     * Pairs bright targets with their nearest reference source.
     */
    public List<CalibrationPoint> collectPoints(List<SourceRecord> targets, List<SourceRecord> references) {
        SkyCellIndex index = SkyCellIndex.build(references.stream().map(SourceRecord::position).toList(), radiusDeg);
        List<CalibrationPoint> points = new ArrayList<>();
        int bright = 0;
        for (SourceRecord target : targets) {
            if (UncertaintyCombiner.signalToNoise(target) < snrCutoff) {
                continue;
            }
            bright++;
            SkyPosition position = target.position();
            Optional<SkyCellIndex.Neighbour> nearest = index.nearest(position, radiusDeg);
            if (nearest.isEmpty()) {
                continue;
            }
            SourceRecord reference = references.get(nearest.get().index());
            double ratio = reference.getPeakFlux() / target.getPeakFlux();
            if (Double.isFinite(ratio)) {
                points.add(new CalibrationPoint(target.getUuid(), reference.getUuid(), position, ratio));
            }
        }
        log.debug("flux.calibration.points bright={} paired={}", bright, points.size());
        return points;
    }

    /**
     * Fits the calibration model, applying the configured fallback when the requested
     * degree cannot be fitted.
     *
     * @throws InsufficientCalibrationDataException with {@link FluxModelFallback#FAIL} and too few points
     * @throws SurfaceFitException                  with {@link FluxModelFallback#FAIL} and a singular fit
     */
    public FluxCalibrationModel fit(List<SourceRecord> targets, List<SourceRecord> references) {
        List<CalibrationPoint> points = collectPoints(targets, references);
        List<SkyPosition> positions = points.stream().map(CalibrationPoint::position).toList();
        double[] ratios = points.stream().mapToDouble(CalibrationPoint::ratio).toArray();

        int lowest = fallback == FluxModelFallback.LOWER_DEGREE ? PolynomialSurfaceFitter.MIN_DEGREE : degree;
        for (int d = degree; d >= lowest; d--) {
            int required = PolynomialSurfaceFitter.requiredPoints(d);
            if (points.size() < required) {
                if (fallback == FluxModelFallback.FAIL) {
                    throw new InsufficientCalibrationDataException(points.size(), required, d);
                }
                log.warn("flux.calibration.insufficient degree={} available={} required={}",
                        d, points.size(), required);
                continue;
            }
            try {
                SurfaceModel surface = new PolynomialSurfaceFitter(d).fit(positions, ratios);
                if (d < degree) {
                    log.warn("flux.calibration.degraded requested={} fitted={}", degree, d);
                }
                log.info("flux.calibration.fitted degree={} points={}", d, points.size());
                return new FluxCalibrationModel(surface, d, points);
            } catch (SurfaceFitException e) {
                if (fallback == FluxModelFallback.FAIL) {
                    throw e;
                }
                log.warn("flux.calibration.fitFailed degree={} reason={}", d, e.getMessage());
            }
        }
        log.warn("flux.calibration.skipped requested={} points={}; fluxes left uncorrected",
                degree, points.size());
        return FluxCalibrationModel.identity(points);
    }
}
