package com.catalog.crossmatch.correction;

import com.catalog.crossmatch.core.model.SkyPosition;
import com.catalog.crossmatch.core.model.SourceRecord;
import com.catalog.crossmatch.surface.ConstantSurface;
import com.catalog.crossmatch.surface.SurfaceModel;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Multiplicative flux correction over sky position. Immutable once built.
 *
 * <p>A non-finite factor at some position leaves that source's flux unchanged.</p>
 */
public final class FluxCalibrationModel {

    private final SurfaceModel surface;
    private final int degree;
    private final List<CalibrationPoint> points;

    FluxCalibrationModel(SurfaceModel surface, int degree, List<CalibrationPoint> points) {
        this.surface = Objects.requireNonNull(surface, "surface is required");
        this.degree = degree;
        this.points = List.copyOf(points);
    }

    /**
     * Model that leaves every flux unchanged.
     */
    public static FluxCalibrationModel identity(List<CalibrationPoint> points) {
        return new FluxCalibrationModel(ConstantSurface.ONE, 0, points);
    }

    public boolean isIdentity() {
        return degree == 0;
    }

    /**
     * Polynomial degree actually fitted, 0 for the identity model.
     */
    public int getDegree() {
        return degree;
    }

    public List<CalibrationPoint> getPoints() {
        return points;
    }

    public SurfaceModel getSurface() {
        return surface;
    }

    public double factorAt(SkyPosition position) {
        double factor = surface.evaluate(position);
        return Double.isFinite(factor) ? factor : 1.0;
    }

    public SourceRecord apply(SourceRecord source) {
        if (isIdentity()) {
            return source;
        }
        return source.withFluxScale(factorAt(source.position()));
    }

    public List<SourceRecord> apply(List<SourceRecord> sources) {
        if (isIdentity()) {
            return sources;
        }
        return sources.stream().map(this::apply).toList();
    }

    /**
     * Samples the correction factor on a regular grid spanning the given box,
     * {@code steps} points per axis.
     */
    public List<GridSample> sampleGrid(double minRa, double maxRa, double minDec, double maxDec, int steps) {
        if (steps < 2) {
            throw new IllegalArgumentException("steps must be >= 2");
        }
        List<GridSample> samples = new ArrayList<>(steps * steps);
        for (int i = 0; i < steps; i++) {
            double ra = minRa + (maxRa - minRa) * i / (steps - 1);
            for (int j = 0; j < steps; j++) {
                double dec = minDec + (maxDec - minDec) * j / (steps - 1);
                samples.add(new GridSample(ra, dec, surface.evaluate(ra, dec)));
            }
        }
        return samples;
    }

    /**
     * Grid over the bounding box of the calibration points; empty without points.
     */
    public List<GridSample> sampleGrid(int steps) {
        if (points.isEmpty()) {
            return List.of();
        }
        double minRa = Double.POSITIVE_INFINITY, maxRa = Double.NEGATIVE_INFINITY;
        double minDec = Double.POSITIVE_INFINITY, maxDec = Double.NEGATIVE_INFINITY;
        for (CalibrationPoint p : points) {
            minRa = Math.min(minRa, p.position().ra());
            maxRa = Math.max(maxRa, p.position().ra());
            minDec = Math.min(minDec, p.position().dec());
            maxDec = Math.max(maxDec, p.position().dec());
        }
        return sampleGrid(minRa, maxRa, minDec, maxDec, steps);
    }

    public record GridSample(double ra, double dec, double factor) {}

    @Override
    public String toString() {
        return "FluxCalibrationModel{surface=" + surface.getName() + ", degree=" + degree
                + ", points=" + points.size() + '}';
    }
}
