package com.catalog.crossmatch.surface;

import com.catalog.crossmatch.core.model.SkyPosition;

import java.util.List;

/**
 * A fitted smooth scalar surface over sky position.
 */
public interface SurfaceModel {

    /**
     * Value of the surface at (ra, dec) in degrees.
     */
    double evaluate(double ra, double dec);

    default double evaluate(SkyPosition position) {
        return evaluate(position.ra(), position.dec());
    }

    default double[] evaluate(List<SkyPosition> positions) {
        double[] values = new double[positions.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = evaluate(positions.get(i));
        }
        return values;
    }

    /**
     * Short model name used in logs, metrics and errors.
     */
    String getName();
}
