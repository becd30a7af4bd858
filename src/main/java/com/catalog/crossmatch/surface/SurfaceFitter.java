package com.catalog.crossmatch.surface;

import com.catalog.crossmatch.core.model.SkyPosition;
import com.catalog.crossmatch.error.SurfaceFitException;

import java.util.List;

/**
 * Fits a {@link SurfaceModel} to values sampled at sky positions.
 */
public interface SurfaceFitter {

    /**
     * @param points sample positions
     * @param values one value per position
     * @throws SurfaceFitException if the system is under-determined or singular
     */
    SurfaceModel fit(List<SkyPosition> points, double[] values);

    /**
     * Fewest points this fitter accepts.
     */
    int minimumPoints();

    String getName();
}
