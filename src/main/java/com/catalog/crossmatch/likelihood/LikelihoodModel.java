package com.catalog.crossmatch.likelihood;

import com.catalog.crossmatch.core.model.SkyPosition;
import com.catalog.crossmatch.core.model.SourceRecord;

/**
 * Scores how likely a target source and a reference source are the same object.
 * Implementations return a value between 0.0 (incompatible) and 1.0 (perfect coincidence).
 */
public interface LikelihoodModel {

    /**
     * Computes the likelihood of a pair.
     *
     * @param target         the target source (fluxes already calibrated)
     * @param targetPosition the position the target is evaluated at (offset-corrected)
     * @param reference      the reference source
     * @return likelihood between 0.0 and 1.0
     */
    double likelihood(SourceRecord target, SkyPosition targetPosition, SourceRecord reference);

    /**
     * Returns the name of this model.
     */
    String getName();
}
