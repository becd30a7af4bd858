package com.catalog.crossmatch.correction;

import com.catalog.crossmatch.core.model.SkyPosition;

/**
 * One nearest-neighbour pair used to fit the flux-calibration surface.
 *
 * @param targetUuid    target source identifier
 * @param referenceUuid reference source identifier
 * @param position      target position
 * @param ratio         reference peak flux divided by target peak flux
 */
public record CalibrationPoint(String targetUuid, String referenceUuid, SkyPosition position, double ratio) {
}
