package com.catalog.crossmatch.core.model;

/**
 * Equatorial sky position in degrees.
 * Right ascension may be negative after wrap-around normalization.
 */
public record SkyPosition(double ra, double dec) {

    public SkyPosition {
        if (!Double.isFinite(ra) || !Double.isFinite(dec)) {
            throw new IllegalArgumentException("Position must be finite, got ra=" + ra + " dec=" + dec);
        }
        if (dec < -90.0 || dec > 90.0) {
            throw new IllegalArgumentException("Declination must be between -90 and 90, got " + dec);
        }
    }

    /**
     * Returns this position moved by the given offsets (degrees).
     */
    public SkyPosition shiftedBy(double dRa, double dDec) {
        double newDec = Math.max(-90.0, Math.min(90.0, dec + dDec));
        return new SkyPosition(ra + dRa, newDec);
    }
}
