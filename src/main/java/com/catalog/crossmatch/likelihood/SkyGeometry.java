package com.catalog.crossmatch.likelihood;

import com.catalog.crossmatch.core.model.SkyPosition;

/**
 * Spherical geometry helpers. All angles in degrees.
 */
public final class SkyGeometry {

    public static final double ARCSEC_PER_DEGREE = 3600.0;

    private SkyGeometry() {
        // Utility class
    }

    /**
     * Great-circle separation between two positions using the haversine formula.
     */
    public static double separation(SkyPosition p1, SkyPosition p2) {
        return separation(p1.ra(), p1.dec(), p2.ra(), p2.dec());
    }

    public static double separation(double ra1, double dec1, double ra2, double dec2) {
        double phi1 = Math.toRadians(dec1);
        double phi2 = Math.toRadians(dec2);
        double dPhi = phi2 - phi1;
        double dLambda = Math.toRadians(ra2 - ra1);
        double h = Math.sin(dPhi / 2) * Math.sin(dPhi / 2)
                + Math.cos(phi1) * Math.cos(phi2) * Math.sin(dLambda / 2) * Math.sin(dLambda / 2);
        h = Math.min(1.0, Math.max(0.0, h));
        return Math.toDegrees(2.0 * Math.asin(Math.sqrt(h)));
    }

    public static double arcsecToDegrees(double arcsec) {
        return arcsec / ARCSEC_PER_DEGREE;
    }
}
