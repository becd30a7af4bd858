package com.catalog.crossmatch.surface;

/**
 * Surface with the same value everywhere.
 */
public record ConstantSurface(double value) implements SurfaceModel {

    public static final ConstantSurface ZERO = new ConstantSurface(0.0);
    public static final ConstantSurface ONE = new ConstantSurface(1.0);

    @Override
    public double evaluate(double ra, double dec) {
        return value;
    }

    @Override
    public String getName() {
        return "constant";
    }
}
