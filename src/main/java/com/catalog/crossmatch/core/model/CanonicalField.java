package com.catalog.crossmatch.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * The fixed fields every source record carries after normalization.
 *
 * <p>Angles of the beam and source shape ({@code psf_a}, {@code psf_b}, {@code a}, {@code b})
 * are in arcseconds, positions and positional errors in degrees, fluxes in the
 * catalogue's flux unit.</p>
 */
public enum CanonicalField {
    RA("ra", true, false, false),
    DEC("dec", true, false, false),
    ERR_RA("err_ra", false, false, false),
    ERR_DEC("err_dec", false, false, false),
    PSF_A("psf_a", false, true, false),
    PSF_B("psf_b", false, true, false),
    A("a", false, true, false),
    B("b", false, true, false),
    PA("pa", false, true, false),
    PEAK_FLUX("peak_flux", true, true, false),
    ERR_PEAK_FLUX("err_peak_flux", false, true, true),
    INT_FLUX("int_flux", false, true, false),
    LOCAL_RMS("local_rms", false, true, true),
    UUID("uuid", false, false, false);

    private final String columnName;
    private final boolean required;
    private final boolean frequencyDependent;
    private final boolean errorTerm;

    CanonicalField(String columnName, boolean required, boolean frequencyDependent, boolean errorTerm) {
        this.columnName = columnName;
        this.required = required;
        this.frequencyDependent = frequencyDependent;
        this.errorTerm = errorTerm;
    }

    /**
     * Canonical column name, e.g. {@code peak_flux}.
     */
    public String columnName() {
        return columnName;
    }

    /**
     * True when a catalogue without this column cannot be matched at all.
     */
    public boolean isRequired() {
        return required;
    }

    /**
     * True when multi-frequency catalogues may tag this column with a frequency.
     */
    public boolean isFrequencyDependent() {
        return frequencyDependent;
    }

    /**
     * True for uncertainty columns, which propagate in quadrature when interpolated.
     */
    public boolean isErrorTerm() {
        return errorTerm;
    }

    public static Optional<CanonicalField> fromColumnName(String name) {
        return Arrays.stream(values())
                .filter(f -> f.columnName.equalsIgnoreCase(name))
                .findFirst();
    }
}
