package com.catalog.crossmatch.schema;

import java.util.List;

/**
 * Where a frequency tag sits in a frequency-dependent column name.
 */
public enum FrequencyAffix {
    /** Columns carry no frequency tag. */
    NONE,
    /** {@code 181_peak_flux} or {@code 181peak_flux}. */
    PREFIX,
    /** {@code peak_flux_181} or {@code peak_flux181}. */
    SUFFIX;

    /**
     * Candidate column names for {@code column} tagged with {@code tag}, in lookup order.
     */
    public List<String> tagged(String column, String tag) {
        return switch (this) {
            case NONE -> List.of();
            case PREFIX -> List.of(tag + "_" + column, tag + column);
            case SUFFIX -> List.of(column + "_" + tag, column + tag);
        };
    }
}
