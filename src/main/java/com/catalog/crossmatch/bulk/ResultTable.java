package com.catalog.crossmatch.bulk;

/**
 * The tables a run can be exported as.
 */
public enum ResultTable {
    MATCHES("matches.csv"),
    LEFTOVER_REFERENCE("leftover_reference.csv"),
    LEFTOVER_TARGET_CORRECTED("leftover_target_corrected.csv"),
    LEFTOVER_TARGET_ORIGINAL("leftover_target_original.csv"),
    OFFSET_DIAGNOSTICS("offset_diagnostics.csv"),
    FLUX_GRID("flux_grid.csv");

    private final String fileName;

    ResultTable(String fileName) {
        this.fileName = fileName;
    }

    public String fileName() {
        return fileName;
    }
}
