package com.catalog.crossmatch.core.model;

/**
 * Role a catalogue plays in a cross-match run.
 */
public enum CatalogueRole {
    /** Catalogue whose positions and fluxes are corrected and matched. */
    TARGET,

    /** Trusted catalogue the target is matched against. */
    REFERENCE
}
