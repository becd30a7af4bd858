package com.catalog.crossmatch.bulk;

import java.io.InputStream;
import java.io.Reader;

/**
 * Reads a catalogue file into a raw table for schema resolution.
 */
public interface CatalogueImporter {

    ImportResult importTable(InputStream input, ProgressCallback callback);

    ImportResult importTable(Reader reader, ProgressCallback callback);

    /**
     * Format read by this importer, e.g. "csv".
     */
    String getFormat();
}
