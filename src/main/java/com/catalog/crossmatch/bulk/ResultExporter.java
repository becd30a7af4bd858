package com.catalog.crossmatch.bulk;

import com.catalog.crossmatch.api.CrossMatchResult;

import java.io.Writer;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes the tables of a run.
 */
public interface ResultExporter {

    /**
     * Writes one table.
     */
    ExportResult export(CrossMatchResult result, ResultTable table, Writer writer, ProgressCallback callback);

    /**
     * Writes every table into {@code directory}, one file each.
     */
    List<ExportResult> exportAll(CrossMatchResult result, Path directory, ProgressCallback callback);

    String getFormat();
}
