package com.catalog.crossmatch.bulk;

/**
 * Result of exporting one table.
 *
 * @param table which table
 * @param rows  data rows written
 */
public record ExportResult(ResultTable table, long rows) {

    @Override
    public String toString() {
        return "ExportResult{table=" + table + ", rows=" + rows + '}';
    }
}
