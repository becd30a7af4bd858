package com.catalog.crossmatch.bulk;

import com.catalog.crossmatch.schema.RawTable;

import java.util.List;

/**
 * Result of reading a catalogue file.
 *
 * @param table        the rows that could be read
 * @param totalRecords data lines seen, including rejected ones
 * @param errors       rejected lines
 */
public record ImportResult(RawTable table, long totalRecords, List<ImportError> errors) {

    public ImportResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public long successCount() {
        return table.rowCount();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * @param lineNumber line in the input (1-based)
     * @param message    why the line was rejected
     */
    public record ImportError(long lineNumber, String message) {}

    @Override
    public String toString() {
        return "ImportResult{total=" + totalRecords +
                ", rows=" + table.rowCount() +
                ", columns=" + table.getColumns().size() +
                ", errors=" + errors.size() + '}';
    }
}
