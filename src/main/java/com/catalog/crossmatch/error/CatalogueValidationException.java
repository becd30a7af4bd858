package com.catalog.crossmatch.error;

/**
 * Thrown when a catalogue cannot be turned into canonical source records.
 * Names the catalogue and, where one is involved, the offending column.
 */
public class CatalogueValidationException extends CrossMatchException {

    private final String catalogue;
    private final String column;

    public CatalogueValidationException(String catalogue, String column, String message) {
        super(ErrorKind.DATA_VALIDATION, format(catalogue, column, message));
        this.catalogue = catalogue;
        this.column = column;
    }

    public String getCatalogue() {
        return catalogue;
    }

    public String getColumn() {
        return column;
    }

    private static String format(String catalogue, String column, String message) {
        StringBuilder sb = new StringBuilder();
        sb.append("[catalogue=").append(catalogue);
        if (column != null) {
            sb.append(", column=").append(column);
        }
        sb.append("] ").append(message);
        return sb.toString();
    }
}
