package com.catalog.crossmatch.schema;

import com.catalog.crossmatch.core.model.CanonicalField;
import com.catalog.crossmatch.core.model.Catalogue;
import com.catalog.crossmatch.core.model.CatalogueRole;
import com.catalog.crossmatch.core.model.SourceRecord;
import com.catalog.crossmatch.error.CatalogueValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Turns a raw table into a canonical {@link Catalogue} using a {@link CatalogueSchema}.
 *
 * <p>Each canonical field is looked up once: first under its mapped column name, then,
 * for frequency-dependent fields, under the frequency-tagged names the schema declares.
 * Missing optional fields become zeros; a missing required field is fatal. Blank optional
 * cells are read as zero.</p>
 */
public class SchemaResolver {
    private static final Logger log = LoggerFactory.getLogger(SchemaResolver.class);

    private final boolean allowExtrapolation;

    public SchemaResolver() {
        this(true);
    }

    public SchemaResolver(boolean allowExtrapolation) {
        this.allowExtrapolation = allowExtrapolation;
    }

    /**
     * @param table             the raw table
     * @param schema            column mapping for this catalogue
     * @param role              target or reference
     * @param targetFrequencyMHz frequency of the target catalogue, or null when unknown
     * @throws CatalogueValidationException if a required column is missing or unreadable,
     *                                      or frequencies cannot be reconciled
     */
    public Catalogue resolve(RawTable table, CatalogueSchema schema, CatalogueRole role, Double targetFrequencyMHz) {
        String name = schema.getName();
        int rows = table.rowCount();
        Map<CanonicalField, double[]> values = new EnumMap<>(CanonicalField.class);
        FrequencyInterpolator.Weights weights = null;

        for (CanonicalField field : CanonicalField.values()) {
            if (field == CanonicalField.UUID) {
                continue;
            }
            String column = schema.columnFor(field);
            OptionalInt direct = table.columnIndex(column);
            if (direct.isPresent()) {
                values.put(field, readColumn(table, name, column, direct.getAsInt(), field.isRequired()));
                continue;
            }
            if (field.isFrequencyDependent() && schema.getFrequencyAffix() != FrequencyAffix.NONE) {
                if (weights == null) {
                    weights = weightsFor(schema, targetFrequencyMHz);
                }
                double[] tagged = readTagged(table, schema, field, column, weights);
                if (tagged != null) {
                    values.put(field, tagged);
                    continue;
                }
            }
            if (field.isRequired()) {
                throw new CatalogueValidationException(name, column, "could not find column '" + column
                        + "'" + taggedHint(schema, column) + "; edit the schema to reflect the catalogue column names");
            }
            log.warn("catalogue.column.missing catalogue={} column={}; margin of error will now be tighter"
                    + " and match probabilities lower", name, column);
            values.put(field, new double[rows]);
        }

        List<String> uuids = readUuids(table, schema, rows);
        List<SourceRecord> sources = new ArrayList<>(rows);
        for (int row = 0; row < rows; row++) {
            SourceRecord.Builder builder = SourceRecord.builder().uuid(uuids.get(row));
            for (Map.Entry<CanonicalField, double[]> e : values.entrySet()) {
                builder.set(e.getKey(), e.getValue()[row]);
            }
            try {
                sources.add(builder.build());
            } catch (IllegalArgumentException e) {
                throw new CatalogueValidationException(name, null, "row " + (row + 1) + ": " + e.getMessage());
            }
        }

        Double frequency = catalogueFrequency(schema, role, targetFrequencyMHz);
        log.info("catalogue.resolved catalogue={} role={} sources={} frequencyMHz={}",
                name, role, sources.size(), frequency);
        return new Catalogue(name, role, sources, frequency);
    }

    private FrequencyInterpolator.Weights weightsFor(CatalogueSchema schema, Double targetFrequencyMHz) {
        if (!schema.isMultiFrequency()) {
            return FrequencyInterpolator.weightsFor(schema.getName(), schema.getFrequencies(), Double.NaN, true);
        }
        if (targetFrequencyMHz == null) {
            throw new CatalogueValidationException(schema.getName(), null,
                    "catalogue exposes fluxes at " + schema.getFrequencies()
                            + " MHz; a target frequency is required to interpolate them");
        }
        FrequencyInterpolator.Weights w = FrequencyInterpolator.weightsFor(
                schema.getName(), schema.getFrequencies(), targetFrequencyMHz, allowExtrapolation);
        log.debug("catalogue.frequency.weights catalogue={} low={} high={} wLow={} wHigh={}",
                schema.getName(), w.lowTag(), w.highTag(), w.lowWeight(), w.highWeight());
        return w;
    }

    private static double[] readTagged(RawTable table, CatalogueSchema schema, CanonicalField field,
                                       String column, FrequencyInterpolator.Weights weights) {
        OptionalInt low = find(table, schema.getFrequencyAffix().tagged(column, weights.lowTag()));
        if (low.isEmpty()) {
            return null;
        }
        double[] lowValues = readColumn(table, schema.getName(), column, low.getAsInt(), field.isRequired());
        if (weights.isSingle()) {
            return lowValues;
        }
        OptionalInt high = find(table, schema.getFrequencyAffix().tagged(column, weights.highTag()));
        if (high.isEmpty()) {
            return null;
        }
        double[] highValues = readColumn(table, schema.getName(), column, high.getAsInt(), field.isRequired());
        double[] combined = new double[lowValues.length];
        for (int i = 0; i < combined.length; i++) {
            combined[i] = field.isErrorTerm()
                    ? weights.error(lowValues[i], highValues[i])
                    : weights.value(lowValues[i], highValues[i]);
        }
        return combined;
    }

    private static OptionalInt find(RawTable table, List<String> names) {
        for (String n : names) {
            OptionalInt i = table.columnIndex(n);
            if (i.isPresent()) {
                return i;
            }
        }
        return OptionalInt.empty();
    }

    private static double[] readColumn(RawTable table, String catalogue, String column, int index, boolean required) {
        double[] values = new double[table.rowCount()];
        for (int row = 0; row < values.length; row++) {
            String cell = table.cell(row, index);
            if (cell == null || cell.isBlank()) {
                if (required) {
                    throw new CatalogueValidationException(catalogue, column, "row " + (row + 1) + " is empty");
                }
                continue;
            }
            try {
                values[row] = Double.parseDouble(cell.trim());
            } catch (NumberFormatException e) {
                throw new CatalogueValidationException(catalogue, column,
                        "row " + (row + 1) + " is not a number: '" + cell + "'");
            }
        }
        return values;
    }

    private static List<String> readUuids(RawTable table, CatalogueSchema schema, int rows) {
        OptionalInt index = table.columnIndex(schema.columnFor(CanonicalField.UUID));
        List<String> uuids = new ArrayList<>(rows);
        for (int row = 0; row < rows; row++) {
            String cell = index.isPresent() ? table.cell(row, index.getAsInt()) : null;
            uuids.add(cell != null && !cell.isBlank() ? cell.trim() : schema.getName() + "-" + (row + 1));
        }
        return uuids;
    }

    private static String taggedHint(CatalogueSchema schema, String column) {
        if (schema.getFrequencyAffix() == FrequencyAffix.NONE) {
            return "";
        }
        List<String> names = new ArrayList<>();
        for (String tag : schema.getFrequencies()) {
            names.addAll(schema.getFrequencyAffix().tagged(column, tag));
        }
        return " or any of " + names;
    }

    private static Double catalogueFrequency(CatalogueSchema schema, CatalogueRole role, Double targetFrequencyMHz) {
        if (role == CatalogueRole.TARGET || schema.isMultiFrequency()) {
            return targetFrequencyMHz;
        }
        if (schema.getFrequencies().size() == 1) {
            return Double.parseDouble(schema.getFrequencies().get(0));
        }
        return null;
    }
}
