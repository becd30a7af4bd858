package com.catalog.crossmatch.schema;

import com.catalog.crossmatch.core.model.CanonicalField;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Declarative mapping from a catalogue's own column names to the canonical fields.
 *
 * <p>Fields without an explicit mapping are looked up under their canonical name.
 * A schema may declare the frequencies its frequency-dependent columns are tagged with
 * and whether the tag is a prefix or a suffix.</p>
 */
public final class CatalogueSchema {

    private final String name;
    private final Map<CanonicalField, String> columns;
    private final FrequencyAffix frequencyAffix;
    private final List<String> frequencies;

    private CatalogueSchema(Builder builder) {
        this.name = builder.name;
        this.columns = Collections.unmodifiableMap(new EnumMap<>(builder.columns));
        this.frequencyAffix = builder.frequencyAffix;
        this.frequencies = List.copyOf(builder.frequencies);
    }

    public String getName() {
        return name;
    }

    /**
     * Source column holding {@code field}, the canonical name when unmapped.
     */
    public String columnFor(CanonicalField field) {
        return columns.getOrDefault(field, field.columnName());
    }

    public Map<CanonicalField, String> getColumns() {
        return columns;
    }

    public FrequencyAffix getFrequencyAffix() {
        return frequencyAffix;
    }

    /**
     * Frequency tags as they appear in column names, e.g. {@code "076"}.
     */
    public List<String> getFrequencies() {
        return frequencies;
    }

    public boolean isMultiFrequency() {
        return frequencies.size() > 1;
    }

    @Override
    public String toString() {
        return "CatalogueSchema{name='" + name + "', mapped=" + columns.size()
                + ", affix=" + frequencyAffix + ", frequencies=" + frequencies + '}';
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static final class Builder {
        private final String name;
        private final Map<CanonicalField, String> columns = new EnumMap<>(CanonicalField.class);
        private FrequencyAffix frequencyAffix = FrequencyAffix.NONE;
        private final List<String> frequencies = new ArrayList<>();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name is required");
        }

        public Builder column(CanonicalField field, String column) {
            if (column == null || column.isBlank()) {
                throw new IllegalArgumentException("column for " + field.columnName() + " must not be blank");
            }
            columns.put(field, column);
            return this;
        }

        public Builder frequencyAffix(FrequencyAffix affix) {
            this.frequencyAffix = Objects.requireNonNull(affix, "affix is required");
            return this;
        }

        /**
         * Adds a frequency tag; its numeric value is the frequency in MHz.
         */
        public Builder frequency(String tag) {
            try {
                Double.parseDouble(tag);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("frequency tag must be numeric: " + tag, e);
            }
            frequencies.add(tag);
            return this;
        }

        public CatalogueSchema build() {
            if (frequencyAffix != FrequencyAffix.NONE && frequencies.isEmpty()) {
                throw new IllegalArgumentException("schema '" + name + "' declares a "
                        + frequencyAffix + " frequency affix but no frequencies");
            }
            return new CatalogueSchema(this);
        }
    }
}
