package com.catalog.crossmatch.schema;

import com.catalog.crossmatch.core.model.CanonicalField;
import com.catalog.crossmatch.error.ConfigurationException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads catalogue schemas from JSON documents.
 *
 * <pre>
 * {
 *   "name": "gleam",
 *   "columns": { "ra": "RAJ2000", "dec": "DEJ2000", "uuid": "GLEAM" },
 *   "frequencyAffix": "SUFFIX",
 *   "frequencies": ["076", "084", "092"]
 * }
 * </pre>
 *
 * <p>Column keys are canonical field names; unknown keys are rejected.</p>
 */
public class CatalogueSchemaLoader {
    private static final Logger log = LoggerFactory.getLogger(CatalogueSchemaLoader.class);

    private final ObjectMapper objectMapper;

    public CatalogueSchemaLoader() {
        this(new ObjectMapper());
    }

    public CatalogueSchemaLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public CatalogueSchema load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("schema", "cannot read schema file " + path + ": " + e.getMessage());
        }
    }

    /**
     * @param source description of where the document came from, used in errors
     */
    public CatalogueSchema load(InputStream in, String source) {
        SchemaDocument doc;
        try {
            doc = objectMapper.readValue(in, SchemaDocument.class);
        } catch (IOException e) {
            throw new ConfigurationException("schema", "invalid schema document " + source + ": " + e.getMessage());
        }
        if (doc.name() == null || doc.name().isBlank()) {
            throw new ConfigurationException("schema.name", "schema " + source + " has no name");
        }

        CatalogueSchema.Builder builder = CatalogueSchema.builder(doc.name());
        if (doc.columns() != null) {
            for (Map.Entry<String, String> e : doc.columns().entrySet()) {
                CanonicalField field = CanonicalField.fromColumnName(e.getKey())
                        .orElseThrow(() -> new ConfigurationException("schema.columns",
                                "unknown canonical field '" + e.getKey() + "' in " + source));
                builder.column(field, e.getValue());
            }
        }
        try {
            if (doc.frequencyAffix() != null) {
                builder.frequencyAffix(FrequencyAffix.valueOf(doc.frequencyAffix().toUpperCase(Locale.ROOT)));
            }
            if (doc.frequencies() != null) {
                doc.frequencies().forEach(builder::frequency);
            }
            CatalogueSchema schema = builder.build();
            log.debug("schema.loaded source={} schema={}", source, schema);
            return schema;
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("schema", e.getMessage() + " (" + source + ")");
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SchemaDocument(
            String name,
            Map<String, String> columns,
            @JsonProperty("frequencyAffix") String frequencyAffix,
            List<String> frequencies
    ) {}
}
