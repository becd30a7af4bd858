package com.catalog.crossmatch.config;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Where a batch run reads its catalogues and writes its results.
 *
 * @param targetCatalogue    CSV file of the target catalogue
 * @param referenceCatalogue CSV file of the reference catalogue
 * @param targetSchema       JSON schema file for the target, or null for the canonical columns
 * @param referenceSchema    JSON schema file for the reference, or null for the canonical columns
 * @param outputDirectory    directory receiving the result tables
 * @param writeReport        whether to write {@code report.json} next to the tables
 */
public record RunConfiguration(
        Path targetCatalogue,
        Path referenceCatalogue,
        Path targetSchema,
        Path referenceSchema,
        Path outputDirectory,
        boolean writeReport
) {
    public static final String REPORT_FILE = "report.json";

    public RunConfiguration {
        Objects.requireNonNull(targetCatalogue, "targetCatalogue is required");
        Objects.requireNonNull(referenceCatalogue, "referenceCatalogue is required");
        Objects.requireNonNull(outputDirectory, "outputDirectory is required");
    }

    public Optional<Path> targetSchemaFile() {
        return Optional.ofNullable(targetSchema);
    }

    public Optional<Path> referenceSchemaFile() {
        return Optional.ofNullable(referenceSchema);
    }
}
