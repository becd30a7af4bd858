package com.catalog.crossmatch.config;

import com.catalog.crossmatch.api.CrossMatchOptions;
import com.catalog.crossmatch.api.CrossMatchResult;
import com.catalog.crossmatch.api.CrossMatcher;
import com.catalog.crossmatch.bulk.CsvCatalogueImporter;
import com.catalog.crossmatch.bulk.CsvResultExporter;
import com.catalog.crossmatch.bulk.ImportResult;
import com.catalog.crossmatch.bulk.JsonReportExporter;
import com.catalog.crossmatch.bulk.ProgressCallback;
import com.catalog.crossmatch.error.CrossMatchException;
import com.catalog.crossmatch.metrics.MetricsService;
import com.catalog.crossmatch.metrics.MicrometerMetricsService;
import com.catalog.crossmatch.schema.CatalogueSchema;
import com.catalog.crossmatch.schema.CatalogueSchemaLoader;
import com.catalog.crossmatch.schema.DefaultSchemas;
import com.catalog.crossmatch.schema.RawTable;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Batch entry point: reads two CSV catalogues, cross-matches them and writes the result
 * tables (and a JSON report) to the output directory.
 *
 * <pre>
 * java -cp ... com.catalog.crossmatch.config.CrossMatchApplication [crossmatch.properties]
 * </pre>
 */
public class CrossMatchApplication {
    private static final Logger log = LoggerFactory.getLogger(CrossMatchApplication.class);

    private final CrossMatchOptions options;
    private final RunConfiguration runConfiguration;
    private final MetricsService metricsService;

    public CrossMatchApplication(CrossMatchOptions options, RunConfiguration runConfiguration,
                                 MetricsService metricsService) {
        this.options = options;
        this.runConfiguration = runConfiguration;
        this.metricsService = metricsService;
    }

    public static void main(String[] args) {
        int status;
        try {
            CrossMatchConfigLoader loader = args.length > 0
                    ? CrossMatchConfigLoader.fromFile(Path.of(args[0]))
                    : CrossMatchConfigLoader.fromDefaultSources();
            CrossMatchApplication app = new CrossMatchApplication(loader.loadOptions(),
                    loader.loadRunConfiguration(), new MicrometerMetricsService(new SimpleMeterRegistry()));
            app.run();
            status = 0;
        } catch (CrossMatchException e) {
            log.error("application.failed kind={} error={}", e.getKind(), e.getMessage());
            status = 1;
        } catch (UncheckedIOException e) {
            log.error("application.failed error={}", e.getMessage());
            status = 1;
        }
        System.exit(status);
    }

    /**
     * Runs the configured cross-match and writes its outputs.
     */
    public CrossMatchResult run() {
        RawTable target = read(runConfiguration.targetCatalogue());
        RawTable reference = read(runConfiguration.referenceCatalogue());
        CatalogueSchemaLoader schemaLoader = new CatalogueSchemaLoader();
        CatalogueSchema targetSchema = runConfiguration.targetSchemaFile()
                .map(schemaLoader::load)
                .orElseGet(() -> DefaultSchemas.canonical("target"));
        CatalogueSchema referenceSchema = runConfiguration.referenceSchemaFile()
                .map(schemaLoader::load)
                .orElseGet(() -> DefaultSchemas.canonical("reference"));

        CrossMatchResult result;
        try (CrossMatcher matcher = CrossMatcher.builder()
                .options(options)
                .metricsService(metricsService)
                .build()) {
            result = matcher.run(target, targetSchema, reference, referenceSchema);
        }

        new CsvResultExporter().exportAll(result, runConfiguration.outputDirectory(), ProgressCallback.NOOP);
        if (runConfiguration.writeReport()) {
            Path report = runConfiguration.outputDirectory().resolve(RunConfiguration.REPORT_FILE);
            try (Writer w = Files.newBufferedWriter(report, StandardCharsets.UTF_8)) {
                new JsonReportExporter().export(result, w);
            } catch (IOException e) {
                throw new UncheckedIOException("cannot write " + report, e);
            }
        }
        log.info("application.completed state={} matches={} rounds={} output={}",
                result.getFinalState(), result.getMatches().size(), result.getRoundCount(),
                runConfiguration.outputDirectory());
        return result;
    }

    private static RawTable read(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            ImportResult imported = new CsvCatalogueImporter().importTable(in, ProgressCallback.NOOP);
            if (imported.hasErrors()) {
                log.warn("application.import.skipped file={} rows={}", file, imported.errors().size());
            }
            return imported.table();
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read " + file, e);
        }
    }
}
