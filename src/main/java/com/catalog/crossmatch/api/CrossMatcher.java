package com.catalog.crossmatch.api;

import com.catalog.crossmatch.core.model.Catalogue;
import com.catalog.crossmatch.core.model.CatalogueRole;
import com.catalog.crossmatch.metrics.MetricsService;
import com.catalog.crossmatch.metrics.NoOpMetricsService;
import com.catalog.crossmatch.schema.CatalogueSchema;
import com.catalog.crossmatch.schema.RawTable;
import com.catalog.crossmatch.schema.SchemaResolver;
import com.catalog.crossmatch.tracing.NoOpTracingService;
import com.catalog.crossmatch.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Main entry point for cross-matching a target catalogue against a reference catalogue.
 *
 * <pre>
 * try (CrossMatcher matcher = CrossMatcher.builder()
 *         .options(CrossMatchOptions.builder().fluxModel(true).fluxModelDegree(2).build())
 *         .metricsService(new MicrometerMetricsService(registry))
 *         .build()) {
 *     CrossMatchResult result = matcher.run(target, reference);
 *     result.getMatches().forEach(m -&gt; ...);
 * }
 * </pre>
 *
 * <p>With {@code parallelism > 1} the matcher owns a fixed thread pool used to score target
 * sources; closing the matcher shuts it down.</p>
 */
public class CrossMatcher implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CrossMatcher.class);

    private final CrossMatchOptions defaultOptions;
    private final CrossMatchService service;
    private final ExecutorService executor;
    private final MetricsService metricsService;
    private final TracingService tracingService;

    private CrossMatcher(Builder builder) {
        this.defaultOptions = builder.options;
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        this.tracingService = builder.tracingService != null
                ? builder.tracingService : new NoOpTracingService();
        this.executor = defaultOptions.getParallelism() > 1
                ? Executors.newFixedThreadPool(defaultOptions.getParallelism()) : null;
        this.service = new CrossMatchService(metricsService, tracingService, executor);
        log.info("CrossMatcher initialized with parallelism={}", defaultOptions.getParallelism());
    }

    public CrossMatchResult run(Catalogue target, Catalogue reference) {
        return run(target, reference, defaultOptions, RoundListener.NOOP);
    }

    public CrossMatchResult run(Catalogue target, Catalogue reference, RoundListener listener) {
        return run(target, reference, defaultOptions, listener);
    }

    /**
     * Runs with other options. Scoring is parallel only if this matcher was built with
     * {@code parallelism > 1}.
     */
    public CrossMatchResult run(Catalogue target, Catalogue reference, CrossMatchOptions options,
                                RoundListener listener) {
        return service.run(target, reference, options, listener);
    }

    /**
     * Resolves both raw tables through their schemas, then runs.
     */
    public CrossMatchResult run(RawTable target, CatalogueSchema targetSchema,
                                RawTable reference, CatalogueSchema referenceSchema) {
        SchemaResolver resolver = new SchemaResolver(defaultOptions.isAllowFrequencyExtrapolation());
        Double frequency = defaultOptions.getTargetFrequencyMHz().isPresent()
                ? defaultOptions.getTargetFrequencyMHz().getAsDouble() : null;
        Catalogue t = resolver.resolve(target, targetSchema, CatalogueRole.TARGET, frequency);
        Catalogue r = resolver.resolve(reference, referenceSchema, CatalogueRole.REFERENCE, frequency);
        return run(t, r);
    }

    public CrossMatchOptions getDefaultOptions() {
        return defaultOptions;
    }

    public MetricsService getMetricsService() {
        return metricsService;
    }

    public TracingService getTracingService() {
        return tracingService;
    }

    @Override
    public void close() {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private CrossMatchOptions options = CrossMatchOptions.defaults();
        private MetricsService metricsService;
        private TracingService tracingService;

        public Builder options(CrossMatchOptions options) {
            this.options = options;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public CrossMatcher build() {
            if (options == null) {
                throw new IllegalStateException("options are required");
            }
            return new CrossMatcher(this);
        }
    }
}
