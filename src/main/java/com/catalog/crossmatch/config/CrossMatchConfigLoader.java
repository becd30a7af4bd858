package com.catalog.crossmatch.config;

import com.catalog.crossmatch.api.CrossMatchOptions;
import com.catalog.crossmatch.correction.FluxModelFallback;
import com.catalog.crossmatch.error.ConfigurationException;
import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfigBuilder;
import org.eclipse.microprofile.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.function.Consumer;

/**
 * Reads run parameters from MicroProfile Config.
 *
 * <p>Keys live under {@code crossmatch.}; system properties, environment variables
 * ({@code CROSSMATCH_SNR_CUTOFF}) and {@code META-INF/microprofile-config.properties} are
 * consulted, plus an optional properties file ranked below the environment.</p>
 *
 * <pre>
 * crossmatch.input.target=target.csv
 * crossmatch.input.reference=reference.csv
 * crossmatch.output.directory=out
 * crossmatch.flux-model=true
 * crossmatch.flux-model-degree=2
 * </pre>
 */
public class CrossMatchConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(CrossMatchConfigLoader.class);

    public static final String PREFIX = "crossmatch.";
    static final int FILE_ORDINAL = 250;

    public static final String SNR_RESTRICTION = PREFIX + "snr-restriction";
    public static final String SNR_CUTOFF = PREFIX + "snr-cutoff";
    public static final String FLUX_MATCHING = PREFIX + "flux-matching";
    public static final String FLUX_MODEL = PREFIX + "flux-model";
    public static final String FLUX_MODEL_DEGREE = PREFIX + "flux-model-degree";
    public static final String FLUX_MODEL_FALLBACK = PREFIX + "flux-model-fallback";
    public static final String SINGLE_MATCH_THRESHOLD = PREFIX + "single-match-threshold";
    public static final String MULTIPLE_MATCH_THRESHOLD = PREFIX + "multiple-match-threshold";
    public static final String NEGLIGIBLE_LIKELIHOOD = PREFIX + "negligible-likelihood";
    public static final String TARGET_FREQUENCY = PREFIX + "target-frequency-mhz";
    public static final String ALLOW_EXTRAPOLATION = PREFIX + "allow-frequency-extrapolation";
    public static final String SEARCH_RADIUS = PREFIX + "search-radius-arcsec";
    public static final String FLUX_CALIBRATION_RADIUS = PREFIX + "flux-calibration-radius-arcsec";
    public static final String OFFSET_SMOOTHING = PREFIX + "offset-smoothing";
    public static final String MAX_ROUNDS = PREFIX + "max-rounds";
    public static final String PARALLELISM = PREFIX + "parallelism";
    public static final String FORCE_FINAL_ROUND = PREFIX + "force-final-round";
    public static final String REFERENCE_PRE_FILTER = PREFIX + "reference-pre-filter";

    public static final String INPUT_TARGET = PREFIX + "input.target";
    public static final String INPUT_REFERENCE = PREFIX + "input.reference";
    public static final String SCHEMA_TARGET = PREFIX + "schema.target";
    public static final String SCHEMA_REFERENCE = PREFIX + "schema.reference";
    public static final String OUTPUT_DIRECTORY = PREFIX + "output.directory";
    public static final String OUTPUT_REPORT = PREFIX + "output.report";

    static final String DEFAULT_OUTPUT_DIRECTORY = "crossmatch-output";

    private final Config config;

    public CrossMatchConfigLoader(Config config) {
        this.config = config;
    }

    /**
     * System properties, environment and {@code META-INF/microprofile-config.properties}.
     */
    public static CrossMatchConfigLoader fromDefaultSources() {
        return new CrossMatchConfigLoader(new SmallRyeConfigBuilder().addDefaultSources().build());
    }

    /**
     * Default sources plus a properties file.
     */
    public static CrossMatchConfigLoader fromFile(Path file) {
        Properties properties = new Properties();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            properties.load(reader);
        } catch (IOException e) {
            throw new ConfigurationException("configFile", "cannot read " + file + ": " + e.getMessage());
        }
        Map<String, String> values = new HashMap<>();
        properties.stringPropertyNames().forEach(k -> values.put(k, properties.getProperty(k)));
        log.info("config.file.loaded path={} keys={}", file, values.size());
        return new CrossMatchConfigLoader(new SmallRyeConfigBuilder()
                .addDefaultSources()
                .withSources(new PropertiesConfigSource(values, file.toString(), FILE_ORDINAL))
                .build());
    }

    /**
     * Only the given values; no system or environment lookup.
     */
    public static CrossMatchConfigLoader fromMap(Map<String, String> values) {
        return new CrossMatchConfigLoader(new SmallRyeConfigBuilder()
                .withSources(new PropertiesConfigSource(values, "in-memory", FILE_ORDINAL))
                .build());
    }

    public CrossMatchOptions loadOptions() {
        CrossMatchOptions.Builder b = CrossMatchOptions.builder();
        apply(SNR_RESTRICTION, Boolean.class, b::snrRestriction);
        apply(SNR_CUTOFF, Double.class, b::snrCutoff);
        apply(FLUX_MATCHING, Boolean.class, b::fluxMatching);
        apply(FLUX_MODEL, Boolean.class, b::fluxModel);
        apply(FLUX_MODEL_DEGREE, Integer.class, b::fluxModelDegree);
        apply(FLUX_MODEL_FALLBACK, String.class, v -> b.fluxModelFallback(fallback(v)));
        apply(SINGLE_MATCH_THRESHOLD, Double.class, b::singleMatchThreshold);
        apply(MULTIPLE_MATCH_THRESHOLD, Double.class, b::multipleMatchThreshold);
        apply(NEGLIGIBLE_LIKELIHOOD, Double.class, b::negligibleLikelihood);
        apply(TARGET_FREQUENCY, Double.class, b::targetFrequencyMHz);
        apply(ALLOW_EXTRAPOLATION, Boolean.class, b::allowFrequencyExtrapolation);
        apply(SEARCH_RADIUS, Double.class, b::searchRadiusArcsec);
        apply(FLUX_CALIBRATION_RADIUS, Double.class, b::fluxCalibrationRadiusArcsec);
        apply(OFFSET_SMOOTHING, Double.class, b::offsetSmoothing);
        apply(MAX_ROUNDS, Integer.class, b::maxRounds);
        apply(PARALLELISM, Integer.class, b::parallelism);
        apply(FORCE_FINAL_ROUND, Boolean.class, b::forceFinalRound);
        apply(REFERENCE_PRE_FILTER, Boolean.class, b::referencePreFilter);
        CrossMatchOptions options = b.build();
        log.debug("config.options.loaded options={}", options);
        return options;
    }

    public RunConfiguration loadRunConfiguration() {
        Path target = value(INPUT_TARGET, String.class).map(Path::of)
                .orElseThrow(() -> new ConfigurationException(INPUT_TARGET, "target catalogue file is required"));
        Path reference = value(INPUT_REFERENCE, String.class).map(Path::of)
                .orElseThrow(() -> new ConfigurationException(INPUT_REFERENCE, "reference catalogue file is required"));
        return new RunConfiguration(
                target,
                reference,
                value(SCHEMA_TARGET, String.class).map(Path::of).orElse(null),
                value(SCHEMA_REFERENCE, String.class).map(Path::of).orElse(null),
                Path.of(value(OUTPUT_DIRECTORY, String.class).orElse(DEFAULT_OUTPUT_DIRECTORY)),
                value(OUTPUT_REPORT, Boolean.class).orElse(true));
    }

    private <T> void apply(String key, Class<T> type, Consumer<T> setter) {
        value(key, type).ifPresent(setter);
    }

    private <T> Optional<T> value(String key, Class<T> type) {
        try {
            return config.getOptionalValue(key, type);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(key, "cannot convert value to " + type.getSimpleName()
                    + ": " + e.getMessage());
        }
    }

    private static FluxModelFallback fallback(String value) {
        try {
            return FluxModelFallback.valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(FLUX_MODEL_FALLBACK, "unknown fallback '" + value
                    + "', expected FAIL, LOWER_DEGREE or SKIP");
        }
    }
}
