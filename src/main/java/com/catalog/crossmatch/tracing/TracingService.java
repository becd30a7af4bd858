package com.catalog.crossmatch.tracing;

import java.util.Map;

/**
 * Creates spans around the stages of a run: the run itself, flux calibration,
 * each matching round and each offset refit.
 * The default {@link NoOpTracingService} does nothing.
 */
public interface TracingService {

    String RUN = "crossmatch.run";
    String FLUX_CALIBRATION = "crossmatch.flux.calibration";
    String ROUND = "crossmatch.round";
    String OFFSET_FIT = "crossmatch.offset.fit";

    Span startSpan(String operationName);

    Span startSpan(String operationName, Map<String, String> attributes);
}
