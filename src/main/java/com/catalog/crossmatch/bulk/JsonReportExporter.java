package com.catalog.crossmatch.bulk;

import com.catalog.crossmatch.api.CrossMatchResult;
import com.catalog.crossmatch.api.RoundSummary;
import com.catalog.crossmatch.correction.OffsetDiagnostics;
import com.catalog.crossmatch.decision.DecisionOutcome;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.List;
import java.util.Map;

/**
 * Writes a JSON summary of a run: final state, counts, per-round figures and decision
 * outcome totals.
 */
public class JsonReportExporter {
    private static final Logger log = LoggerFactory.getLogger(JsonReportExporter.class);

    private final ObjectMapper objectMapper;

    public JsonReportExporter() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public JsonReportExporter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public RunReport toReport(CrossMatchResult result) {
        List<RoundReport> rounds = result.getRounds().stream().map(JsonReportExporter::toRound).toList();
        return new RunReport(
                result.getRunId(),
                result.getFinalState().name(),
                result.isRaWrapped(),
                result.getMatches().size(),
                result.getLeftoverTargetsOriginal().size(),
                result.getLeftoverReferences().size(),
                result.getFluxCalibration().map(m -> m.getDegree()).orElse(null),
                result.getDuration().toMillis(),
                rounds,
                result.getLedger().countByOutcome());
    }

    public void export(CrossMatchResult result, Writer writer) {
        try {
            objectMapper.writeValue(writer, toReport(result));
            log.info("report.exported runId={}", result.getRunId());
        } catch (IOException e) {
            log.error("report.failed runId={} error={}", result.getRunId(), e.getMessage());
            throw new UncheckedIOException("cannot write run report", e);
        }
    }

    private static RoundReport toRound(RoundSummary s) {
        return new RoundReport(s.round(), s.forced(), s.evaluated(), s.accepted(), s.conflictsDeferred(),
                s.leftoverTargets(), s.leftoverReferences(), s.candidateSetSizes(), s.duration().toMillis(),
                s.offsetDiagnostics().map(OffsetDiagnostics::rmsResidualArcsec).orElse(null));
    }

    public record RunReport(
            String runId,
            String finalState,
            boolean raWrapped,
            int matches,
            int leftoverTargets,
            int leftoverReferences,
            Integer fluxModelDegree,
            long durationMillis,
            List<RoundReport> rounds,
            Map<DecisionOutcome, Long> decisions
    ) {}

    public record RoundReport(
            int round,
            boolean forced,
            int evaluated,
            int accepted,
            int conflictsDeferred,
            int leftoverTargets,
            int leftoverReferences,
            Map<Integer, Long> candidateSetSizes,
            long durationMillis,
            Double rmsResidualArcsec
    ) {}
}
