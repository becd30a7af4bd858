package com.catalog.crossmatch.bulk;

import com.catalog.crossmatch.api.ConvergenceState;
import com.catalog.crossmatch.api.CrossMatchResult;
import com.catalog.crossmatch.api.RoundSummary;
import com.catalog.crossmatch.decision.DecisionLedger;
import com.catalog.crossmatch.decision.DecisionOutcome;
import com.catalog.crossmatch.decision.MatchDecisionRecord;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonReportExporterTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private static CrossMatchResult result() {
        DecisionLedger ledger = new DecisionLedger();
        ledger.record(MatchDecisionRecord.builder().round(1).targetUuid("t-1")
                .outcome(DecisionOutcome.ACCEPTED).build());
        ledger.record(MatchDecisionRecord.builder().round(1).targetUuid("t-2")
                .outcome(DecisionOutcome.NO_CANDIDATES).build());
        RoundSummary round = new RoundSummary(1, false, 2, 1, 0, 1, 4, Map.of(0, 1L, 1, 1L),
                Duration.ofMillis(12), null);
        return CrossMatchResult.builder()
                .runId("run-7")
                .rounds(List.of(round))
                .finalState(ConvergenceState.CONVERGED)
                .ledger(ledger)
                .duration(Duration.ofMillis(40))
                .build();
    }

    @Test
    @DisplayName("Report should summarize the run and each round")
    void testReport() throws IOException {
        StringWriter out = new StringWriter();

        new JsonReportExporter().export(result(), out);

        JsonNode json = mapper.readTree(out.toString());
        assertEquals("run-7", json.get("runId").asText());
        assertEquals("CONVERGED", json.get("finalState").asText());
        assertTrue(json.get("fluxModelDegree").isNull());
        assertEquals(40, json.get("durationMillis").asLong());
        assertEquals(1, json.get("decisions").get("ACCEPTED").asLong());
        assertEquals(1, json.get("decisions").get("NO_CANDIDATES").asLong());

        JsonNode round = json.get("rounds").get(0);
        assertEquals(2, round.get("evaluated").asInt());
        assertEquals(1, round.get("candidateSetSizes").get("0").asLong());
        assertTrue(round.get("rmsResidualArcsec").isNull());
    }

    @Test
    @DisplayName("toReport should mirror the result")
    void testToReport() {
        JsonReportExporter.RunReport report = new JsonReportExporter().toReport(result());

        assertEquals(0, report.matches());
        assertEquals(1, report.rounds().size());
        assertEquals(12, report.rounds().get(0).durationMillis());
        assertNull(report.fluxModelDegree());
    }

    @Test
    @DisplayName("Writer failures should surface as UncheckedIOException")
    void testWriterFailure() {
        Writer failing = new Writer() {
            @Override
            public void write(char[] cbuf, int off, int len) throws IOException {
                throw new IOException("closed");
            }

            @Override
            public void flush() throws IOException {
                throw new IOException("closed");
            }

            @Override
            public void close() {
            }
        };

        assertThrows(UncheckedIOException.class, () -> new JsonReportExporter().export(result(), failing));
    }
}
