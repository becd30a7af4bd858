package com.catalog.crossmatch.decision;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DecisionLedger Tests")
class DecisionLedgerTest {

    private DecisionLedger ledger;

    private static MatchDecisionRecord record(int round, String target, DecisionOutcome outcome) {
        return MatchDecisionRecord.builder()
                .round(round)
                .targetUuid(target)
                .referenceUuid(outcome == DecisionOutcome.NO_CANDIDATES ? null : "ref-" + target)
                .outcome(outcome)
                .build();
    }

    @BeforeEach
    void setUp() {
        ledger = new DecisionLedger();
        ledger.record(record(1, "a", DecisionOutcome.ACCEPTED));
        ledger.record(record(1, "b", DecisionOutcome.BELOW_THRESHOLD));
        ledger.recordAll(List.of(
                record(2, "b", DecisionOutcome.CONFLICT_DEFERRED),
                record(3, "b", DecisionOutcome.ACCEPTED)));
    }

    @Test
    @DisplayName("Should filter by round, target and outcome")
    void queries() {
        assertEquals(4, ledger.size());
        assertEquals(2, ledger.getForRound(1).size());
        assertEquals(3, ledger.getForTarget("b").size());
        assertEquals(2, ledger.getByOutcome(DecisionOutcome.ACCEPTED).size());
    }

    @Test
    @DisplayName("Outcome counts should include zero entries")
    void countByOutcome() {
        Map<DecisionOutcome, Long> counts = ledger.countByOutcome();

        assertEquals(2L, counts.get(DecisionOutcome.ACCEPTED));
        assertEquals(1L, counts.get(DecisionOutcome.CONFLICT_DEFERRED));
        assertEquals(0L, counts.get(DecisionOutcome.NO_CANDIDATES));
        assertEquals(DecisionOutcome.values().length, counts.size());
    }

    @Test
    @DisplayName("getAll should be an immutable snapshot in insertion order")
    void immutableSnapshot() {
        List<MatchDecisionRecord> all = ledger.getAll();

        assertEquals("a", all.get(0).getTargetUuid());
        assertThrows(UnsupportedOperationException.class, () -> all.add(record(9, "z", DecisionOutcome.ACCEPTED)));
        ledger.record(record(4, "c", DecisionOutcome.NO_CANDIDATES));
        assertEquals(4, all.size());
    }

    @Test
    @DisplayName("Records should get an id, a timestamp and NaN separation by default")
    void recordDefaults() {
        MatchDecisionRecord r = record(1, "x", DecisionOutcome.NO_CANDIDATES);

        assertNotNull(r.getId());
        assertNotNull(r.getEvaluatedAt());
        assertTrue(Double.isNaN(r.getSeparationArcsec()));
        assertThrows(NullPointerException.class, () -> MatchDecisionRecord.builder().round(1).build());
    }
}
