package com.catalog.crossmatch.decision;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Append-only store of every match decision made during a run.
 */
public class DecisionLedger {
    private static final Logger log = LoggerFactory.getLogger(DecisionLedger.class);

    private final List<MatchDecisionRecord> records;

    public DecisionLedger() {
        this.records = new CopyOnWriteArrayList<>();
    }

    public MatchDecisionRecord record(MatchDecisionRecord record) {
        records.add(record);
        log.trace("decision.recorded round={} target={} outcome={}",
                record.getRound(), record.getTargetUuid(), record.getOutcome());
        return record;
    }

    public void recordAll(Collection<MatchDecisionRecord> batch) {
        records.addAll(batch);
        log.debug("decision.batchRecorded count={}", batch.size());
    }

    /**
     * All records in insertion order (immutable view).
     */
    public List<MatchDecisionRecord> getAll() {
        return Collections.unmodifiableList(new ArrayList<>(records));
    }

    public List<MatchDecisionRecord> getForRound(int round) {
        return records.stream()
                .filter(r -> r.getRound() == round)
                .collect(Collectors.toList());
    }

    public List<MatchDecisionRecord> getForTarget(String targetUuid) {
        return records.stream()
                .filter(r -> targetUuid.equals(r.getTargetUuid()))
                .collect(Collectors.toList());
    }

    public List<MatchDecisionRecord> getByOutcome(DecisionOutcome outcome) {
        return records.stream()
                .filter(r -> r.getOutcome() == outcome)
                .collect(Collectors.toList());
    }

    /**
     * Number of records per outcome, with zero entries for unseen outcomes.
     */
    public Map<DecisionOutcome, Long> countByOutcome() {
        Map<DecisionOutcome, Long> counts = new EnumMap<>(DecisionOutcome.class);
        for (DecisionOutcome outcome : DecisionOutcome.values()) {
            counts.put(outcome, 0L);
        }
        for (MatchDecisionRecord r : records) {
            counts.merge(r.getOutcome(), 1L, Long::sum);
        }
        return counts;
    }

    public int size() {
        return records.size();
    }
}
