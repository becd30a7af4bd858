package com.catalog.crossmatch.matching;

import com.catalog.crossmatch.core.model.AcceptedMatch;
import com.catalog.crossmatch.core.model.MatchCandidate;
import com.catalog.crossmatch.core.model.MatchDecision;
import com.catalog.crossmatch.decision.AcceptanceRule;
import com.catalog.crossmatch.decision.CandidateSet;
import com.catalog.crossmatch.decision.DecisionOutcome;
import com.catalog.crossmatch.decision.MatchDecisionRecord;
import com.catalog.crossmatch.likelihood.LikelihoodModel;
import com.catalog.crossmatch.search.CandidateSearch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.function.IntPredicate;

/**
 * Runs one round of candidate search, scoring and acceptance.
 *
 * <p>Scoring of independent target sources may be spread over an executor. Aggregation is
 * always sequential: proposals are ordered by raw likelihood (then normalized likelihood,
 * then target index) and each reference source goes to the first proposal that claims it.
 * A target whose accepted candidate was already claimed is deferred to the next round.
 * The outcome is therefore independent of the degree of parallelism.</p>
 */
public class MatchingRound {
    private static final Logger log = LoggerFactory.getLogger(MatchingRound.class);

    private static final Comparator<Evaluation> PROPOSAL_ORDER =
            Comparator.comparingDouble((Evaluation e) -> e.decision().candidate().rawLikelihood()).reversed()
                    .thenComparing(Comparator.comparingDouble(
                            (Evaluation e) -> e.decision().candidate().normalizedLikelihood()).reversed())
                    .thenComparingInt(Evaluation::targetIndex);

    private final LikelihoodModel likelihoodModel;
    private final double radiusDeg;
    private final ExecutorService executor;
    private final int parallelism;

    /**
     * Sequential round.
     */
    public MatchingRound(LikelihoodModel likelihoodModel, double radiusDeg) {
        this(likelihoodModel, radiusDeg, null, 1);
    }

    /**
     * @param executor    executor for scoring, or null to score on the calling thread
     * @param parallelism number of chunks the target pool is split into when an executor is given
     */
    public MatchingRound(LikelihoodModel likelihoodModel, double radiusDeg,
                         ExecutorService executor, int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1");
        }
        this.likelihoodModel = likelihoodModel;
        this.radiusDeg = radiusDeg;
        this.executor = executor;
        this.parallelism = parallelism;
    }

    /**
     * Scores every eligible target source against the unmatched reference sources.
     *
     * @param round      round number recorded in matches and decisions
     * @param targets    unmatched target sources, searched from their working positions
     * @param references unmatched reference sources
     * @param eligible   which target indices take part this round
     * @param rule       acceptance thresholds for this round
     */
    public RoundOutcome execute(int round, SourcePool targets, SourcePool references,
                                IntPredicate eligible, AcceptanceRule rule) {
        CandidateSearch search = new CandidateSearch(references.workingSources(), likelihoodModel, radiusDeg);

        List<Integer> indices = new ArrayList<>();
        for (int i = 0; i < targets.size(); i++) {
            if (eligible.test(i)) {
                indices.add(i);
            }
        }
        List<Evaluation> evaluations = score(indices, targets, search, rule);

        // Serialized aggregation
        List<Evaluation> proposals = evaluations.stream()
                .filter(e -> e.decision().isAccepted())
                .sorted(PROPOSAL_ORDER)
                .toList();
        Set<Integer> claimedReferences = new HashSet<>();
        Set<Integer> acceptedTargets = new HashSet<>();
        for (Evaluation proposal : proposals) {
            int referenceIndex = proposal.decision().candidate().referenceIndex();
            if (claimedReferences.add(referenceIndex)) {
                acceptedTargets.add(proposal.targetIndex());
            }
        }

        List<AcceptedMatch> accepted = new ArrayList<>();
        List<MatchDecisionRecord> records = new ArrayList<>(evaluations.size());
        Map<Integer, Long> sizes = new TreeMap<>();
        int conflicts = 0;
        for (Evaluation e : evaluations) {
            sizes.merge(e.candidates().size(), 1L, Long::sum);
            DecisionOutcome outcome = e.decision().outcome();
            if (outcome == DecisionOutcome.ACCEPTED) {
                if (acceptedTargets.contains(e.targetIndex())) {
                    accepted.add(toMatch(round, e, targets, search));
                } else {
                    outcome = DecisionOutcome.CONFLICT_DEFERRED;
                    conflicts++;
                }
            }
            records.add(toRecord(round, e, outcome, targets, search, rule));
        }

        log.debug("crossmatch.round.scored round={} evaluated={} accepted={} conflicts={} references={}",
                round, evaluations.size(), accepted.size(), conflicts, references.size());
        return new RoundOutcome(round, accepted, acceptedTargets, claimedReferences, records,
                evaluations.size(), sizes);
    }

    private List<Evaluation> score(List<Integer> indices, SourcePool targets,
                                   CandidateSearch search, AcceptanceRule rule) {
        if (executor == null || parallelism == 1 || indices.size() < 2) {
            return scoreChunk(indices, targets, search, rule);
        }
        int chunkSize = (indices.size() + parallelism - 1) / parallelism;
        List<CompletableFuture<List<Evaluation>>> futures = new ArrayList<>();
        for (int from = 0; from < indices.size(); from += chunkSize) {
            List<Integer> chunk = indices.subList(from, Math.min(indices.size(), from + chunkSize));
            futures.add(CompletableFuture.supplyAsync(() -> scoreChunk(chunk, targets, search, rule), executor));
        }
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw e;
        }
        List<Evaluation> all = new ArrayList<>(indices.size());
        for (CompletableFuture<List<Evaluation>> future : futures) {
            all.addAll(future.join());
        }
        return all;
    }

    private static List<Evaluation> scoreChunk(List<Integer> indices, SourcePool targets,
                                               CandidateSearch search, AcceptanceRule rule) {
        List<Evaluation> evaluations = new ArrayList<>(indices.size());
        for (int i : indices) {
            CandidateSet candidates = search.candidatesFor(i, targets.source(i), targets.position(i));
            evaluations.add(new Evaluation(i, candidates, rule.decide(candidates)));
        }
        return evaluations;
    }

    private static AcceptedMatch toMatch(int round, Evaluation e, SourcePool targets, CandidateSearch search) {
        MatchCandidate c = e.decision().candidate();
        int count = e.decision().candidateCount();
        return AcceptedMatch.builder()
                .target(targets.source(e.targetIndex()))
                .reference(search.reference(c.referenceIndex()))
                .correctedTargetPosition(targets.position(e.targetIndex()))
                .rawLikelihood(c.rawLikelihood())
                .normalizedLikelihood(count > 1 ? c.normalizedLikelihood() : null)
                .candidateCount(count)
                .round(round)
                .separationArcsec(c.separationArcsec())
                .decision(e.decision().matchDecision() != null
                        ? e.decision().matchDecision() : MatchDecision.SINGLE_CANDIDATE)
                .build();
    }

    private static MatchDecisionRecord toRecord(int round, Evaluation e, DecisionOutcome outcome,
                                                SourcePool targets, CandidateSearch search, AcceptanceRule rule) {
        MatchDecisionRecord.Builder builder = MatchDecisionRecord.builder()
                .round(round)
                .targetUuid(targets.source(e.targetIndex()).getUuid())
                .candidateCount(e.candidates().size())
                .outcome(outcome)
                .singleThreshold(rule.getSingleThreshold())
                .multipleThreshold(rule.getMultipleThreshold())
                .forced(rule.isForced());
        MatchCandidate best = e.decision().candidate();
        if (best != null) {
            builder.referenceUuid(search.reference(best.referenceIndex()).getUuid())
                    .rawLikelihood(best.rawLikelihood())
                    .normalizedLikelihood(best.normalizedLikelihood())
                    .separationArcsec(best.separationArcsec());
        }
        return builder.build();
    }

    private record Evaluation(int targetIndex, CandidateSet candidates, AcceptanceRule.Decision decision) {}
}
