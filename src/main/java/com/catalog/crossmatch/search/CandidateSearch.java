package com.catalog.crossmatch.search;

import com.catalog.crossmatch.core.model.MatchCandidate;
import com.catalog.crossmatch.core.model.SkyPosition;
import com.catalog.crossmatch.core.model.SourceRecord;
import com.catalog.crossmatch.decision.CandidateSet;
import com.catalog.crossmatch.likelihood.LikelihoodModel;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Finds and scores the reference sources within the search radius of a target source.
 *
 * <p>Built once per round over that round's unmatched reference sources. Queries are
 * read-only and may run concurrently.</p>
 */
public final class CandidateSearch {

    private final List<SourceRecord> references;
    private final SkyCellIndex index;
    private final LikelihoodModel likelihoodModel;
    private final double radiusDeg;

    public CandidateSearch(List<SourceRecord> references, LikelihoodModel likelihoodModel, double radiusDeg) {
        this.references = List.copyOf(Objects.requireNonNull(references, "references is required"));
        this.likelihoodModel = Objects.requireNonNull(likelihoodModel, "likelihoodModel is required");
        if (!(radiusDeg > 0.0)) {
            throw new IllegalArgumentException("radiusDeg must be positive");
        }
        this.radiusDeg = radiusDeg;
        this.index = SkyCellIndex.build(this.references.stream().map(SourceRecord::position).toList(), radiusDeg);
    }

    /**
     * Scores every reference source within the radius of {@code position}.
     *
     * @param targetIndex index of the target in the round's pool, carried into the candidates
     * @param target      the target record (uncertainties and flux)
     * @param position    where the target is searched from, normally its corrected position
     */
    public CandidateSet candidatesFor(int targetIndex, SourceRecord target, SkyPosition position) {
        List<SkyCellIndex.Neighbour> neighbours = index.within(position, radiusDeg);
        if (neighbours.isEmpty()) {
            return CandidateSet.empty(targetIndex);
        }
        List<MatchCandidate> raw = new ArrayList<>(neighbours.size());
        for (SkyCellIndex.Neighbour n : neighbours) {
            SourceRecord reference = references.get(n.index());
            double likelihood = clamp(likelihoodModel.likelihood(target, position, reference));
            raw.add(new MatchCandidate(targetIndex, n.index(), n.separationDeg(),
                    reference.getPeakFlux() - target.getPeakFlux(), likelihood, 0.0));
        }
        return CandidateSet.normalize(targetIndex, raw);
    }

    public SourceRecord reference(int index) {
        return references.get(index);
    }

    public int referenceCount() {
        return references.size();
    }

    private static double clamp(double likelihood) {
        if (Double.isNaN(likelihood)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, likelihood));
    }
}
