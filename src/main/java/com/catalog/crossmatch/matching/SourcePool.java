package com.catalog.crossmatch.matching;

import com.catalog.crossmatch.core.model.SkyPosition;
import com.catalog.crossmatch.core.model.SourceRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable snapshot of the unmatched sources of one catalogue.
 *
 * <p>Each source keeps its original record alongside a working position (the corrected
 * position for target sources, the original one for reference sources). Every change
 * produces a new snapshot with a higher version; a snapshot is never modified.</p>
 */
public final class SourcePool {

    private final long version;
    private final List<SourceRecord> sources;
    private final List<SkyPosition> positions;

    private SourcePool(long version, List<SourceRecord> sources, List<SkyPosition> positions) {
        if (sources.size() != positions.size()) {
            throw new IllegalArgumentException("sources and positions differ in size: "
                    + sources.size() + " vs " + positions.size());
        }
        this.version = version;
        this.sources = List.copyOf(sources);
        this.positions = List.copyOf(positions);
    }

    /**
     * Initial snapshot where every working position is the record's own position.
     */
    public static SourcePool of(List<SourceRecord> sources) {
        Objects.requireNonNull(sources, "sources is required");
        return new SourcePool(0L, sources, sources.stream().map(SourceRecord::position).toList());
    }

    public long getVersion() {
        return version;
    }

    public int size() {
        return sources.size();
    }

    public boolean isEmpty() {
        return sources.isEmpty();
    }

    public SourceRecord source(int index) {
        return sources.get(index);
    }

    public SkyPosition position(int index) {
        return positions.get(index);
    }

    /**
     * Original records.
     */
    public List<SourceRecord> sources() {
        return sources;
    }

    /**
     * Records moved to their working positions.
     */
    public List<SourceRecord> workingSources() {
        List<SourceRecord> moved = new ArrayList<>(sources.size());
        for (int i = 0; i < sources.size(); i++) {
            SourceRecord s = sources.get(i);
            SkyPosition p = positions.get(i);
            moved.add(p.equals(s.position()) ? s : s.withPosition(p));
        }
        return moved;
    }

    /**
     * Returns a new snapshot with the given working positions, index for index.
     */
    public SourcePool withPositions(List<SkyPosition> newPositions) {
        return new SourcePool(version + 1, sources, newPositions);
    }

    /**
     * Returns a new snapshot without the sources at the given indices.
     */
    public SourcePool without(Set<Integer> indices) {
        if (indices.isEmpty()) {
            return this;
        }
        List<SourceRecord> keptSources = new ArrayList<>(sources.size() - indices.size());
        List<SkyPosition> keptPositions = new ArrayList<>(sources.size() - indices.size());
        for (int i = 0; i < sources.size(); i++) {
            if (!indices.contains(i)) {
                keptSources.add(sources.get(i));
                keptPositions.add(positions.get(i));
            }
        }
        return new SourcePool(version + 1, keptSources, keptPositions);
    }

    @Override
    public String toString() {
        return "SourcePool{version=" + version + ", size=" + sources.size() + '}';
    }
}
