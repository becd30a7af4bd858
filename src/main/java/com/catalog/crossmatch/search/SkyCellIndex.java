package com.catalog.crossmatch.search;

import com.catalog.crossmatch.core.model.SkyPosition;
import com.catalog.crossmatch.likelihood.SkyGeometry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Blocking index over sky positions.
 *
 * <p>Positions are bucketed into declination bands of height {@code cellSize} and, within a
 * band, right-ascension cells of width {@code cellSize}. A radius query visits only the
 * bands and cells that can hold a position within the radius, then confirms each
 * candidate with the exact great-circle separation, so it returns exactly what a full
 * scan would.</p>
 *
 * <p>Immutable after construction and safe for concurrent queries.</p>
 */
public final class SkyCellIndex {

    private static final double POLAR_CAP_DEG = 89.0;

    private final double cellSize;
    private final List<SkyPosition> positions;
    private final Map<Long, int[]> cells;

    private SkyCellIndex(double cellSize, List<SkyPosition> positions, Map<Long, int[]> cells) {
        this.cellSize = cellSize;
        this.positions = positions;
        this.cells = cells;
    }

    /**
     * Builds an index over the given positions. The cell size should be the search radius
     * the index is queried with most often.
     */
    public static SkyCellIndex build(List<SkyPosition> positions, double cellSizeDeg) {
        if (!(cellSizeDeg > 0.0)) {
            throw new IllegalArgumentException("cellSizeDeg must be positive");
        }
        Map<Long, List<Integer>> buckets = new HashMap<>();
        for (int i = 0; i < positions.size(); i++) {
            SkyPosition p = positions.get(i);
            buckets.computeIfAbsent(key(band(p.dec(), cellSizeDeg), raCell(p.ra(), cellSizeDeg)),
                    k -> new ArrayList<>()).add(i);
        }
        Map<Long, int[]> cells = new HashMap<>(buckets.size() * 2);
        buckets.forEach((k, v) -> cells.put(k, v.stream().mapToInt(Integer::intValue).toArray()));
        return new SkyCellIndex(cellSizeDeg, List.copyOf(positions), cells);
    }

    public int size() {
        return positions.size();
    }

    public SkyPosition position(int index) {
        return positions.get(index);
    }

    /**
     * Returns every indexed position within {@code radiusDeg} of {@code center},
     * ordered by increasing separation.
     */
    public List<Neighbour> within(SkyPosition center, double radiusDeg) {
        if (positions.isEmpty()) {
            return List.of();
        }
        List<Neighbour> result = new ArrayList<>();
        int minBand = band(Math.max(-90.0, center.dec() - radiusDeg), cellSize);
        int maxBand = band(Math.min(90.0, center.dec() + radiusDeg), cellSize);
        double maxAbsDec = Math.min(90.0, Math.abs(center.dec()) + radiusDeg);
        double raHalfWidth = maxAbsDec >= POLAR_CAP_DEG
                ? Double.POSITIVE_INFINITY
                : radiusDeg / Math.cos(Math.toRadians(maxAbsDec));

        if (raHalfWidth >= 90.0) {
            // RA cells converge near the pole; visit every cell of the affected bands.
            for (Map.Entry<Long, int[]> entry : cells.entrySet()) {
                int band = (int) (entry.getKey() >> 32);
                if (band >= minBand && band <= maxBand) {
                    collect(entry.getValue(), center, radiusDeg, result);
                }
            }
        } else {
            for (double shift : raShifts(center.ra(), raHalfWidth)) {
                int minCell = raCell(center.ra() + shift - raHalfWidth, cellSize);
                int maxCell = raCell(center.ra() + shift + raHalfWidth, cellSize);
                for (int band = minBand; band <= maxBand; band++) {
                    for (int cell = minCell; cell <= maxCell; cell++) {
                        int[] members = cells.get(key(band, cell));
                        if (members != null) {
                            collect(members, center, radiusDeg, result);
                        }
                    }
                }
            }
        }
        Collections.sort(result);
        return result;
    }

    /**
     * Returns the nearest indexed position within {@code radiusDeg}, if any.
     */
    public Optional<Neighbour> nearest(SkyPosition center, double radiusDeg) {
        List<Neighbour> neighbours = within(center, radiusDeg);
        return neighbours.isEmpty() ? Optional.empty() : Optional.of(neighbours.get(0));
    }

    private void collect(int[] members, SkyPosition center, double radiusDeg, List<Neighbour> out) {
        for (int index : members) {
            double separation = SkyGeometry.separation(center, positions.get(index));
            if (separation <= radiusDeg) {
                out.add(new Neighbour(index, separation));
            }
        }
    }

    /**
     * A query window that crosses RA 0 or 360 is also searched one full turn away,
     * so catalogues that were not wrap-normalized still find their neighbours.
     */
    private static double[] raShifts(double ra, double halfWidth) {
        if (ra - halfWidth < 0.0) {
            return new double[]{0.0, 360.0};
        }
        if (ra + halfWidth >= 360.0) {
            return new double[]{0.0, -360.0};
        }
        return new double[]{0.0};
    }

    private static int band(double dec, double cellSize) {
        return (int) Math.floor((dec + 90.0) / cellSize);
    }

    private static int raCell(double ra, double cellSize) {
        return (int) Math.floor(ra / cellSize);
    }

    private static long key(int band, int raCell) {
        return ((long) band << 32) | (raCell & 0xffffffffL);
    }

    /**
     * An index entry found by a query.
     *
     * @param index         position of the entry in the indexed list
     * @param separationDeg great-circle separation from the query center
     */
    public record Neighbour(int index, double separationDeg) implements Comparable<Neighbour> {
        @Override
        public int compareTo(Neighbour other) {
            int bySeparation = Double.compare(separationDeg, other.separationDeg);
            return bySeparation != 0 ? bySeparation : Integer.compare(index, other.index);
        }
    }
}
