package com.catalog.crossmatch.search;

import com.catalog.crossmatch.core.model.SkyPosition;
import com.catalog.crossmatch.likelihood.SkyGeometry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SkyCellIndex Tests")
class SkyCellIndexTest {

    private static List<Integer> bruteForce(List<SkyPosition> positions, SkyPosition center, double radius) {
        List<Integer> hits = new ArrayList<>();
        for (int i = 0; i < positions.size(); i++) {
            if (SkyGeometry.separation(center, positions.get(i)) <= radius) {
                hits.add(i);
            }
        }
        return hits;
    }

    private static List<Integer> indices(List<SkyCellIndex.Neighbour> neighbours) {
        return neighbours.stream().map(SkyCellIndex.Neighbour::index).sorted().toList();
    }

    @ParameterizedTest(name = "radius={0}")
    @ValueSource(doubles = {0.05, 0.5, 3.0})
    @DisplayName("Radius queries should return exactly what a full scan returns")
    void matchesBruteForce(double radius) {
        Random random = new Random(42);
        List<SkyPosition> positions = new ArrayList<>();
        for (int i = 0; i < 2000; i++) {
            positions.add(new SkyPosition(random.nextDouble() * 360.0, random.nextDouble() * 180.0 - 90.0));
        }
        SkyCellIndex index = SkyCellIndex.build(positions, radius);

        for (int q = 0; q < 200; q++) {
            SkyPosition center = new SkyPosition(random.nextDouble() * 360.0, random.nextDouble() * 180.0 - 90.0);
            assertEquals(bruteForce(positions, center, radius), indices(index.within(center, radius)));
        }
    }

    @Test
    @DisplayName("Queries should find neighbours across RA 0/360")
    void wrapAround() {
        List<SkyPosition> positions = List.of(new SkyPosition(359.99, 0.0), new SkyPosition(0.01, 0.0));
        SkyCellIndex index = SkyCellIndex.build(positions, 0.1);

        assertEquals(List.of(0, 1), indices(index.within(new SkyPosition(0.0, 0.0), 0.05)));
        assertEquals(List.of(0, 1), indices(index.within(new SkyPosition(359.995, 0.0), 0.05)));
    }

    @Test
    @DisplayName("Queries should find neighbours on the far side of the pole")
    void nearPole() {
        List<SkyPosition> positions = List.of(new SkyPosition(0.0, 89.9), new SkyPosition(180.0, 89.9),
                new SkyPosition(90.0, 80.0));
        SkyCellIndex index = SkyCellIndex.build(positions, 0.5);

        assertEquals(List.of(0, 1), indices(index.within(new SkyPosition(0.0, 89.95), 0.5)));
    }

    @Test
    @DisplayName("Results should be ordered by separation and nearest should return the first")
    void orderingAndNearest() {
        List<SkyPosition> positions = List.of(new SkyPosition(10.0, 0.03), new SkyPosition(10.0, 0.01),
                new SkyPosition(10.0, 0.02));
        SkyCellIndex index = SkyCellIndex.build(positions, 0.1);

        List<SkyCellIndex.Neighbour> found = index.within(new SkyPosition(10.0, 0.0), 0.1);
        assertEquals(List.of(1, 2, 0), found.stream().map(SkyCellIndex.Neighbour::index).toList());
        assertEquals(1, index.nearest(new SkyPosition(10.0, 0.0), 0.1).orElseThrow().index());
        assertTrue(index.nearest(new SkyPosition(50.0, 0.0), 0.1).isEmpty());
    }

    @Test
    @DisplayName("Empty index and invalid cell size")
    void edgeCases() {
        assertTrue(SkyCellIndex.build(List.of(), 1.0).within(new SkyPosition(0, 0), 1.0).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> SkyCellIndex.build(List.of(), 0.0));
    }
}
