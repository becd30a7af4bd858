package com.catalog.crossmatch.normalize;

import com.catalog.crossmatch.core.model.Catalogue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static com.catalog.crossmatch.SourceFixtures.reference;
import static com.catalog.crossmatch.SourceFixtures.source;
import static com.catalog.crossmatch.SourceFixtures.target;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RaWrapNormalizer Tests")
class RaWrapNormalizerTest {

    @Test
    @DisplayName("A field straddling RA 0 should be shifted to be contiguous")
    void wrapsStraddlingField() {
        Catalogue t = target(List.of(source("t0", 359.5, 0), source("t1", 0.5, 0)));
        Catalogue r = reference(List.of(source("r0", 200.0, 0), source("r1", 1.0, 0)));

        RaWrapNormalizer.Result result = RaWrapNormalizer.normalize(t, r);

        assertTrue(result.wrapped());
        assertEquals(-0.5, result.target().get(0).getRa(), 1e-12);
        assertEquals(0.5, result.target().get(1).getRa());
        assertEquals(-160.0, result.reference().get(0).getRa(), 1e-12);
    }

    @Test
    @DisplayName("The low and high edges may come from different catalogues")
    void edgesAcrossCatalogues() {
        Catalogue t = target(List.of(source("t0", 355.0, 0)));
        Catalogue r = reference(List.of(source("r0", 5.0, 0)));

        assertTrue(RaWrapNormalizer.normalize(t, r).wrapped());
    }

    @Test
    @DisplayName("Normalizing twice should change nothing the second time")
    void idempotent() {
        Catalogue t = target(List.of(source("t0", 359.5, 0), source("t1", 0.5, 0)));
        Catalogue r = reference(List.of(source("r0", 359.9, 0)));
        RaWrapNormalizer.Result once = RaWrapNormalizer.normalize(t, r);

        RaWrapNormalizer.Result twice = RaWrapNormalizer.normalize(once.target(), once.reference());

        assertFalse(twice.wrapped());
        assertSame(once.target(), twice.target());
    }

    @Test
    @DisplayName("A field away from RA 0 should be untouched")
    void untouched() {
        Catalogue t = target(List.of(source("t0", 120.0, 0)));
        Catalogue r = reference(List.of(source("r0", 121.0, 0)));

        RaWrapNormalizer.Result result = RaWrapNormalizer.normalize(t, r);

        assertFalse(result.wrapped());
        assertSame(t, result.target());
        assertSame(r, result.reference());
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({"-0.5, 359.5", "0, 0", "360, 0", "725, 5", "180, 180"})
    @DisplayName("toStandardRange should map into [0, 360)")
    void standardRange(double ra, double expected) {
        assertEquals(expected, RaWrapNormalizer.toStandardRange(ra), 1e-12);
    }
}
