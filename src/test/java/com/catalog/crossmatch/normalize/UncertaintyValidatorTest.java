package com.catalog.crossmatch.normalize;

import com.catalog.crossmatch.core.model.Catalogue;
import com.catalog.crossmatch.core.model.SourceRecord;
import com.catalog.crossmatch.error.CatalogueValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.catalog.crossmatch.SourceFixtures.reference;
import static com.catalog.crossmatch.SourceFixtures.source;
import static com.catalog.crossmatch.SourceFixtures.target;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("UncertaintyValidator Tests")
class UncertaintyValidatorTest {

    private static SourceRecord bare(String uuid) {
        return SourceRecord.builder().uuid(uuid).ra(1).dec(1).peakFlux(1).build();
    }

    @Test
    @DisplayName("No positional uncertainty anywhere should be fatal")
    void noPositionalUncertainty() {
        CatalogueValidationException e = assertThrows(CatalogueValidationException.class,
                () -> UncertaintyValidator.validate(target(List.of(bare("t"))), reference(List.of(bare("r"))), false));
        assertTrue(e.getColumn().contains("psf_a"));
    }

    @Test
    @DisplayName("Flux uncertainty should only be required with flux matching")
    void fluxUncertainty() {
        SourceRecord positional = SourceRecord.builder().uuid("t").ra(1).dec(1).peakFlux(1).psfA(30).build();
        Catalogue t = target(List.of(positional));
        Catalogue r = reference(List.of(bare("r")));

        assertDoesNotThrow(() -> UncertaintyValidator.validate(t, r, false));
        assertThrows(CatalogueValidationException.class, () -> UncertaintyValidator.validate(t, r, true));
    }

    @Test
    @DisplayName("Uncertainties present in only one catalogue should be accepted")
    void oneSided() {
        assertDoesNotThrow(() -> UncertaintyValidator.validate(
                target(List.of(source("t", 1, 1))), reference(List.of(bare("r"))), true));
    }
}
