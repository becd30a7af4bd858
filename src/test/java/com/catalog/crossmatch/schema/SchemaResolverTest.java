package com.catalog.crossmatch.schema;

import com.catalog.crossmatch.core.model.CanonicalField;
import com.catalog.crossmatch.core.model.Catalogue;
import com.catalog.crossmatch.core.model.CatalogueRole;
import com.catalog.crossmatch.core.model.SourceRecord;
import com.catalog.crossmatch.error.CatalogueValidationException;
import com.catalog.crossmatch.error.ErrorKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SchemaResolver Tests")
class SchemaResolverTest {

    private final SchemaResolver resolver = new SchemaResolver();

    private static RawTable table(List<String> columns, String[]... rows) {
        return new RawTable(columns, List.of(rows));
    }

    @Nested
    @DisplayName("Column mapping")
    class MappingTests {

        @Test
        @DisplayName("Should read mapped columns into canonical fields")
        void mappedColumns() {
            CatalogueSchema schema = CatalogueSchema.builder("gleam")
                    .column(CanonicalField.RA, "RAJ2000")
                    .column(CanonicalField.DEC, "DEJ2000")
                    .column(CanonicalField.PEAK_FLUX, "S_peak")
                    .column(CanonicalField.UUID, "Name")
                    .build();
            RawTable raw = table(List.of("Name", "RAJ2000", "DEJ2000", "S_peak", "err_ra"),
                    new String[]{"J001", "10.5", "-20.25", "1.5", "0.001"});

            Catalogue c = resolver.resolve(raw, schema, CatalogueRole.REFERENCE, null);

            SourceRecord s = c.get(0);
            assertEquals("J001", s.getUuid());
            assertEquals(10.5, s.getRa());
            assertEquals(-20.25, s.getDec());
            assertEquals(1.5, s.getPeakFlux());
            assertEquals(0.001, s.getErrRa());
            assertEquals(0.0, s.getLocalRms());
            assertEquals(CatalogueRole.REFERENCE, c.getRole());
        }

        @Test
        @DisplayName("Missing uuid column should give sequential identifiers")
        void generatedUuids() {
            RawTable raw = table(List.of("ra", "dec", "peak_flux"),
                    new String[]{"1", "2", "3"}, new String[]{"4", "5", "6"});

            Catalogue c = resolver.resolve(raw, DefaultSchemas.canonical("tgt"), CatalogueRole.TARGET, null);

            assertEquals("tgt-1", c.get(0).getUuid());
            assertEquals("tgt-2", c.get(1).getUuid());
        }

        @Test
        @DisplayName("Blank optional cells should read as zero")
        void blankOptionalCell() {
            RawTable raw = table(List.of("ra", "dec", "peak_flux", "local_rms"),
                    new String[]{"1", "2", "3", " "});

            assertEquals(0.0, resolver.resolve(raw, DefaultSchemas.canonical("t"), CatalogueRole.TARGET, null)
                    .get(0).getLocalRms());
        }
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("A missing required column should name the catalogue and column")
        void missingRequiredColumn() {
            RawTable raw = table(List.of("ra", "dec"), new String[]{"1", "2"});

            CatalogueValidationException e = assertThrows(CatalogueValidationException.class,
                    () -> resolver.resolve(raw, DefaultSchemas.canonical("cat"), CatalogueRole.TARGET, null));
            assertEquals("cat", e.getCatalogue());
            assertEquals("peak_flux", e.getColumn());
            assertEquals(ErrorKind.DATA_VALIDATION, e.getKind());
        }

        @Test
        @DisplayName("Non-numeric and blank required cells should be rejected")
        void badCells() {
            CatalogueSchema schema = DefaultSchemas.canonical("cat");

            assertThrows(CatalogueValidationException.class, () -> resolver.resolve(
                    table(List.of("ra", "dec", "peak_flux"), new String[]{"x", "2", "3"}),
                    schema, CatalogueRole.TARGET, null));
            assertThrows(CatalogueValidationException.class, () -> resolver.resolve(
                    table(List.of("ra", "dec", "peak_flux"), new String[]{"1", "", "3"}),
                    schema, CatalogueRole.TARGET, null));
        }

        @Test
        @DisplayName("Out-of-range declination should be reported with the row")
        void invalidRow() {
            CatalogueValidationException e = assertThrows(CatalogueValidationException.class,
                    () -> resolver.resolve(table(List.of("ra", "dec", "peak_flux"), new String[]{"1", "95", "3"}),
                            DefaultSchemas.canonical("cat"), CatalogueRole.TARGET, null));
            assertTrue(e.getMessage().contains("row 1"));
        }
    }

    @Nested
    @DisplayName("Frequency-tagged columns")
    class FrequencyTests {

        private final CatalogueSchema schema = CatalogueSchema.builder("multi")
                .frequencyAffix(FrequencyAffix.SUFFIX)
                .frequency("100")
                .frequency("200")
                .build();

        private final RawTable raw = table(
                List.of("ra", "dec", "peak_flux_100", "peak_flux200", "err_peak_flux_100", "err_peak_flux_200"),
                new String[]{"1", "2", "1.0", "3.0", "0.3", "0.4"});

        @Test
        @DisplayName("Values should be interpolated and errors propagated in quadrature")
        void interpolates() {
            Catalogue c = resolver.resolve(raw, schema, CatalogueRole.REFERENCE, 150.0);

            SourceRecord s = c.get(0);
            assertEquals(2.0, s.getPeakFlux(), 1e-12);
            assertEquals(Math.hypot(0.15, 0.2), s.getErrPeakFlux(), 1e-12);
            assertEquals(150.0, c.getFrequencyMHz().getAsDouble());
        }

        @Test
        @DisplayName("An exact frequency match should take that column alone")
        void exactFrequency() {
            assertEquals(3.0, resolver.resolve(raw, schema, CatalogueRole.REFERENCE, 200.0).get(0).getPeakFlux(), 1e-12);
        }

        @Test
        @DisplayName("Without a target frequency a multi-frequency catalogue cannot be resolved")
        void requiresTargetFrequency() {
            assertThrows(CatalogueValidationException.class,
                    () -> resolver.resolve(raw, schema, CatalogueRole.REFERENCE, null));
        }

        @Test
        @DisplayName("Extrapolation should be refused when disabled")
        void extrapolationDisabled() {
            assertThrows(CatalogueValidationException.class,
                    () -> new SchemaResolver(false).resolve(raw, schema, CatalogueRole.REFERENCE, 300.0));
            assertEquals(5.0, resolver.resolve(raw, schema, CatalogueRole.REFERENCE, 300.0).get(0).getPeakFlux(), 1e-12);
        }

        @Test
        @DisplayName("A single-frequency prefix catalogue should use its tag as frequency")
        void singlePrefixFrequency() {
            CatalogueSchema single = CatalogueSchema.builder("single")
                    .frequencyAffix(FrequencyAffix.PREFIX)
                    .frequency("181")
                    .build();
            RawTable prefixed = table(List.of("ra", "dec", "181_peak_flux"), new String[]{"1", "2", "0.7"});

            Catalogue c = resolver.resolve(prefixed, single, CatalogueRole.REFERENCE, null);

            assertEquals(0.7, c.get(0).getPeakFlux(), 1e-12);
            assertEquals(181.0, c.getFrequencyMHz().getAsDouble());
        }
    }
}
