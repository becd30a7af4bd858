package com.catalog.crossmatch.bulk;

import com.catalog.crossmatch.api.ConvergenceState;
import com.catalog.crossmatch.api.CrossMatchResult;
import com.catalog.crossmatch.core.model.AcceptedMatch;
import com.catalog.crossmatch.core.model.MatchDecision;
import com.catalog.crossmatch.core.model.SkyPosition;
import com.catalog.crossmatch.core.model.SourceRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static com.catalog.crossmatch.SourceFixtures.source;
import static org.junit.jupiter.api.Assertions.*;

class CsvResultExporterTest {

    private final CsvResultExporter exporter = new CsvResultExporter();

    static CrossMatchResult sampleResult() {
        SourceRecord target = source("t-1", -0.5, 10.0);
        SourceRecord reference = source("r-1", -0.5, 10.001);
        AcceptedMatch match = AcceptedMatch.builder()
                .target(target)
                .reference(reference)
                .correctedTargetPosition(new SkyPosition(-0.5, 10.0005))
                .rawLikelihood(0.98)
                .normalizedLikelihood(0.91)
                .candidateCount(2)
                .round(1)
                .separationArcsec(3.6)
                .decision(MatchDecision.MULTIPLE_CANDIDATES)
                .build();
        return CrossMatchResult.builder()
                .runId("run-1")
                .matches(List.of(match))
                .leftoverReferences(List.of(source("r-2, \"bright\"", 1.0, 10.0)))
                .leftoverTargetsOriginal(List.of(source("t-2", 359.0, 11.0)))
                .leftoverTargetsCorrected(List.of(source("t-2", -1.5, 11.0)))
                .finalState(ConvergenceState.CONVERGED)
                .raWrapped(true)
                .build();
    }

    @Test
    @DisplayName("Match table should carry prefixed columns and the match figures")
    void testMatchesTable() {
        StringWriter out = new StringWriter();

        ExportResult exported = exporter.export(sampleResult(), ResultTable.MATCHES, out, null);

        String[] lines = out.toString().split("\\R");
        assertEquals(1, exported.rows());
        assertEquals(2, lines.length);
        assertTrue(lines[0].startsWith("tar_ra,tar_dec,"));
        assertTrue(lines[0].contains(",ref_ra,ref_dec,"));
        assertTrue(lines[0].endsWith(
                "tar_ra_corrected,tar_dec_corrected,separation_arcsec,raw_likelihood,normalized_likelihood,"
                        + "candidates,round,decision"));
        assertTrue(lines[1].startsWith("359.5,10.0,"));
        assertTrue(lines[1].endsWith(",359.5,10.0005,3.6,0.98,0.91,2,1,MULTIPLE_CANDIDATES"));
    }

    @Test
    @DisplayName("Source tables should use canonical names and escape text cells")
    void testSourceTables() {
        StringWriter out = new StringWriter();

        exporter.export(sampleResult(), ResultTable.LEFTOVER_REFERENCE, out, null);

        String[] lines = out.toString().split("\\R");
        assertTrue(lines[0].startsWith("ra,dec,err_ra,err_dec,psf_a"));
        assertTrue(lines[0].endsWith(",uuid"));
        assertTrue(lines[1].endsWith(",\"r-2, \"\"bright\"\"\""));
    }

    @Test
    @DisplayName("Corrected leftovers should be mapped back into [0, 360)")
    void testCorrectedLeftovers() {
        StringWriter out = new StringWriter();

        exporter.export(sampleResult(), ResultTable.LEFTOVER_TARGET_CORRECTED, out, null);

        String row = out.toString().split("\\R")[1];
        assertTrue(row.startsWith("358.5,11.0,"));
    }

    @Test
    @DisplayName("Flux grid without a model should only have a header")
    void testEmptyFluxGrid() {
        StringWriter out = new StringWriter();

        ExportResult exported = exporter.export(sampleResult(), ResultTable.FLUX_GRID, out, null);

        assertEquals(0, exported.rows());
        assertEquals("ra,dec,factor", out.toString().trim());
    }

    @Test
    @DisplayName("exportAll should write one file per table")
    void testExportAll(@TempDir Path dir) throws IOException {
        Path output = dir.resolve("nested/out");

        List<ExportResult> results = exporter.exportAll(sampleResult(), output, null);

        assertEquals(ResultTable.values().length, results.size());
        for (ResultTable table : ResultTable.values()) {
            assertTrue(Files.exists(output.resolve(table.fileName())), table.fileName());
        }
        assertEquals(2, Files.readAllLines(output.resolve("matches.csv")).size());
        assertEquals("round,tar_uuid,ra,dec,measured_dra,measured_ddec,modelled_dra,modelled_ddec",
                Files.readAllLines(output.resolve("offset_diagnostics.csv")).get(0));
    }
}
