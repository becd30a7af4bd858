package com.catalog.crossmatch.bulk;

import com.catalog.crossmatch.api.CrossMatchResult;
import com.catalog.crossmatch.core.model.AcceptedMatch;
import com.catalog.crossmatch.core.model.CanonicalField;
import com.catalog.crossmatch.core.model.SourceRecord;
import com.catalog.crossmatch.correction.FluxCalibrationModel;
import com.catalog.crossmatch.correction.OffsetDiagnostics;
import com.catalog.crossmatch.normalize.RaWrapNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/**
 * CSV result writer.
 *
 * <p>Source tables use the canonical column names. The match table prefixes target columns
 * with {@code tar_} and reference columns with {@code ref_}, followed by the corrected target
 * position and the match figures. Right ascensions are written in [0, 360).</p>
 */
public class CsvResultExporter implements ResultExporter {
    private static final Logger log = LoggerFactory.getLogger(CsvResultExporter.class);

    private static final int FLUX_GRID_STEPS = 50;
    private static final CanonicalField[] FIELDS = CanonicalField.values();

    @Override
    public ExportResult export(CrossMatchResult result, ResultTable table, Writer writer, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        PrintWriter pw = new PrintWriter(new BufferedWriter(writer));
        long rows = switch (table) {
            case MATCHES -> writeMatches(pw, result.getMatches());
            case LEFTOVER_REFERENCE -> writeSources(pw, result.getLeftoverReferences());
            case LEFTOVER_TARGET_CORRECTED -> writeSources(pw, result.getLeftoverTargetsCorrected());
            case LEFTOVER_TARGET_ORIGINAL -> writeSources(pw, result.getLeftoverTargetsOriginal());
            case OFFSET_DIAGNOSTICS -> writeDiagnostics(pw, result.getOffsetDiagnostics());
            case FLUX_GRID -> writeFluxGrid(pw, result.getFluxCalibration().orElse(null));
        };
        pw.flush();
        if (pw.checkError()) {
            throw new UncheckedIOException(new IOException("failed writing " + table));
        }
        ExportResult exported = new ExportResult(table, rows);
        cb.onProgress(rows, rows, "Exported " + table);
        log.info("export.completed result={}", exported);
        return exported;
    }

    @Override
    public List<ExportResult> exportAll(CrossMatchResult result, Path directory, ProgressCallback callback) {
        List<ExportResult> results = new ArrayList<>();
        try {
            Files.createDirectories(directory);
            for (ResultTable table : ResultTable.values()) {
                try (Writer w = Files.newBufferedWriter(directory.resolve(table.fileName()), StandardCharsets.UTF_8)) {
                    results.add(export(result, table, w, callback));
                }
            }
        } catch (IOException e) {
            log.error("export.failed directory={} error={}", directory, e.getMessage());
            throw new UncheckedIOException("cannot write results to " + directory, e);
        }
        return results;
    }

    @Override
    public String getFormat() {
        return "csv";
    }

    private long writeMatches(PrintWriter pw, List<AcceptedMatch> matches) {
        StringJoiner header = new StringJoiner(",");
        for (CanonicalField f : FIELDS) {
            header.add("tar_" + f.columnName());
        }
        for (CanonicalField f : FIELDS) {
            header.add("ref_" + f.columnName());
        }
        header.add("tar_ra_corrected").add("tar_dec_corrected").add("separation_arcsec")
                .add("raw_likelihood").add("normalized_likelihood").add("candidates")
                .add("round").add("decision");
        pw.println(header);

        for (AcceptedMatch m : matches) {
            StringJoiner row = new StringJoiner(",");
            appendSource(row, m.getTarget());
            appendSource(row, m.getReference());
            row.add(number(RaWrapNormalizer.toStandardRange(m.getCorrectedTargetPosition().ra())))
                    .add(number(m.getCorrectedTargetPosition().dec()))
                    .add(number(m.getSeparationArcsec()))
                    .add(number(m.getRawLikelihood()))
                    .add(m.getNormalizedLikelihood() != null ? number(m.getNormalizedLikelihood()) : "")
                    .add(Integer.toString(m.getCandidateCount()))
                    .add(Integer.toString(m.getRound()))
                    .add(m.getDecision().name());
            pw.println(row);
        }
        return matches.size();
    }

    private long writeSources(PrintWriter pw, List<SourceRecord> sources) {
        StringJoiner header = new StringJoiner(",");
        for (CanonicalField f : FIELDS) {
            header.add(f.columnName());
        }
        pw.println(header);
        for (SourceRecord s : sources) {
            StringJoiner row = new StringJoiner(",");
            appendSource(row, s);
            pw.println(row);
        }
        return sources.size();
    }

    private long writeDiagnostics(PrintWriter pw, List<OffsetDiagnostics> diagnostics) {
        pw.println("round,tar_uuid,ra,dec,measured_dra,measured_ddec,modelled_dra,modelled_ddec");
        long rows = 0;
        for (OffsetDiagnostics d : diagnostics) {
            for (OffsetDiagnostics.Sample s : d.samples()) {
                pw.println(d.round() + "," + csvEscape(s.targetUuid()) + ","
                        + number(RaWrapNormalizer.toStandardRange(s.ra())) + "," + number(s.dec()) + ","
                        + number(s.measuredRa()) + "," + number(s.measuredDec()) + ","
                        + number(s.modelledRa()) + "," + number(s.modelledDec()));
                rows++;
            }
        }
        return rows;
    }

    private long writeFluxGrid(PrintWriter pw, FluxCalibrationModel model) {
        pw.println("ra,dec,factor");
        if (model == null) {
            return 0;
        }
        List<FluxCalibrationModel.GridSample> samples = model.sampleGrid(FLUX_GRID_STEPS);
        for (FluxCalibrationModel.GridSample g : samples) {
            pw.println(number(RaWrapNormalizer.toStandardRange(g.ra())) + "," + number(g.dec()) + ","
                    + number(g.factor()));
        }
        return samples.size();
    }

    private static void appendSource(StringJoiner row, SourceRecord s) {
        for (CanonicalField f : FIELDS) {
            if (f == CanonicalField.UUID) {
                row.add(csvEscape(s.getUuid()));
            } else if (f == CanonicalField.RA) {
                row.add(number(RaWrapNormalizer.toStandardRange(s.getRa())));
            } else {
                row.add(number(s.get(f)));
            }
        }
    }

    private static String number(double value) {
        return Double.toString(value);
    }

    private static String csvEscape(String value) {
        if (value == null) return "";
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
