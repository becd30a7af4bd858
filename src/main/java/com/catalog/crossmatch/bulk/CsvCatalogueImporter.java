package com.catalog.crossmatch.bulk;

import com.catalog.crossmatch.schema.RawTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * CSV catalogue reader.
 *
 * <p>The first non-comment line is the header. Lines starting with {@code #} and blank
 * lines are skipped. Fields may be quoted with {@code "}; a doubled quote inside a quoted
 * field stands for one quote. Lines whose field count differs from the header are
 * rejected and reported, the rest of the file is still read.</p>
 */
public class CsvCatalogueImporter implements CatalogueImporter {
    private static final Logger log = LoggerFactory.getLogger(CsvCatalogueImporter.class);
    private static final int PROGRESS_INTERVAL = 10_000;

    @Override
    public ImportResult importTable(InputStream input, ProgressCallback callback) {
        return importTable(new InputStreamReader(input, StandardCharsets.UTF_8), callback);
    }

    /**
     * @throws UncheckedIOException if the reader fails
     */
    @Override
    public ImportResult importTable(Reader reader, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        List<ImportResult.ImportError> errors = new ArrayList<>();
        List<String[]> rows = new ArrayList<>();
        List<String> header = null;
        long totalRecords = 0;

        try (BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader)) {
            String line;
            long lineNumber = 0;
            while ((line = br.readLine()) != null) {
                lineNumber++;
                if (line.isBlank() || line.startsWith("#")) {
                    continue;
                }
                List<String> fields = parseLine(line);
                if (header == null) {
                    header = fields.stream().map(String::trim).toList();
                    continue;
                }
                totalRecords++;
                if (fields.size() != header.size()) {
                    errors.add(new ImportResult.ImportError(lineNumber,
                            "expected " + header.size() + " fields, found " + fields.size()));
                    log.warn("import.error line={} fields={} expected={}", lineNumber, fields.size(), header.size());
                    continue;
                }
                rows.add(fields.toArray(new String[0]));
                if (totalRecords % PROGRESS_INTERVAL == 0) {
                    cb.onProgress(totalRecords, -1, "Read " + totalRecords + " records");
                }
            }
        } catch (IOException e) {
            log.error("import.failed error={}", e.getMessage());
            throw new UncheckedIOException("cannot read catalogue", e);
        }

        RawTable table = new RawTable(header != null ? header : List.of(), rows);
        ImportResult result = new ImportResult(table, totalRecords, errors);
        cb.onProgress(totalRecords, totalRecords, "Import completed");
        log.info("import.completed result={}", result);
        return result;
    }

    @Override
    public String getFormat() {
        return "csv";
    }

    static List<String> parseLine(String line) {
        List<String> fields = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quoted) {
                if (c == '"') {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                        current.append('"');
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    current.append(c);
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == ',') {
                fields.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        fields.add(current.toString());
        return fields;
    }
}
