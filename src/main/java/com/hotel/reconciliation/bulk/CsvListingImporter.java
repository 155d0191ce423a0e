package com.hotel.reconciliation.bulk;

import com.hotel.reconciliation.core.model.RawListing;
import com.hotel.reconciliation.core.model.Source;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * CSV listing importer.
 *
 * <p>Expected CSV format (header names are matched case-insensitively, unknown columns ignored):</p>
 * <pre>
 * HOTEL_NAME,PRICE,RATING,REVIEW_AMOUNT,DISTANCE,URL,latitude,longitude
 * "Grand Plaza Hotel &amp; Spa","€ 120",8.4,"2,345 reviews","850 m from centre",https://...,38.7169,-9.1399
 * </pre>
 *
 * <p>A name column is required. Fields may be quoted; a doubled quote inside a quoted
 * field is a literal quote. Records do not span lines.</p>
 */
public class CsvListingImporter implements ListingImporter {
    private static final Logger log = LoggerFactory.getLogger(CsvListingImporter.class);
    private static final int PROGRESS_INTERVAL = 100;

    @Override
    public ImportResult importListings(InputStream input, Source source, ProgressCallback callback) {
        return importListings(new InputStreamReader(input, StandardCharsets.UTF_8), source, callback);
    }

    @Override
    public ImportResult importListings(Reader reader, Source source, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        List<RawListing> listings = new ArrayList<>();
        List<ImportResult.ImportError> errors = new ArrayList<>();
        long totalRecords = 0;

        try (BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader)) {
            String headerLine = br.readLine();
            if (headerLine == null) {
                return new ImportResult(source, List.of(), 0, List.of());
            }
            List<ListingFields> columns = parseHeader(stripBom(headerLine));
            if (!columns.contains(ListingFields.NAME)) {
                errors.add(new ImportResult.ImportError(1, headerLine, "Header has no name column"));
                log.warn("import.failed source={} reason=no-name-column header='{}'", source, headerLine);
                return new ImportResult(source, List.of(), 0, errors);
            }

            String line;
            long lineNumber = 1;
            while ((line = br.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                totalRecords++;
                try {
                    List<String> fields = parseLine(line);
                    if (fields.size() != columns.size()) {
                        throw new IllegalArgumentException("Expected " + columns.size() + " fields, found "
                                + fields.size());
                    }
                    Map<ListingFields, String> values = new EnumMap<>(ListingFields.class);
                    for (int i = 0; i < columns.size(); i++) {
                        if (columns.get(i) != null) {
                            values.put(columns.get(i), fields.get(i));
                        }
                    }
                    listings.add(ListingFields.toListing(source, listings.size(), values));
                } catch (IllegalArgumentException e) {
                    errors.add(new ImportResult.ImportError(lineNumber, line, e.getMessage()));
                    log.warn("import.error source={} line={} error={}", source, lineNumber, e.getMessage());
                }

                if (totalRecords % PROGRESS_INTERVAL == 0) {
                    cb.onProgress(totalRecords, -1, "Read " + totalRecords + " records");
                }
            }
        } catch (IOException e) {
            log.error("import.failed source={} error={}", source, e.getMessage());
            errors.add(new ImportResult.ImportError(0, "", "IO error: " + e.getMessage()));
        }

        ImportResult result = new ImportResult(source, listings, totalRecords, errors);
        cb.onProgress(totalRecords, totalRecords, "Import completed");
        log.info("import.completed result={}", result);
        return result;
    }

    @Override
    public String getFormat() {
        return "csv";
    }

    private static List<ListingFields> parseHeader(String headerLine) {
        List<ListingFields> columns = new ArrayList<>();
        for (String name : parseLine(headerLine)) {
            ListingFields field = ListingFields.forName(name);
            // First occurrence wins
            columns.add(field != null && columns.contains(field) ? null : field);
        }
        return columns;
    }

    /**
     * Splits one CSV line into fields, handling quoted values.
     *
     * @throws IllegalArgumentException on an unterminated quote
     */
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
        if (quoted) {
            throw new IllegalArgumentException("Unterminated quoted field");
        }
        fields.add(current.toString());
        return fields;
    }

    private static String stripBom(String line) {
        return !line.isEmpty() && line.charAt(0) == '\uFEFF' ? line.substring(1) : line;
    }
}
