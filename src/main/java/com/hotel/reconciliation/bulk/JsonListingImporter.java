package com.hotel.reconciliation.bulk;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
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
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * JSON listing importer.
 *
 * <p>Accepts either a JSON array of objects:</p>
 * <pre>
 * [
 *   {"name": "Grand Plaza Hotel", "price": "€ 115", "rating": 8.4, "reviews": 1500},
 *   {"name": "Casa Azul", "price": 89}
 * ]
 * </pre>
 *
 * <p>or JSON Lines, one object per line. Values may be JSON numbers or loosely formatted text.</p>
 */
public class JsonListingImporter implements ListingImporter {
    private static final Logger log = LoggerFactory.getLogger(JsonListingImporter.class);
    private static final int PROGRESS_INTERVAL = 100;

    private final ObjectMapper objectMapper;

    public JsonListingImporter() {
        this(new ObjectMapper());
    }

    public JsonListingImporter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public ImportResult importListings(InputStream input, Source source, ProgressCallback callback) {
        return importListings(new InputStreamReader(input, StandardCharsets.UTF_8), source, callback);
    }

    @Override
    public ImportResult importListings(Reader reader, Source source, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        Batch batch = new Batch(source, cb);

        try (BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader)) {
            int first = skipWhitespace(br);
            if (first == '[') {
                readArray(br, batch);
            } else if (first != -1) {
                readLines(br, batch);
            }
        } catch (IOException e) {
            log.error("import.failed source={} error={}", source, e.getMessage());
            batch.errors.add(new ImportResult.ImportError(0, "", "IO error: " + e.getMessage()));
        }

        ImportResult result = new ImportResult(source, batch.listings, batch.totalRecords, batch.errors);
        cb.onProgress(batch.totalRecords, batch.totalRecords, "Import completed");
        log.info("import.completed result={}", result);
        return result;
    }

    @Override
    public String getFormat() {
        return "json";
    }

    private void readArray(BufferedReader br, Batch batch) throws IOException {
        JsonNode root;
        try {
            root = objectMapper.readTree(br);
        } catch (JsonProcessingException e) {
            batch.errors.add(new ImportResult.ImportError(0, "", "Malformed JSON array: " + e.getOriginalMessage()));
            log.warn("import.error source={} error={}", batch.source, e.getOriginalMessage());
            return;
        }
        long position = 0;
        for (JsonNode element : root) {
            position++;
            batch.accept(position, element);
        }
    }

    private void readLines(BufferedReader br, Batch batch) throws IOException {
        String line;
        long lineNumber = 0;
        while ((line = br.readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            try {
                batch.accept(lineNumber, objectMapper.readTree(line));
            } catch (JsonProcessingException e) {
                batch.totalRecords++;
                batch.errors.add(new ImportResult.ImportError(lineNumber, line, "Malformed JSON: "
                        + e.getOriginalMessage()));
                log.warn("import.error source={} line={} error={}", batch.source, lineNumber, e.getOriginalMessage());
            }
        }
    }

    /**
     * Skips leading whitespace and returns the first significant character without consuming it.
     */
    private static int skipWhitespace(BufferedReader br) throws IOException {
        while (true) {
            br.mark(1);
            int c = br.read();
            if (c == -1) {
                return -1;
            }
            if (!Character.isWhitespace(c) && c != '\uFEFF') {
                br.reset();
                return c;
            }
        }
    }

    /**
     * Accumulates the outcome of one import.
     */
    private static final class Batch {
        private final Source source;
        private final ProgressCallback callback;
        private final List<RawListing> listings = new ArrayList<>();
        private final List<ImportResult.ImportError> errors = new ArrayList<>();
        private long totalRecords;

        Batch(Source source, ProgressCallback callback) {
            this.source = source;
            this.callback = callback;
        }

        void accept(long lineNumber, JsonNode node) {
            totalRecords++;
            if (node == null || !node.isObject()) {
                errors.add(new ImportResult.ImportError(lineNumber, String.valueOf(node), "Expected a JSON object"));
                log.warn("import.error source={} line={} error=not-an-object", source, lineNumber);
            } else {
                listings.add(ListingFields.toListing(source, listings.size(), values(node)));
            }
            if (totalRecords % PROGRESS_INTERVAL == 0) {
                callback.onProgress(totalRecords, -1, "Read " + totalRecords + " records");
            }
        }

        private static Map<ListingFields, String> values(JsonNode node) {
            Map<ListingFields, String> values = new EnumMap<>(ListingFields.class);
            Iterator<Map.Entry<String, JsonNode>> properties = node.fields();
            while (properties.hasNext()) {
                Map.Entry<String, JsonNode> property = properties.next();
                ListingFields field = ListingFields.forName(property.getKey());
                JsonNode value = property.getValue();
                if (field != null && !values.containsKey(field) && value.isValueNode() && !value.isNull()) {
                    values.put(field, value.asText());
                }
            }
            return values;
        }
    }
}
