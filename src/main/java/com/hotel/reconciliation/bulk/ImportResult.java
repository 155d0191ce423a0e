package com.hotel.reconciliation.bulk;

import com.hotel.reconciliation.core.model.RawListing;
import com.hotel.reconciliation.core.model.Source;

import java.util.List;
import java.util.Objects;

/**
 * Result of importing one source's listings.
 *
 * @param source       the source the listings were tagged with
 * @param listings     listings read, indexed by their position in this list
 * @param totalRecords number of records found in the input, readable or not
 * @param errors       records that could not be read
 */
public record ImportResult(
        Source source,
        List<RawListing> listings,
        long totalRecords,
        List<ImportError> errors
) {
    public ImportResult {
        Objects.requireNonNull(source, "source is required");
        listings = listings != null ? List.copyOf(listings) : List.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public long successCount() {
        return listings.size();
    }

    public long errorCount() {
        return errors.size();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * A record that could not be read.
     *
     * @param lineNumber line (CSV, JSONL) or element position (JSON array) in the input, 1-based
     * @param input      the offending input, possibly truncated
     * @param message    why it could not be read
     */
    public record ImportError(long lineNumber, String input, String message) {}

    @Override
    public String toString() {
        return "ImportResult{source=" + source +
                ", total=" + totalRecords +
                ", imported=" + listings.size() +
                ", errors=" + errors.size() + '}';
    }
}
