package com.hotel.reconciliation.bulk;

import com.hotel.reconciliation.core.model.Source;

import java.io.InputStream;
import java.io.Reader;

/**
 * Reads already-collected listings of one platform into {@code RawListing}s.
 * Unreadable records are reported in {@link ImportResult#errors()}, never thrown.
 */
public interface ListingImporter {

    /**
     * Imports listings from a UTF-8 input stream.
     *
     * @param input    the input stream to read from
     * @param source   the source tag to assign to every listing
     * @param callback optional progress callback
     * @return the import result
     */
    ImportResult importListings(InputStream input, Source source, ProgressCallback callback);

    /**
     * Imports listings from a reader.
     *
     * @param reader   the reader to read from
     * @param source   the source tag to assign to every listing
     * @param callback optional progress callback
     * @return the import result
     */
    ImportResult importListings(Reader reader, Source source, ProgressCallback callback);

    /**
     * Returns the format supported by this importer ("csv", "json").
     */
    String getFormat();
}
