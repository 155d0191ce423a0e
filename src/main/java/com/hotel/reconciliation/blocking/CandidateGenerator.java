package com.hotel.reconciliation.blocking;

import com.hotel.reconciliation.core.model.NormalizedListing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Proposes cross-source candidate pairs using bucket keys instead of all-pairs comparison.
 *
 * <p>B listings are indexed by bucket key. Each A listing is paired with the B listings that
 * share its name token and sit in a cell of its {@link GridNeighborhood}: the adjacent cells
 * by default, or every cell within a search radius. With a radius, no pair closer than the
 * radius is skipped; a true match is then missed only when the first cleaned name tokens differ
 * (when the name token is in use).</p>
 *
 * <p>Indices in the produced pairs are positions in the lists given to {@link #generate}.</p>
 */
public class CandidateGenerator {
    private static final Logger log = LoggerFactory.getLogger(CandidateGenerator.class);

    private final GridNeighborhood neighborhood;

    public CandidateGenerator() {
        this(GridNeighborhood.adjacent());
    }

    public CandidateGenerator(GridNeighborhood neighborhood) {
        this.neighborhood = Objects.requireNonNull(neighborhood, "neighborhood is required");
    }

    public GridNeighborhood getNeighborhood() {
        return neighborhood;
    }

    public CandidateSet generate(List<NormalizedListing> sourceA, List<NormalizedListing> sourceB) {
        Map<BucketKey, List<Integer>> bIndex = new HashMap<>();
        for (int i = 0; i < sourceB.size(); i++) {
            bIndex.computeIfAbsent(sourceB.get(i).bucketKey(), k -> new ArrayList<>()).add(i);
        }
        bIndex.replaceAll((key, indices) -> Collections.unmodifiableList(indices));
        Map<BucketKey, List<Integer>> frozenIndex = Collections.unmodifiableMap(bIndex);

        // Partition A by cell, in order of first appearance (= ascending lowest index)
        Map<GridCell, List<Integer>> byCell = new LinkedHashMap<>();
        for (int i = 0; i < sourceA.size(); i++) {
            byCell.computeIfAbsent(sourceA.get(i).bucketKey().cell(), c -> new ArrayList<>()).add(i);
        }

        List<CandidatePartition> partitions = new ArrayList<>(byCell.size());
        for (Map.Entry<GridCell, List<Integer>> entry : byCell.entrySet()) {
            List<BucketKey> keys = new ArrayList<>(entry.getValue().size());
            for (int aIndex : entry.getValue()) {
                keys.add(sourceA.get(aIndex).bucketKey());
            }
            partitions.add(new CandidatePartition(
                    entry.getKey(), entry.getValue(), keys, frozenIndex, neighborhood));
        }

        log.debug("candidates.indexed aListings={} bListings={} bBuckets={} partitions={} neighborhood={}",
                sourceA.size(), sourceB.size(), frozenIndex.size(), partitions.size(), neighborhood);
        return new CandidateSet(partitions);
    }
}
