package com.hotel.reconciliation.blocking;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * The candidate pairs of all A listings sharing one grid cell.
 * Partitions are disjoint on the A side, so they can be scored independently.
 * Iteration is lazy and can be repeated.
 */
public final class CandidatePartition implements Iterable<CandidateIndexPair> {

    private final GridCell cell;
    private final List<Integer> aIndices;
    private final List<BucketKey> aKeys;
    private final Map<BucketKey, List<Integer>> bIndex;
    private final GridNeighborhood neighborhood;

    CandidatePartition(GridCell cell, List<Integer> aIndices, List<BucketKey> aKeys,
                       Map<BucketKey, List<Integer>> bIndex, GridNeighborhood neighborhood) {
        this.cell = cell;
        this.aIndices = List.copyOf(aIndices);
        this.aKeys = List.copyOf(aKeys);
        this.bIndex = bIndex;
        this.neighborhood = neighborhood;
    }

    public GridCell getCell() {
        return cell;
    }

    /**
     * Indices of the A listings in this partition, ascending.
     */
    public List<Integer> getAIndices() {
        return aIndices;
    }

    /**
     * B candidates of one A listing of this partition, ascending by B index.
     */
    List<Integer> candidatesOf(int position) {
        BucketKey key = aKeys.get(position);
        List<List<Integer>> groups = new ArrayList<>();
        int total = 0;
        for (GridCell neighbor : neighborhood.around(key.cell())) {
            List<Integer> group = bIndex.get(key.inCell(neighbor));
            if (group != null) {
                groups.add(group);
                total += group.size();
            }
        }
        if (groups.size() == 1) {
            return groups.get(0);
        }
        List<Integer> merged = new ArrayList<>(total);
        groups.forEach(merged::addAll);
        merged.sort(null);
        return merged;
    }

    @Override
    public Iterator<CandidateIndexPair> iterator() {
        return new Iterator<>() {
            private int position = 0;
            private List<Integer> current = List.of();
            private int offset = 0;

            @Override
            public boolean hasNext() {
                while (offset >= current.size()) {
                    if (position >= aIndices.size()) {
                        return false;
                    }
                    current = candidatesOf(position);
                    offset = 0;
                    position++;
                }
                return true;
            }

            @Override
            public CandidateIndexPair next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return new CandidateIndexPair(aIndices.get(position - 1), current.get(offset++));
            }
        };
    }

    @Override
    public String toString() {
        return "CandidatePartition{" + cell + ", aListings=" + aIndices.size() + '}';
    }
}
