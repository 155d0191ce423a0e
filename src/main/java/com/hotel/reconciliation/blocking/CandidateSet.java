package com.hotel.reconciliation.blocking;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * The finite, restartable sequence of candidate pairs of one run.
 * Nothing is materialized up front: each iteration walks the partitions again.
 */
public final class CandidateSet implements Iterable<CandidateIndexPair> {

    private final List<CandidatePartition> partitions;

    CandidateSet(List<CandidatePartition> partitions) {
        this.partitions = List.copyOf(partitions);
    }

    /**
     * Partitions in ascending order of their lowest A index.
     */
    public List<CandidatePartition> partitions() {
        return partitions;
    }

    @Override
    public Iterator<CandidateIndexPair> iterator() {
        return new Iterator<>() {
            private int partition = 0;
            private Iterator<CandidateIndexPair> current = Collections.emptyIterator();

            @Override
            public boolean hasNext() {
                while (!current.hasNext()) {
                    if (partition >= partitions.size()) {
                        return false;
                    }
                    current = partitions.get(partition++).iterator();
                }
                return true;
            }

            @Override
            public CandidateIndexPair next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return current.next();
            }
        };
    }

    public Stream<CandidateIndexPair> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    /**
     * Materializes every pair. Mostly useful for tests and audits.
     */
    public List<CandidateIndexPair> toList() {
        List<CandidateIndexPair> pairs = new ArrayList<>();
        forEach(pairs::add);
        return pairs;
    }

    public long count() {
        long count = 0;
        for (CandidatePartition partition : partitions) {
            for (int i = 0; i < partition.getAIndices().size(); i++) {
                count += partition.candidatesOf(i).size();
            }
        }
        return count;
    }
}
