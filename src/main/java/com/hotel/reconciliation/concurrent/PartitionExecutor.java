package com.hotel.reconciliation.concurrent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Runs independent partitions of one reconciliation run and returns their results in
 * partition order, so callers can merge by concatenation regardless of scheduling.
 *
 * <p>With parallelism 1 every partition runs on the calling thread and no pool is created.
 * Otherwise a fixed pool lives for the duration of the run and is shut down on {@link #close()}.
 * A failure in any partition fails the whole call. Pool threads see the caller's MDC
 * (run id, stage) while they work on its partitions.</p>
 */
public class PartitionExecutor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PartitionExecutor.class);
    private static final AtomicInteger POOL_SEQUENCE = new AtomicInteger();

    private final int parallelism;
    private final ExecutorService executor;

    private PartitionExecutor(int parallelism) {
        this.parallelism = parallelism;
        this.executor = parallelism > 1 ? Executors.newFixedThreadPool(parallelism, threadFactory()) : null;
    }

    /**
     * Creates an executor for one run.
     *
     * @param parallelism number of worker threads; 1 runs partitions inline
     */
    public static PartitionExecutor create(int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1");
        }
        return new PartitionExecutor(parallelism);
    }

    /**
     * An executor that runs everything on the calling thread.
     */
    public static PartitionExecutor sequential() {
        return new PartitionExecutor(1);
    }

    public int getParallelism() {
        return parallelism;
    }

    /**
     * Applies {@code task} to every partition and returns the results in partition order.
     */
    public <P, R> List<R> map(List<P> partitions, Function<? super P, ? extends R> task) {
        List<R> results = new ArrayList<>(partitions.size());
        if (executor == null || partitions.size() <= 1) {
            for (P partition : partitions) {
                results.add(task.apply(partition));
            }
            return results;
        }

        Map<String, String> logContext = MDC.getCopyOfContextMap();
        List<Future<? extends R>> futures = new ArrayList<>(partitions.size());
        for (P partition : partitions) {
            futures.add(executor.submit(() -> withLogContext(logContext, () -> task.apply(partition))));
        }
        try {
            for (Future<? extends R> future : futures) {
                results.add(future.get());
            }
        } catch (InterruptedException e) {
            cancelAll(futures);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Partitioned work interrupted", e);
        } catch (ExecutionException e) {
            cancelAll(futures);
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Partition failed", cause);
        }
        return results;
    }

    /**
     * Splits a list into consecutive chunks of at most {@code chunkSize} elements.
     */
    public static <T> List<List<T>> chunk(List<T> items, int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be > 0");
        }
        List<List<T>> chunks = new ArrayList<>();
        for (int start = 0; start < items.size(); start += chunkSize) {
            chunks.add(items.subList(start, Math.min(items.size(), start + chunkSize)));
        }
        return chunks;
    }

    @Override
    public void close() {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("partition.executor.forced-shutdown parallelism={}", parallelism);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Runs {@code work} on a pool thread with the submitting thread's MDC, then clears it.
     */
    private static <R> R withLogContext(Map<String, String> logContext, Supplier<R> work) {
        if (logContext != null) {
            MDC.setContextMap(logContext);
        }
        try {
            return work.get();
        } finally {
            MDC.clear();
        }
    }

    private static void cancelAll(List<? extends Future<?>> futures) {
        for (Future<?> future : futures) {
            future.cancel(true);
        }
    }

    private static ThreadFactory threadFactory() {
        int pool = POOL_SEQUENCE.incrementAndGet();
        AtomicInteger threadNumber = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable,
                    "reconcile-" + pool + "-worker-" + threadNumber.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
