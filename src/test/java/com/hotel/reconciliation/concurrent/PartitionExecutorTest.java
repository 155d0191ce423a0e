package com.hotel.reconciliation.concurrent;

import com.hotel.reconciliation.logging.LogContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PartitionExecutor Tests")
class PartitionExecutorTest {

    @Test
    @DisplayName("Results keep partition order")
    void keepsOrder() {
        List<Integer> partitions = IntStream.range(0, 50).boxed().toList();

        try (PartitionExecutor executor = PartitionExecutor.create(4)) {
            List<Integer> squares = executor.map(partitions, i -> {
                if (i % 7 == 0) {
                    Thread.yield();
                }
                return i * i;
            });

            assertEquals(IntStream.range(0, 50).map(i -> i * i).boxed().toList(), squares);
        }
    }

    @Test
    @DisplayName("Pool threads carry the caller's run and stage context")
    void propagatesLogContext() {
        List<Integer> partitions = IntStream.range(0, 8).boxed().toList();

        List<String> seen;
        try (LogContext run = LogContext.forRun("run-42");
             LogContext stage = LogContext.forStage("matching");
             PartitionExecutor executor = PartitionExecutor.create(4)) {
            seen = executor.map(partitions, i -> MDC.get("runId") + "/" + MDC.get("stage"));
        }

        assertEquals(8, seen.size());
        assertTrue(seen.stream().allMatch("run-42/matching"::equals));
        assertNull(MDC.get("runId"));
    }

    @Test
    @DisplayName("Pool threads do not keep a finished run's context")
    void clearsLogContextAfterTask() {
        try (PartitionExecutor executor = PartitionExecutor.create(2)) {
            try (LogContext run = LogContext.forRun("run-1")) {
                executor.map(List.of(1, 2, 3, 4), i -> i);
            }
            List<String> after = executor.map(List.of(1, 2, 3, 4), i -> MDC.get("runId"));

            assertTrue(after.stream().allMatch(Objects::isNull));
        }
    }

    @Test
    @DisplayName("Parallelism 1 runs on the calling thread")
    void sequentialRunsInline() {
        Set<String> threads = ConcurrentHashMap.newKeySet();

        try (PartitionExecutor executor = PartitionExecutor.sequential()) {
            executor.map(List.of(1, 2, 3), i -> threads.add(Thread.currentThread().getName()));
        }

        assertEquals(Set.of(Thread.currentThread().getName()), threads);
    }

    @Test
    @DisplayName("A failing partition fails the call with its own exception")
    void propagatesFailure() {
        try (PartitionExecutor executor = PartitionExecutor.create(3)) {
            IllegalStateException e = assertThrows(IllegalStateException.class,
                    () -> executor.map(List.of(1, 2, 3, 4), i -> {
                        if (i == 3) {
                            throw new IllegalStateException("partition 3 failed");
                        }
                        return i;
                    }));
            assertEquals("partition 3 failed", e.getMessage());
        }
    }

    @Test
    @DisplayName("Chunks are consecutive and bounded")
    void chunk() {
        List<List<Integer>> chunks = PartitionExecutor.chunk(List.of(1, 2, 3, 4, 5), 2);

        assertEquals(List.of(List.of(1, 2), List.of(3, 4), List.of(5)), chunks);
        assertTrue(PartitionExecutor.chunk(List.of(), 3).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> PartitionExecutor.chunk(List.of(1), 0));
    }

    @Test
    @DisplayName("Parallelism must be positive")
    void invalidParallelism() {
        assertThrows(IllegalArgumentException.class, () -> PartitionExecutor.create(0));
    }
}
