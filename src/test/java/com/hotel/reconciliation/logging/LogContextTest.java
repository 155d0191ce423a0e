package com.hotel.reconciliation.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogContext Tests")
class LogContextTest {

    @AfterEach
    void cleanupMDC() {
        MDC.clear();
    }

    @Test
    @DisplayName("forRun sets runId and operation")
    void forRunSetsMDC() {
        try (LogContext ctx = LogContext.forRun("run-123")) {
            assertEquals("run-123", MDC.get("runId"));
            assertEquals("reconcile", MDC.get("operation"));
        }
        assertNull(MDC.get("runId"));
        assertNull(MDC.get("operation"));
    }

    @Test
    @DisplayName("A stage context only removes its own keys")
    void nestedStage() {
        try (LogContext run = LogContext.forRun("run-1")) {
            try (LogContext stage = LogContext.forStage("match")) {
                assertEquals("match", MDC.get("stage"));
                assertEquals("run-1", MDC.get("runId"));
            }
            assertNull(MDC.get("stage"));
            assertEquals("run-1", MDC.get("runId"));
        }
    }

    @Test
    @DisplayName("Extra keys are removed on close")
    void withExtraKeys() {
        LogContext ctx = LogContext.forStage("normalize").with("source", "A");
        assertEquals("A", MDC.get("source"));

        ctx.close();

        assertNull(MDC.get("source"));
        assertNull(MDC.get("stage"));
    }

    @Test
    @DisplayName("Run ids are unique")
    void uniqueRunIds() {
        assertNotEquals(LogContext.generateRunId(), LogContext.generateRunId());
    }
}
