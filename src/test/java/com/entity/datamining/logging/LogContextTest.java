package com.entity.datamining.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogContext Tests")
class LogContextTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    @DisplayName("Should populate request keys and remove them on close")
    void requestContext() {
        try (LogContext ctx = LogContext.forRequest("corr-1", "fetch")) {
            assertEquals("corr-1", MDC.get("correlationId"));
            assertEquals("fetch", MDC.get("requestType"));
            assertEquals("request", MDC.get("operation"));
        }
        assertNull(MDC.get("correlationId"));
        assertNull(MDC.get("operation"));
    }

    @Test
    @DisplayName("Should populate task keys and extra keys")
    void taskContext() {
        try (LogContext ctx = LogContext.forTask("politician", "stances", "P1").with("attempt", "1")) {
            assertEquals("politician", MDC.get("entityType"));
            assertEquals("stances", MDC.get("field"));
            assertEquals("P1", MDC.get("referenceId"));
            assertEquals("enrich", MDC.get("operation"));
            assertEquals("1", MDC.get("attempt"));
        }
        assertNull(MDC.get("referenceId"));
        assertNull(MDC.get("attempt"));
    }

    @Test
    @DisplayName("Should leave unrelated MDC keys alone")
    void keepsOtherKeys() {
        MDC.put("service", "orchestrator");
        try (LogContext ctx = LogContext.forRequest(LogContext.generateCorrelationId(), "search")) {
            assertNotNull(MDC.get("correlationId"));
        }
        assertEquals("orchestrator", MDC.get("service"));
    }
}
