package com.logicsynth.eval;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class QueryContextTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void beforeDeadline_passes() {
        QueryContext context = QueryContext.withDeadline(Clock.fixed(NOW, ZoneOffset.UTC), NOW.plusSeconds(1));
        assertFalse(context.isExpired());
        assertDoesNotThrow(context::checkDeadline);
    }

    @Test
    void pastDeadline_throws() {
        QueryContext context = QueryContext.withDeadline(Clock.fixed(NOW, ZoneOffset.UTC), NOW.minusMillis(1));
        assertTrue(context.isExpired());
        QueryTimeoutException ex = assertThrows(QueryTimeoutException.class, context::checkDeadline);
        assertTrue(ex.getMessage().contains("deadline"));
    }

    @Test
    void cancellation_throwsEvenBeforeDeadline() {
        QueryContext context = QueryContext.withTimeout(Duration.ofMinutes(1));
        context.cancel();
        assertTrue(context.isCancelled());
        QueryTimeoutException ex = assertThrows(QueryTimeoutException.class, context::checkDeadline);
        assertEquals("query cancelled", ex.getMessage());
    }
}
