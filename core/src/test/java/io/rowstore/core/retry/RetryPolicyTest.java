// file: core/src/test/java/io/rowstore/core/retry/RetryPolicyTest.java
package io.rowstore.core.retry;

import io.grpc.Status;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    /** Clock the test moves by hand. */
    static final class ManualClock extends Clock {
        private Instant now;

        ManualClock(Instant start) {
            this.now = start;
        }

        void advance(Duration d) {
            now = now.plus(d);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }

    @Test
    void only_transient_codes_are_retryable() {
        assertTrue(RetryPolicy.isRetryable(Status.UNAVAILABLE));
        assertTrue(RetryPolicy.isRetryable(Status.DEADLINE_EXCEEDED));
        assertFalse(RetryPolicy.isRetryable(Status.OK));
        assertFalse(RetryPolicy.isRetryable(Status.INTERNAL));
        assertFalse(RetryPolicy.isRetryable(Status.PERMISSION_DENIED));
        assertFalse(RetryPolicy.isRetryable(Status.OUT_OF_RANGE));
    }

    @Test
    void retryable_codes_cannot_be_changed_by_callers() {
        assertThrows(UnsupportedOperationException.class,
                () -> RetryPolicy.RETRYABLE_CODES.add(Status.Code.PERMISSION_DENIED));
        assertThrows(UnsupportedOperationException.class,
                () -> RetryPolicy.RETRYABLE_CODES.remove(Status.Code.UNAVAILABLE));
        assertFalse(RetryPolicy.isRetryable(Status.PERMISSION_DENIED));
        assertTrue(RetryPolicy.isRetryable(Status.UNAVAILABLE));
    }

    @Test
    void limited_error_count_allows_exactly_max_failures() {
        var p = new LimitedErrorCountRetryPolicy(3);
        assertTrue(p.onFailure(Status.UNAVAILABLE));
        assertTrue(p.onFailure(Status.DEADLINE_EXCEEDED));
        assertTrue(p.onFailure(Status.UNAVAILABLE));
        assertFalse(p.onFailure(Status.UNAVAILABLE), "fourth failure exceeds the budget");
    }

    @Test
    void limited_error_count_stops_on_permanent_error_regardless_of_count() {
        var p = new LimitedErrorCountRetryPolicy(100);
        assertFalse(p.onFailure(Status.PERMISSION_DENIED));
    }

    @Test
    void clone_resets_the_counter_but_keeps_the_limit() {
        var prototype = new LimitedErrorCountRetryPolicy(1);
        assertTrue(prototype.onFailure(Status.UNAVAILABLE));
        assertFalse(prototype.onFailure(Status.UNAVAILABLE));

        RetryPolicy fresh = prototype.clone();
        assertNotSame(prototype, fresh);
        assertTrue(fresh.onFailure(Status.UNAVAILABLE));
        assertFalse(fresh.onFailure(Status.UNAVAILABLE));
    }

    @Test
    void limited_time_allows_retries_until_deadline() {
        var clock = new ManualClock(Instant.parse("2024-01-01T00:00:00Z"));
        var p = new LimitedTimeRetryPolicy(Duration.ofSeconds(10), clock);
        assertEquals(Instant.parse("2024-01-01T00:00:10Z"), p.deadline());

        assertTrue(p.onFailure(Status.UNAVAILABLE));
        clock.advance(Duration.ofSeconds(9));
        assertTrue(p.onFailure(Status.UNAVAILABLE));
        clock.advance(Duration.ofSeconds(1));
        assertFalse(p.onFailure(Status.UNAVAILABLE), "deadline reached");
    }

    @Test
    void limited_time_stops_on_permanent_error_and_clone_moves_deadline() {
        var clock = new ManualClock(Instant.parse("2024-01-01T00:00:00Z"));
        var p = new LimitedTimeRetryPolicy(Duration.ofSeconds(10), clock);
        assertFalse(p.onFailure(Status.INVALID_ARGUMENT));

        clock.advance(Duration.ofMinutes(1));
        assertFalse(p.onFailure(Status.UNAVAILABLE));

        var fresh = p.clone();
        assertEquals(Instant.parse("2024-01-01T00:01:10Z"), fresh.deadline());
        assertTrue(fresh.onFailure(Status.UNAVAILABLE));
    }

    @Test
    void limited_time_reports_remaining_budget_and_never_goes_negative() {
        var clock = new ManualClock(Instant.parse("2024-01-01T00:00:00Z"));
        var p = new LimitedTimeRetryPolicy(Duration.ofSeconds(10), clock);
        assertEquals(Duration.ofSeconds(10), p.remaining());

        clock.advance(Duration.ofSeconds(7));
        assertEquals(Duration.ofSeconds(3), p.remaining());

        clock.advance(Duration.ofSeconds(5));
        assertEquals(Duration.ZERO, p.remaining());
    }
}
