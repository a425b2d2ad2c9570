// file: core/src/test/java/io/rowstore/core/retry/ExponentialBackoffPolicyTest.java
package io.rowstore.core.retry;

import io.grpc.Status;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExponentialBackoffPolicyTest {

    private static List<Long> delays(BackoffPolicy p, int n, Status status) {
        List<Long> out = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            out.add(p.onCompletion(status).toMillis());
        }
        return out;
    }

    @Test
    void doubles_and_caps_at_maximum() {
        var p = new ExponentialBackoffPolicy(Duration.ofMillis(10), Duration.ofMillis(50));
        assertEquals(List.of(10L, 20L, 40L, 50L, 50L), delays(p, 5, Status.UNAVAILABLE));
    }

    @Test
    void tolerates_calls_after_success() {
        var p = new ExponentialBackoffPolicy(Duration.ofMillis(10), Duration.ofMillis(50));
        assertEquals(List.of(10L, 20L), delays(p, 2, Status.OK));
    }

    @Test
    void clone_starts_over_from_initial() {
        var p = new ExponentialBackoffPolicy(Duration.ofMillis(5), Duration.ofMillis(100));
        delays(p, 4, Status.UNAVAILABLE);
        assertEquals(List.of(5L, 10L), delays(p.clone(), 2, Status.UNAVAILABLE));
    }

    @Test
    void zero_initial_delay_stays_zero() {
        var p = new ExponentialBackoffPolicy(Duration.ZERO, Duration.ofMillis(10));
        assertEquals(List.of(0L, 0L, 0L), delays(p, 3, Status.UNAVAILABLE));
    }

    @Test
    void rejects_maximum_below_initial() {
        assertThrows(IllegalArgumentException.class,
                () -> new ExponentialBackoffPolicy(Duration.ofMillis(10), Duration.ofMillis(5)));
    }
}
