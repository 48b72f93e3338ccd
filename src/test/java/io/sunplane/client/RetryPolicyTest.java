package io.sunplane.client;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

final class RetryPolicyTest {
    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void backoffDoublesFromBaseAndCapsAtTwoSeconds() {
        RetryPolicy policy = RetryPolicy.DEFAULT;

        Assertions.assertEquals(Duration.ofMillis(200), policy.delayAfter(1, null, NOW));
        Assertions.assertEquals(Duration.ofMillis(400), policy.delayAfter(2, null, NOW));
        Assertions.assertEquals(Duration.ofMillis(800), policy.delayAfter(3, "", NOW));
        Assertions.assertEquals(Duration.ofSeconds(2), policy.delayAfter(9, null, NOW));
    }

    @Test
    void retryAfterSecondsIsHonouredAndClamped() {
        Assertions.assertEquals(Duration.ofSeconds(1), RetryPolicy.DEFAULT.delayAfter(1, "1", NOW));
        Assertions.assertEquals(Duration.ofSeconds(2), RetryPolicy.DEFAULT.delayAfter(1, "120", NOW));
    }

    @Test
    void retryAfterHttpDateIsRelativeToNow() {
        Duration delay = RetryPolicy.DEFAULT.delayAfter(1, "Thu, 01 Jan 2026 00:00:01 GMT", NOW);
        Assertions.assertEquals(Duration.ofSeconds(1), delay);
        Assertions.assertEquals(Duration.ZERO, RetryPolicy.DEFAULT.delayAfter(1, "Wed, 31 Dec 2025 23:00:00 GMT", NOW));
    }

    @Test
    void unparseableRetryAfterFallsBackToBackoff() {
        Assertions.assertEquals(Duration.ofMillis(400), RetryPolicy.DEFAULT.delayAfter(2, "soon", NOW));
    }

    @Test
    void retryableStatuses() {
        for (int status : new int[]{408, 425, 429, 500, 503, 599}) {
            Assertions.assertTrue(RetryPolicy.retryableStatus(status), "status " + status);
        }
        for (int status : new int[]{200, 400, 401, 403, 404, 409, 600}) {
            Assertions.assertFalse(RetryPolicy.retryableStatus(status), "status " + status);
        }
    }
}
