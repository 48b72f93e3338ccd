package io.sunplane.client;

import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Attempt budget and backoff for idempotent object store requests.
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay) {
    public static final RetryPolicy DEFAULT = new RetryPolicy(4, Duration.ofMillis(200), Duration.ofSeconds(2));

    public RetryPolicy {
        maxAttempts = Math.max(1, maxAttempts);
        baseDelay = baseDelay == null || baseDelay.isNegative() ? Duration.ZERO : baseDelay;
        maxDelay = maxDelay == null || maxDelay.isNegative() ? Duration.ZERO : maxDelay;
    }

    public static boolean retryableStatus(int status) {
        return status == 408 || status == 425 || status == 429 || (status >= 500 && status <= 599);
    }

    /**
     * Delay after {@code failedAttempt} (1-indexed) failed. A parseable Retry-After wins over backoff;
     * both are clamped to {@link #maxDelay()}.
     */
    public Duration delayAfter(int failedAttempt, String retryAfter, Instant now) {
        String value = retryAfter == null ? "" : retryAfter.trim();
        if (!value.isEmpty()) {
            Duration hinted = parseRetryAfter(value, now);
            if (hinted != null) {
                return clamp(hinted);
            }
        }
        int attempt = Math.max(1, failedAttempt);
        int shift = Math.min(attempt - 1, 20);
        return clamp(baseDelay.multipliedBy(1L << shift));
    }

    private Duration clamp(Duration delay) {
        if (delay.isNegative()) {
            return Duration.ZERO;
        }
        return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
    }

    static Duration parseRetryAfter(String value, Instant now) {
        try {
            long seconds = Long.parseLong(value);
            return seconds >= 0 ? Duration.ofSeconds(seconds) : null;
        } catch (NumberFormatException ignored) {
            // not delta-seconds, try HTTP-date
        }
        try {
            Instant at = ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
            Duration delay = Duration.between(now, at);
            return delay.isNegative() ? Duration.ZERO : delay;
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
