package com.whereq.orchestra.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * Transport-level redelivery policy for nacked tasks.
 * The default of one attempt means a failed task is not redelivered.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetryPolicy {

    /**
     * Total delivery attempts, including the first one
     */
    @Builder.Default
    private int maxAttempts = 1;

    /**
     * Initial backoff interval in milliseconds
     */
    @Builder.Default
    private long initialIntervalMs = 1000;

    /**
     * Backoff multiplier
     */
    @Builder.Default
    private int backoffMultiplier = 2;

    /**
     * Maximum backoff interval in milliseconds
     */
    @Builder.Default
    private long maxIntervalMs = 60000;

    public static RetryPolicy defaultPolicy() {
        return RetryPolicy.builder().build();
    }

    public boolean allowsAnotherAttempt(int attempt) {
        return attempt < maxAttempts;
    }

    /**
     * Exponential backoff before delivering attempt {@code attempt + 1}
     */
    public Duration backoffAfter(int attempt) {
        long backoff = (long) (initialIntervalMs * Math.pow(backoffMultiplier, Math.max(attempt - 1, 0)));
        return Duration.ofMillis(Math.min(backoff, maxIntervalMs));
    }
}
