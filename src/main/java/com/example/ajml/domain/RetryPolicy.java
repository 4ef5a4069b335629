package com.example.ajml.domain;

import java.util.List;
import java.util.Objects;

/**
 * Retry behaviour of an API tool. {@code maxRetries == 0} disables retrying.
 */
public record RetryPolicy(int maxRetries, Backoff backoff, double baseDelaySeconds, List<Integer> retryStatusCodes) {

    public static final String DEFAULT_STATUS_CODES = "429, 500, 502, 503, 504";

    /** Upper bound of a single exponential wait. */
    public static final double MAX_BACKOFF_SECONDS = 60.0;

    public RetryPolicy {
        Objects.requireNonNull(backoff, "backoff");
        retryStatusCodes = retryStatusCodes != null ? List.copyOf(retryStatusCodes) : List.of();
    }

    public boolean enabled() {
        return maxRetries > 0;
    }

    public enum Backoff {
        EXPONENTIAL, FIXED;

        public static Backoff fromToken(String token) {
            if ("exponential".equals(token)) {
                return EXPONENTIAL;
            }
            if ("fixed".equals(token)) {
                return FIXED;
            }
            throw new IllegalArgumentException("Unknown backoff strategy: " + token);
        }
    }
}
