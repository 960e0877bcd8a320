package org.netpreserve.archivescope.config;

/**
 * Limits shared by the index and object store clients.
 *
 * @param maxConcurrent     requests allowed in flight at once
 * @param requestsPerSecond pacing between the end of one request and the start of the next
 */
public record RateLimitConfig(
        int maxConcurrent,
        double requestsPerSecond
) {
}
