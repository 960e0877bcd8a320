package org.netpreserve.archivescope.db;

import java.time.Duration;
import java.time.Instant;

/**
 * Metadata row of one persisted cache value. Timestamps are epoch milliseconds.
 */
public record CacheEntry(
        String keyHash,
        String filename,
        long sizeBytes,
        long createdAt,
        long lastAccessedAt,
        long accessCount,
        long ttlSeconds
) {
    public Instant expiresAt() {
        return Instant.ofEpochMilli(createdAt).plus(Duration.ofSeconds(ttlSeconds));
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt());
    }
}
