package org.netpreserve.archivescope.cache;

/**
 * @param hits           reads answered by any tier
 * @param misses         reads answered by no tier
 * @param hitRatePercent hits / (hits + misses) × 100, rounded to two decimals
 * @param evictions      persisted entries removed to stay under the size bound
 * @param entryCount     persisted entries
 * @param sizeBytes      persisted bytes
 * @param maxSizeBytes   configured persisted size bound
 * @param memoryEntries  entries in the in-process tier
 */
public record CacheStats(
        long hits,
        long misses,
        double hitRatePercent,
        long evictions,
        long entryCount,
        long sizeBytes,
        long maxSizeBytes,
        int memoryEntries
) {
    static double hitRatePercent(long hits, long misses) {
        long total = hits + misses;
        if (total == 0) return 0.0;
        return Math.round(hits * 10000.0 / total) / 100.0;
    }
}
