package org.netpreserve.archivescope.discovery;

/**
 * Page counts of a domain in two snapshots.
 *
 * @param changePercent change relative to the first snapshot, 0 when the first has no pages
 */
public record SnapshotComparison(
        String domain,
        SnapshotPages first,
        SnapshotPages second,
        int change,
        double changePercent,
        Trend trend
) {
    public record SnapshotPages(String snapshotId, int pages) {
    }

    public enum Trend {
        GROWING, SHRINKING, STABLE;

        static Trend of(int change) {
            return change > 0 ? GROWING : change < 0 ? SHRINKING : STABLE;
        }
    }
}
