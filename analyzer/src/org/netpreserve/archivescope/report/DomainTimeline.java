package org.netpreserve.archivescope.report;

import java.util.List;
import java.util.Map;

/**
 * A domain's evolution over snapshots in the order given by the caller. The added and removed
 * technology lists are keyed by the later snapshot of each adjacent pair.
 */
public record DomainTimeline(
        String domain,
        List<String> snapshots,
        Map<String, Integer> pageCounts,
        Map<String, Long> sizeBytes,
        Map<String, Integer> pagesAnalyzed,
        Map<String, Integer> pagesAttempted,
        Map<String, List<String>> technologies,
        Map<String, List<String>> technologiesAdded,
        Map<String, List<String>> technologiesRemoved
) {
}
