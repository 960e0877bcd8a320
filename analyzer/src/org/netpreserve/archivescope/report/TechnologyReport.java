package org.netpreserve.archivescope.report;

import java.util.Map;

/**
 * Technology usage across a domain's sampled pages.
 *
 * @param technologies       technology name to the number of pages using it, most used first
 * @param categories         category to its technologies' page counts
 * @param adoptionPercentage technology name to the percentage of analysed pages using it
 */
public record TechnologyReport(
        String domain,
        String snapshotId,
        int pagesAnalyzed,
        int pagesAttempted,
        Map<String, Integer> technologies,
        Map<String, Map<String, Integer>> categories,
        Map<String, Double> adoptionPercentage
) {
    static TechnologyReport empty(String domain, String snapshotId) {
        return new TechnologyReport(domain, snapshotId, 0, 0, Map.of(), Map.of(), Map.of());
    }
}
