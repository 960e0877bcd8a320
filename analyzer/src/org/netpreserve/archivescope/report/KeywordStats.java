package org.netpreserve.archivescope.report;

import java.util.List;
import java.util.Map;

/**
 * Keyword occurrences across a domain sample.
 *
 * @param frequencies      keyword to per-URL occurrence counts; URLs without an occurrence are absent
 * @param totalOccurrences keyword to its total count over all analysed pages
 * @param tfidfScores      keyword to per-URL TF-IDF; keywords found on no page are absent
 */
public record KeywordStats(
        String domain,
        String snapshotId,
        List<String> keywords,
        boolean caseSensitive,
        int pagesAnalyzed,
        int pagesAttempted,
        Map<String, Map<String, Integer>> frequencies,
        Map<String, Integer> totalOccurrences,
        Map<String, Map<String, Double>> tfidfScores
) {
}
