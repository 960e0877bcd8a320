package org.netpreserve.archivescope.discovery;

import java.util.List;
import java.util.Map;

/**
 * A domain's presence in one snapshot, computed from index records alone.
 *
 * @param totalPages     index records examined
 * @param subdomains     distinct hosts, sorted
 * @param totalSizeBytes sum of compressed record lengths
 * @param statusCodes    HTTP status to record count
 * @param mimeTypes      MIME type to record count
 * @param sampleSize     maximum number of records requested
 * @param complete       false if the sample limit was reached, so the domain may have more captures
 */
public record DomainStats(
        String domain,
        String snapshotId,
        int totalPages,
        int uniqueSubdomains,
        List<String> subdomains,
        long totalSizeBytes,
        Map<Integer, Integer> statusCodes,
        Map<String, Integer> mimeTypes,
        int sampleSize,
        boolean complete
) {
}
