package org.netpreserve.archivescope.report;

import java.util.List;
import java.util.Map;

/**
 * HTTP response header practices across a domain sample.
 *
 * @param securityHeaders adoption percentage of each security header
 * @param cachingPolicies Cache-Control classification ({@code no-cache}, {@code max-age}, {@code other}) to page count
 * @param servers         lower-cased server product name to page count
 * @param securityScore   0 to 100
 */
public record HeaderReport(
        String domain,
        String snapshotId,
        int pagesAnalyzed,
        int pagesAttempted,
        Map<String, Double> securityHeaders,
        Map<String, Integer> cachingPolicies,
        Map<String, Integer> servers,
        double securityScore,
        List<String> recommendations
) {
}
