package org.netpreserve.archivescope.report;

import java.util.List;
import java.util.Map;

/**
 * Internal link structure of a domain sample.
 *
 * @param nodes    sampled URLs
 * @param edges    every internal link found, including links to URLs outside {@code nodes}
 * @param hubPages nodes ranked by inbound link count
 * @param pagerank score of each node, summing to 1 over {@code nodes}
 */
public record LinkGraph(
        String domain,
        String snapshotId,
        int pagesAnalyzed,
        int pagesAttempted,
        List<String> nodes,
        List<Edge> edges,
        List<Hub> hubPages,
        Map<String, Double> pagerank
) {
    public record Edge(String source, String target) {
    }

    public record Hub(String url, int inboundLinks) {
    }

    static LinkGraph empty(String domain, String snapshotId) {
        return new LinkGraph(domain, snapshotId, 0, 0, List.of(), List.of(), List.of(), Map.of());
    }
}
