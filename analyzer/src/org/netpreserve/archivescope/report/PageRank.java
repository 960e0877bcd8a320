package org.netpreserve.archivescope.report;

import java.util.*;

/**
 * Damped random-surfer PageRank over a fixed number of iterations. Only edges with both
 * endpoints in the node set count towards a node's out-degree and pass on score. Pages
 * without outgoing edges leak their score, so the result is normalized to sum to 1.
 */
final class PageRank {
    private PageRank() {
    }

    static Map<String, Double> compute(Collection<String> nodes, List<LinkGraph.Edge> edges, int iterations,
                                       double damping) {
        var index = new LinkedHashMap<String, Integer>();
        for (String node : nodes) index.putIfAbsent(node, index.size());
        int n = index.size();
        var result = new LinkedHashMap<String, Double>();
        if (n == 0) return result;

        var outbound = new ArrayList<List<Integer>>(n);
        for (int i = 0; i < n; i++) outbound.add(new ArrayList<>());
        for (var edge : edges) {
            Integer source = index.get(edge.source());
            Integer target = index.get(edge.target());
            if (source != null && target != null) outbound.get(source).add(target);
        }

        double[] scores = new double[n];
        Arrays.fill(scores, 1.0 / n);
        for (int iteration = 0; iteration < iterations; iteration++) {
            double[] next = new double[n];
            Arrays.fill(next, (1 - damping) / n);
            for (int source = 0; source < n; source++) {
                var targets = outbound.get(source);
                if (targets.isEmpty()) continue;
                double share = damping * scores[source] / targets.size();
                for (int target : targets) next[target] += share;
            }
            scores = next;
        }

        double total = 0;
        for (double score : scores) total += score;
        for (var entry : index.entrySet()) {
            double score = scores[entry.getValue()];
            result.put(entry.getKey(), total > 0 ? score / total : score);
        }
        return result;
    }
}
