package org.netpreserve.archivescope.report;

import org.netpreserve.archivescope.analysis.LinkExtractor;
import org.netpreserve.archivescope.analysis.Technology;
import org.netpreserve.archivescope.analysis.TechnologyDetector;
import org.netpreserve.archivescope.analysis.TextExtractor;
import org.netpreserve.archivescope.cache.CacheKeys;
import org.netpreserve.archivescope.cache.CacheManager;
import org.netpreserve.archivescope.config.AggregationConfig;
import org.netpreserve.archivescope.fetch.FetchedPage;
import org.netpreserve.archivescope.fetch.PageFetcher;
import org.netpreserve.archivescope.index.IndexClient;
import org.netpreserve.archivescope.index.IndexRecord;
import org.netpreserve.archivescope.util.BoundedFanOut;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.*;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Domain-level reports computed over a sample of a domain's captures.
 * <p>
 * Every report follows the same steps: enumerate the domain's captures, keep the latest
 * capture of each URL in first-seen order up to the sample size, fetch and analyse the pages
 * with bounded concurrency, then fold the successful results. Pages that fail are logged and
 * counted but never abort a report. Finished reports are cached for the configured report
 * time to live under a key made of all their inputs; reports with no analysed pages are not
 * cached.
 */
public class AggregationEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AggregationEngine.class);
    static final List<String> SECURITY_HEADERS = List.of(
            "strict-transport-security",
            "content-security-policy",
            "x-frame-options",
            "x-content-type-options",
            "referrer-policy",
            "permissions-policy",
            "x-xss-protection");
    static final List<String> ESSENTIAL_HEADERS = SECURITY_HEADERS.subList(0, 4);
    static final String NO_DATA = "No data available for analysis";
    private final IndexClient index;
    private final PageFetcher fetcher;
    private final CacheManager cache;
    private final TechnologyDetector technologyDetector;
    private final LinkExtractor linkExtractor;
    private final TextExtractor textExtractor;
    private final AggregationConfig config;
    private final BoundedFanOut fanOut = new BoundedFanOut("aggregate");

    public AggregationEngine(IndexClient index, PageFetcher fetcher, CacheManager cache,
                             TechnologyDetector technologyDetector, LinkExtractor linkExtractor,
                             TextExtractor textExtractor, AggregationConfig config) {
        this.index = index;
        this.fetcher = fetcher;
        this.cache = cache;
        this.technologyDetector = technologyDetector;
        this.linkExtractor = linkExtractor;
        this.textExtractor = textExtractor;
        this.config = config;
    }

    public TechnologyReport technologyReport(String domain, String snapshotId, int sampleSize) {
        String key = CacheKeys.of("technology_report", snapshotId, domain, sampleSize);
        var cached = cache.getJson(key, TechnologyReport.class);
        if (cached.isPresent()) {
            log.info("Returning cached technology report for {}", domain);
            return cached.get();
        }
        var candidates = candidates(domain, snapshotId, sampleSize);
        if (candidates.isEmpty()) {
            log.warn("No pages found for {} in {}", domain, snapshotId);
            return TechnologyReport.empty(domain, snapshotId);
        }

        var batch = analyzePages(candidates, snapshotId, config.concurrency(), technologyDetector::detect);
        var counts = new LinkedHashMap<String, Integer>();
        var categories = new LinkedHashMap<String, Map<String, Integer>>();
        for (List<Technology> detected : batch.results().values()) {
            for (Technology technology : new LinkedHashSet<>(detected)) {
                counts.merge(technology.name(), 1, Integer::sum);
                categories.computeIfAbsent(technology.category(), category -> new LinkedHashMap<>())
                        .merge(technology.name(), 1, Integer::sum);
            }
        }
        var technologies = byCountDescending(counts);
        var adoption = new LinkedHashMap<String, Double>();
        int analyzed = batch.succeeded();
        technologies.forEach((name, count) -> adoption.put(name, round(100.0 * count / analyzed, 2)));

        var report = new TechnologyReport(domain, snapshotId, analyzed, batch.attempted(), technologies,
                categories, adoption);
        log.info("Technology report for {}: {} technologies on {}/{} pages", domain, technologies.size(),
                analyzed, batch.attempted());
        return store(key, report, analyzed);
    }

    /**
     * Builds the internal link graph of a domain sample. With {@code depth > 1} each further
     * level fetches link targets that aren't nodes yet, until the node count reaches
     * {@code sampleSize}.
     */
    public LinkGraph linkGraph(String domain, String snapshotId, int sampleSize, int depth) {
        if (depth < 1) throw new IllegalArgumentException("depth must be at least 1");
        String key = CacheKeys.of("link_graph", snapshotId, domain, sampleSize, depth);
        var cached = cache.getJson(key, LinkGraph.class);
        if (cached.isPresent()) {
            log.info("Returning cached link graph for {}", domain);
            return cached.get();
        }
        var candidates = candidates(domain, snapshotId, sampleSize);
        if (candidates.isEmpty()) {
            log.warn("No pages found for {} in {}", domain, snapshotId);
            return LinkGraph.empty(domain, snapshotId);
        }

        var nodes = new LinkedHashSet<String>();
        candidates.forEach(candidate -> nodes.add(candidate.url()));
        var edges = new ArrayList<LinkGraph.Edge>();
        var batch = analyzePages(candidates, snapshotId, config.concurrency(), linkExtractor::internalLinks);
        int analyzed = batch.succeeded();
        int attempted = batch.attempted();
        addEdges(batch.results(), edges);

        var level = batch.results();
        for (int currentDepth = 2; currentDepth <= depth && nodes.size() < sampleSize; currentDepth++) {
            var frontier = new LinkedHashSet<String>();
            for (List<String> links : level.values()) {
                for (String target : links) {
                    if (nodes.size() + frontier.size() >= sampleSize) break;
                    if (!nodes.contains(target)) frontier.add(target);
                }
            }
            if (frontier.isEmpty()) break;
            log.debug("Following {} links at depth {}", frontier.size(), currentDepth);
            nodes.addAll(frontier);
            var next = fanOut.run(List.copyOf(frontier), config.concurrency(),
                    url -> fetcher.fetch(url, snapshotId).map(linkExtractor::internalLinks));
            analyzed += next.succeeded();
            attempted += next.attempted();
            addEdges(next.results(), edges);
            level = next.results();
        }

        var pagerank = PageRank.compute(nodes, edges, config.pagerankIterations(), config.damping());
        var graph = new LinkGraph(domain, snapshotId, analyzed, attempted, List.copyOf(nodes), edges,
                hubPages(nodes, edges, config.hubPages()), pagerank);
        log.info("Link graph for {}: {} nodes, {} edges", domain, nodes.size(), edges.size());
        return store(key, graph, analyzed);
    }

    public KeywordStats keywordFrequency(String domain, List<String> keywords, String snapshotId, int sampleSize,
                                         boolean caseSensitive) {
        var terms = keywords.stream().filter(keyword -> !keyword.isBlank()).distinct().toList();
        var sortedTerms = new ArrayList<>(terms);
        Collections.sort(sortedTerms);
        String key = CacheKeys.of("keyword_freq", snapshotId, domain, String.join(",", sortedTerms), sampleSize,
                caseSensitive);
        var cached = cache.getJson(key, KeywordStats.class);
        if (cached.isPresent()) {
            log.info("Returning cached keyword analysis for {}", domain);
            return cached.get();
        }
        var candidates = candidates(domain, snapshotId, sampleSize);
        if (candidates.isEmpty()) {
            log.warn("No pages found for {} in {}", domain, snapshotId);
            return tally(domain, snapshotId, terms, caseSensitive, Map.of(), 0);
        }

        var batch = analyzePages(candidates, snapshotId, config.concurrency(), textExtractor::text);
        var stats = tally(domain, snapshotId, terms, caseSensitive, batch.results(), batch.attempted());
        log.info("Keyword analysis for {}: {} keywords over {}/{} pages", domain, terms.size(),
                stats.pagesAnalyzed(), stats.pagesAttempted());
        return store(key, stats, stats.pagesAnalyzed());
    }

    /**
     * Tracks page counts, sizes and technologies over snapshots in the order given. Only the
     * first few pages of each snapshot are analysed for technologies.
     */
    public DomainTimeline evolutionTimeline(String domain, List<String> snapshotIds, int sampleSize) {
        String key = CacheKeys.of("timeline", domain, String.join(",", snapshotIds), sampleSize);
        var cached = cache.getJson(key, DomainTimeline.class);
        if (cached.isPresent()) {
            log.info("Returning cached timeline for {}", domain);
            return cached.get();
        }

        var pageCounts = new LinkedHashMap<String, Integer>();
        var sizeBytes = new LinkedHashMap<String, Long>();
        var pagesAnalyzed = new LinkedHashMap<String, Integer>();
        var pagesAttempted = new LinkedHashMap<String, Integer>();
        var technologies = new LinkedHashMap<String, List<String>>();
        int totalAnalyzed = 0;
        for (String snapshotId : snapshotIds) {
            var candidates = candidates(domain, snapshotId, sampleSize);
            pageCounts.put(snapshotId, candidates.size());
            sizeBytes.put(snapshotId, candidates.stream().mapToLong(IndexRecord::length).sum());
            var sample = candidates.subList(0, Math.min(config.timelineSample(), candidates.size()));
            var batch = analyzePages(sample, snapshotId, config.timelineConcurrency(), technologyDetector::detect);
            var names = new TreeSet<String>();
            batch.results().values().forEach(detected -> detected.forEach(technology -> names.add(technology.name())));
            technologies.put(snapshotId, List.copyOf(names));
            pagesAnalyzed.put(snapshotId, batch.succeeded());
            pagesAttempted.put(snapshotId, batch.attempted());
            totalAnalyzed += batch.succeeded();
            log.info("Snapshot {}: {} pages, {} technologies", snapshotId, candidates.size(), names.size());
        }

        var timeline = new DomainTimeline(domain, List.copyOf(snapshotIds), pageCounts, sizeBytes, pagesAnalyzed,
                pagesAttempted, technologies, changes(snapshotIds, technologies, true),
                changes(snapshotIds, technologies, false));
        return store(key, timeline, totalAnalyzed);
    }

    public HeaderReport headerAnalysis(String domain, String snapshotId, int sampleSize) {
        String key = CacheKeys.of("header_analysis", snapshotId, domain, sampleSize);
        var cached = cache.getJson(key, HeaderReport.class);
        if (cached.isPresent()) {
            log.info("Returning cached header analysis for {}", domain);
            return cached.get();
        }
        var candidates = candidates(domain, snapshotId, sampleSize);
        if (candidates.isEmpty()) {
            log.warn("No pages found for {} in {}", domain, snapshotId);
            return summarizeHeaders(domain, snapshotId, List.of(), 0);
        }
        var batch = analyzePages(candidates, snapshotId, config.concurrency(), FetchedPage::headers);
        var report = summarizeHeaders(domain, snapshotId, List.copyOf(batch.results().values()), batch.attempted());
        log.info("Header analysis for {}: score {} over {}/{} pages", domain, report.securityScore(),
                report.pagesAnalyzed(), report.pagesAttempted());
        return store(key, report, report.pagesAnalyzed());
    }

    /**
     * The latest capture of each distinct URL under {@code domain}, in first-seen order, at
     * most {@code sampleSize} of them. Paging stops at the first URL beyond the sample.
     */
    List<IndexRecord> candidates(String domain, String snapshotId, int sampleSize) {
        if (sampleSize < 1) return List.of();
        var latest = new LinkedHashMap<String, IndexRecord>();
        try (var records = index.streamDomain(domain, snapshotId, null)) {
            for (var iterator = records.iterator(); iterator.hasNext(); ) {
                IndexRecord record = iterator.next();
                IndexRecord previous = latest.get(record.url());
                if (previous == null) {
                    if (latest.size() >= sampleSize) break;
                    latest.put(record.url(), record);
                } else if (record.captureTimestamp().compareTo(previous.captureTimestamp()) > 0) {
                    latest.put(record.url(), record);
                }
            }
        }
        log.debug("{} candidate pages for {} in {}", latest.size(), domain, snapshotId);
        return List.copyOf(latest.values());
    }

    private <T> BoundedFanOut.Batch<T> analyzePages(List<IndexRecord> pages, String snapshotId, int width,
                                                    Function<FetchedPage, T> analysis) {
        var byUrl = new LinkedHashMap<String, IndexRecord>();
        pages.forEach(page -> byUrl.put(page.url(), page));
        var batch = fanOut.run(List.copyOf(byUrl.keySet()), width,
                url -> fetcher.fetch(byUrl.get(url), snapshotId).map(analysis));
        if (!batch.failures().isEmpty()) {
            log.warn("{} of {} pages could not be analysed in {}", batch.failures().size(), batch.attempted(),
                    snapshotId);
        }
        return batch;
    }

    private <R> R store(String key, R report, int pagesAnalyzed) {
        if (pagesAnalyzed > 0) {
            cache.setJson(key, report, config.reportTtl());
        }
        return report;
    }

    private static void addEdges(Map<String, List<String>> linksBySource, List<LinkGraph.Edge> edges) {
        linksBySource.forEach((source, targets) -> {
            for (String target : targets) edges.add(new LinkGraph.Edge(source, target));
        });
    }

    /**
     * Nodes with at least one inbound edge, most linked first. Equal counts keep the order in
     * which the node was first linked to.
     */
    static List<LinkGraph.Hub> hubPages(Set<String> nodes, List<LinkGraph.Edge> edges, int limit) {
        var inbound = new LinkedHashMap<String, Integer>();
        for (var edge : edges) {
            if (nodes.contains(edge.target())) inbound.merge(edge.target(), 1, Integer::sum);
        }
        return inbound.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                .limit(limit)
                .map(entry -> new LinkGraph.Hub(entry.getKey(), entry.getValue()))
                .toList();
    }

    static KeywordStats tally(String domain, String snapshotId, List<String> terms, boolean caseSensitive,
                              Map<String, String> textByUrl, int attempted) {
        int flags = caseSensitive ? 0 : Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
        var frequencies = new LinkedHashMap<String, Map<String, Integer>>();
        var totals = new LinkedHashMap<String, Integer>();
        for (String term : terms) {
            Pattern pattern = Pattern.compile("\\b" + Pattern.quote(term) + "\\b", flags);
            var perUrl = new LinkedHashMap<String, Integer>();
            int total = 0;
            for (var entry : textByUrl.entrySet()) {
                int count = 0;
                Matcher matcher = pattern.matcher(entry.getValue());
                while (matcher.find()) count++;
                if (count > 0) {
                    perUrl.put(entry.getKey(), count);
                    total += count;
                }
            }
            frequencies.put(term, perUrl);
            totals.put(term, total);
        }

        int documents = textByUrl.size();
        var tfidf = new LinkedHashMap<String, Map<String, Double>>();
        frequencies.forEach((term, perUrl) -> {
            if (perUrl.isEmpty()) return;
            double idf = Math.log((double) documents / perUrl.size());
            var scores = new LinkedHashMap<String, Double>();
            perUrl.forEach((url, count) -> scores.put(url, round(count * idf, 4)));
            tfidf.put(term, scores);
        });
        return new KeywordStats(domain, snapshotId, terms, caseSensitive, documents, attempted, frequencies, totals,
                tfidf);
    }

    /**
     * Technologies added (or removed) between each adjacent pair of snapshots, keyed by the
     * later snapshot and sorted by name.
     */
    static Map<String, List<String>> changes(List<String> snapshotIds, Map<String, List<String>> technologies,
                                             boolean added) {
        var changes = new LinkedHashMap<String, List<String>>();
        for (int i = 1; i < snapshotIds.size(); i++) {
            var before = new TreeSet<>(technologies.getOrDefault(snapshotIds.get(i - 1), List.of()));
            var after = new TreeSet<>(technologies.getOrDefault(snapshotIds.get(i), List.of()));
            if (added) {
                after.removeAll(before);
                changes.put(snapshotIds.get(i), List.copyOf(after));
            } else {
                before.removeAll(after);
                changes.put(snapshotIds.get(i), List.copyOf(before));
            }
        }
        return changes;
    }

    static HeaderReport summarizeHeaders(String domain, String snapshotId, List<Map<String, String>> headerSets,
                                         int attempted) {
        int analyzed = headerSets.size();
        if (analyzed == 0) {
            return new HeaderReport(domain, snapshotId, 0, attempted, Map.of(), Map.of(), Map.of(), 0.0,
                    List.of(NO_DATA));
        }

        var headerCounts = new HashMap<String, Integer>();
        var cachingPolicies = new LinkedHashMap<String, Integer>();
        var servers = new LinkedHashMap<String, Integer>();
        for (Map<String, String> headers : headerSets) {
            var normalized = new HashMap<String, String>();
            headers.forEach((name, value) -> normalized.put(name.toLowerCase(Locale.ROOT), value));
            for (String header : SECURITY_HEADERS) {
                if (normalized.containsKey(header)) headerCounts.merge(header, 1, Integer::sum);
            }
            String cacheControl = normalized.get("cache-control");
            if (cacheControl != null) {
                String value = cacheControl.toLowerCase(Locale.ROOT);
                String policy = value.contains("no-cache") || value.contains("no-store") ? "no-cache"
                        : value.contains("max-age") ? "max-age" : "other";
                cachingPolicies.merge(policy, 1, Integer::sum);
            }
            String server = normalized.get("server");
            if (server != null) {
                servers.merge(server.split("/", 2)[0].trim().toLowerCase(Locale.ROOT), 1, Integer::sum);
            }
        }

        var adoption = new LinkedHashMap<String, Double>();
        for (String header : SECURITY_HEADERS) {
            adoption.put(header, round(100.0 * headerCounts.getOrDefault(header, 0) / analyzed, 2));
        }
        double pointsPerHeader = 100.0 / ESSENTIAL_HEADERS.size();
        double score = 0;
        for (String header : ESSENTIAL_HEADERS) {
            score += adoption.get(header) / 100 * pointsPerHeader;
        }
        score = round(score, 2);
        return new HeaderReport(domain, snapshotId, analyzed, attempted, adoption, cachingPolicies,
                byCountDescending(servers), score, recommendations(adoption, score));
    }

    private static List<String> recommendations(Map<String, Double> adoption, double score) {
        var recommendations = new ArrayList<String>();
        if (adoption.get("strict-transport-security") < 80) {
            recommendations.add("Enable HSTS (Strict-Transport-Security) to enforce HTTPS connections");
        }
        if (adoption.get("content-security-policy") < 50) {
            recommendations.add("Implement Content-Security-Policy to prevent XSS and data injection attacks");
        }
        if (adoption.get("x-frame-options") < 80) {
            recommendations.add("Add X-Frame-Options header to prevent clickjacking attacks");
        }
        if (adoption.get("x-content-type-options") < 80) {
            recommendations.add("Set X-Content-Type-Options: nosniff to prevent MIME sniffing");
        }
        if (score >= 90) {
            recommendations.add("Excellent security header coverage");
        } else if (score >= 70) {
            recommendations.add("Good security header coverage with room for improvement");
        } else if (score >= 50) {
            recommendations.add("Moderate security header coverage, consider improvements");
        } else {
            recommendations.add("Poor security header coverage, immediate action recommended");
        }
        return recommendations;
    }

    private static Map<String, Integer> byCountDescending(Map<String, Integer> counts) {
        var sorted = new LinkedHashMap<String, Integer>();
        counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                .forEach(entry -> sorted.put(entry.getKey(), entry.getValue()));
        return sorted;
    }

    static double round(double value, int places) {
        return BigDecimal.valueOf(value).setScale(places, RoundingMode.HALF_UP).doubleValue();
    }

    @Override
    public void close() {
        fanOut.close();
    }
}
