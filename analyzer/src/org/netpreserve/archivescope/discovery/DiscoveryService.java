package org.netpreserve.archivescope.discovery;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.archivescope.cache.CacheKeys;
import org.netpreserve.archivescope.cache.CacheManager;
import org.netpreserve.archivescope.index.CrawlSnapshot;
import org.netpreserve.archivescope.index.IndexClient;
import org.netpreserve.archivescope.index.IndexRecord;
import org.netpreserve.archivescope.index.MatchType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.*;

/**
 * Cached index queries: the snapshot listing, searches, per-domain statistics and
 * snapshot-to-snapshot comparisons. Empty answers aren't cached.
 */
public class DiscoveryService {
    private static final Logger log = LoggerFactory.getLogger(DiscoveryService.class);
    static final Duration SNAPSHOTS_TTL = Duration.ofHours(24);
    static final Duration SEARCH_TTL = Duration.ofHours(1);
    static final Duration DOMAIN_STATS_TTL = Duration.ofHours(6);
    static final Duration COMPARISON_TTL = Duration.ofHours(24);
    private final IndexClient index;
    private final CacheManager cache;

    public DiscoveryService(IndexClient index, CacheManager cache) {
        this.index = index;
        this.cache = cache;
    }

    public List<CrawlSnapshot> listSnapshots() {
        String key = CacheKeys.of("snapshots");
        var cached = cache.getJson(key, SnapshotList.class);
        if (cached.isPresent()) return cached.get().snapshots();
        var snapshots = index.listSnapshots();
        if (!snapshots.isEmpty()) {
            cache.setJson(key, new SnapshotList(snapshots), SNAPSHOTS_TTL);
        }
        return snapshots;
    }

    /**
     * The snapshot with the greatest date in the cached listing; the first listed wins a tie.
     */
    public Optional<CrawlSnapshot> latestSnapshot() {
        CrawlSnapshot latest = null;
        for (var snapshot : listSnapshots()) {
            if (latest == null || snapshot.date().isAfter(latest.date())) latest = snapshot;
        }
        return Optional.ofNullable(latest);
    }

    /**
     * @param snapshotId the given id, or the latest snapshot's when null
     * @return empty if no id was given and no snapshot is listed
     */
    public Optional<String> resolveSnapshot(@Nullable String snapshotId) {
        if (snapshotId != null) return Optional.of(snapshotId);
        return latestSnapshot().map(CrawlSnapshot::id);
    }

    public SearchResult search(String query, @Nullable String snapshotId, int limit, MatchType matchType) {
        var snapshot = resolveSnapshot(snapshotId);
        if (snapshot.isEmpty()) {
            log.warn("No snapshots available to search for {}", query);
            return new SearchResult(query, null, matchType, 0, List.of());
        }
        String key = CacheKeys.of("search", snapshot.get(), query, limit, matchType.parameter());
        var cached = cache.getJson(key, SearchResult.class);
        if (cached.isPresent()) return cached.get();
        var records = index.search(query, snapshot.get(), limit, matchType);
        var result = new SearchResult(query, snapshot.get(), matchType, records.size(), records);
        if (!records.isEmpty()) cache.setJson(key, result, SEARCH_TTL);
        return result;
    }

    public Optional<DomainStats> domainStats(String domain, @Nullable String snapshotId, int sampleSize) {
        var snapshot = resolveSnapshot(snapshotId);
        if (snapshot.isEmpty()) return Optional.empty();
        String key = CacheKeys.of("domain_stats", snapshot.get(), domain, sampleSize);
        var cached = cache.getJson(key, DomainStats.class);
        if (cached.isPresent()) return cached;

        var records = index.search(domain, snapshot.get(), sampleSize, MatchType.DOMAIN);
        var stats = summarize(domain, snapshot.get(), records, sampleSize);
        if (!records.isEmpty()) cache.setJson(key, stats, DOMAIN_STATS_TTL);
        log.info("Domain stats for {} in {}: {} pages on {} hosts", domain, snapshot.get(), stats.totalPages(),
                stats.uniqueSubdomains());
        return Optional.of(stats);
    }

    public SnapshotComparison compareSnapshots(String domain, String firstSnapshotId, String secondSnapshotId,
                                               int sampleSize) {
        String key = CacheKeys.of("compare", domain, firstSnapshotId, secondSnapshotId, sampleSize);
        var cached = cache.getJson(key, SnapshotComparison.class);
        if (cached.isPresent()) return cached.get();

        int firstPages = domainStats(domain, firstSnapshotId, sampleSize).map(DomainStats::totalPages).orElse(0);
        int secondPages = domainStats(domain, secondSnapshotId, sampleSize).map(DomainStats::totalPages).orElse(0);
        int change = secondPages - firstPages;
        double percent = firstPages > 0 ? Math.round(change * 10000.0 / firstPages) / 100.0 : 0;
        var comparison = new SnapshotComparison(domain,
                new SnapshotComparison.SnapshotPages(firstSnapshotId, firstPages),
                new SnapshotComparison.SnapshotPages(secondSnapshotId, secondPages),
                change, percent, SnapshotComparison.Trend.of(change));
        if (firstPages > 0 || secondPages > 0) cache.setJson(key, comparison, COMPARISON_TTL);
        return comparison;
    }

    static DomainStats summarize(String domain, String snapshotId, List<IndexRecord> records, int sampleSize) {
        var hosts = new TreeSet<String>();
        var statusCodes = new TreeMap<Integer, Integer>();
        var mimeTypes = new LinkedHashMap<String, Integer>();
        long totalSize = 0;
        for (IndexRecord record : records) {
            hosts.add(host(record.url()));
            totalSize += record.length();
            statusCodes.merge(record.statusCode(), 1, Integer::sum);
            mimeTypes.merge(record.mimeType(), 1, Integer::sum);
        }
        return new DomainStats(domain, snapshotId, records.size(), hosts.size(), List.copyOf(hosts), totalSize,
                statusCodes, mimeTypes, sampleSize, records.size() < sampleSize);
    }

    static String host(String url) {
        try {
            String host = URI.create(url).getHost();
            if (host != null) return host.toLowerCase(Locale.ROOT);
        } catch (IllegalArgumentException e) {
            log.debug("Unparseable URL {}", url);
        }
        int schemeEnd = url.indexOf("://");
        String rest = schemeEnd >= 0 ? url.substring(schemeEnd + 3) : url;
        int slash = rest.indexOf('/');
        return (slash >= 0 ? rest.substring(0, slash) : rest).toLowerCase(Locale.ROOT);
    }
}
