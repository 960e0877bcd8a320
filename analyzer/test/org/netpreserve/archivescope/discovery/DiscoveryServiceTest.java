package org.netpreserve.archivescope.discovery;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.netpreserve.archivescope.cache.CacheManager;
import org.netpreserve.archivescope.config.CacheConfig;
import org.netpreserve.archivescope.index.CrawlSnapshot;
import org.netpreserve.archivescope.index.IndexClient;
import org.netpreserve.archivescope.index.IndexRecord;
import org.netpreserve.archivescope.index.MatchType;
import org.netpreserve.archivescope.index.SnapshotStatus;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class DiscoveryServiceTest {
    private static final CrawlSnapshot MARCH = new CrawlSnapshot("CC-MAIN-2024-10", "March 2024",
            LocalDate.of(2024, 3, 4), SnapshotStatus.COMPLETE, "https://index.commoncrawl.org/CC-MAIN-2024-10-index");
    private static final CrawlSnapshot APRIL = new CrawlSnapshot("CC-MAIN-2024-18", "April 2024",
            LocalDate.of(2024, 4, 29), SnapshotStatus.COMPLETE, "https://index.commoncrawl.org/CC-MAIN-2024-18-index");
    @TempDir
    Path dir;
    private final IndexClient index = mock(IndexClient.class);
    private CacheManager cache;
    private DiscoveryService discovery;

    @BeforeEach
    public void setUp() throws IOException {
        cache = CacheManager.open(new CacheConfig(dir.toString(), 10_000_000, 1_000_000, 100, Duration.ofHours(1)),
                null);
        discovery = new DiscoveryService(index, cache);
    }

    @AfterEach
    public void tearDown() {
        cache.close();
    }

    private static IndexRecord record(String url, int status, String mimeType, long length) {
        return new IndexRecord(url, mimeType, status, "sha1:X", "20240301000000", length, 0, "seg.warc.gz");
    }

    @Test
    public void snapshotListingIsCachedUnlessEmpty() {
        when(index.listSnapshots()).thenReturn(List.of());
        assertEquals(List.of(), discovery.listSnapshots());
        assertTrue(discovery.latestSnapshot().isEmpty());
        assertTrue(discovery.resolveSnapshot(null).isEmpty());
        verify(index, times(3)).listSnapshots();

        when(index.listSnapshots()).thenReturn(List.of(APRIL, MARCH));
        assertEquals(List.of(APRIL, MARCH), discovery.listSnapshots());
        assertEquals(List.of(APRIL, MARCH), discovery.listSnapshots());
        assertEquals(APRIL, discovery.latestSnapshot().orElseThrow());
        assertEquals("CC-MAIN-2024-18", discovery.resolveSnapshot(null).orElseThrow());
        assertEquals("CC-MAIN-2024-10", discovery.resolveSnapshot("CC-MAIN-2024-10").orElseThrow());
        verify(index, times(4)).listSnapshots();
    }

    @Test
    public void searchResultsAreCachedPerQuery() {
        var records = List.of(record("https://example.com/", 200, "text/html", 100));
        when(index.search("example.com/*", "CC-MAIN-2024-10", 10, MatchType.PREFIX)).thenReturn(records);

        var result = discovery.search("example.com/*", "CC-MAIN-2024-10", 10, MatchType.PREFIX);
        assertEquals(1, result.count());
        assertEquals("CC-MAIN-2024-10", result.snapshotId());
        assertEquals(result, discovery.search("example.com/*", "CC-MAIN-2024-10", 10, MatchType.PREFIX));
        verify(index, times(1)).search("example.com/*", "CC-MAIN-2024-10", 10, MatchType.PREFIX);

        assertEquals(0, discovery.search("example.com/*", "CC-MAIN-2024-10", 20, MatchType.PREFIX).count());
    }

    @Test
    public void domainStatsSummariseIndexRecords() {
        when(index.search("example.com", "CC-MAIN-2024-10", 5, MatchType.DOMAIN)).thenReturn(List.of(
                record("https://example.com/", 200, "text/html", 1000),
                record("https://www.example.com/a", 200, "text/html", 500),
                record("https://Blog.Example.com/b", 404, "text/html", 200),
                record("https://example.com/logo.png", 200, "image/png", 300)));

        var stats = discovery.domainStats("example.com", "CC-MAIN-2024-10", 5).orElseThrow();
        assertEquals(4, stats.totalPages());
        assertEquals(List.of("blog.example.com", "example.com", "www.example.com"), stats.subdomains());
        assertEquals(3, stats.uniqueSubdomains());
        assertEquals(2000, stats.totalSizeBytes());
        assertEquals(Map.of(200, 3, 404, 1), stats.statusCodes());
        assertEquals(Map.of("text/html", 3, "image/png", 1), stats.mimeTypes());
        assertTrue(stats.complete());

        assertEquals(stats, discovery.domainStats("example.com", "CC-MAIN-2024-10", 5).orElseThrow());
        verify(index, times(1)).search("example.com", "CC-MAIN-2024-10", 5, MatchType.DOMAIN);
    }

    @Test
    public void comparesPageCountsBetweenSnapshots() {
        when(index.search("example.com", "CC-MAIN-2024-10", 100, MatchType.DOMAIN)).thenReturn(List.of(
                record("https://example.com/", 200, "text/html", 1),
                record("https://example.com/a", 200, "text/html", 1),
                record("https://example.com/b", 200, "text/html", 1)));
        when(index.search("example.com", "CC-MAIN-2024-18", 100, MatchType.DOMAIN)).thenReturn(List.of(
                record("https://example.com/", 200, "text/html", 1),
                record("https://example.com/a", 200, "text/html", 1),
                record("https://example.com/b", 200, "text/html", 1),
                record("https://example.com/c", 200, "text/html", 1)));

        var comparison = discovery.compareSnapshots("example.com", "CC-MAIN-2024-10", "CC-MAIN-2024-18", 100);
        assertEquals(3, comparison.first().pages());
        assertEquals(4, comparison.second().pages());
        assertEquals(1, comparison.change());
        assertEquals(33.33, comparison.changePercent());
        assertEquals(SnapshotComparison.Trend.GROWING, comparison.trend());

        var reversed = discovery.compareSnapshots("example.com", "CC-MAIN-2024-18", "CC-MAIN-2024-10", 100);
        assertEquals(-25.0, reversed.changePercent());
        assertEquals(SnapshotComparison.Trend.SHRINKING, reversed.trend());

        var nothing = discovery.compareSnapshots("nothing.example", "CC-MAIN-2024-10", "CC-MAIN-2024-18", 100);
        assertEquals(0.0, nothing.changePercent());
        assertEquals(SnapshotComparison.Trend.STABLE, nothing.trend());
    }

    @Test
    public void hostFallsBackForUnparseableUrls() {
        assertEquals("example.com", DiscoveryService.host("https://Example.com/path"));
        assertEquals("example.com", DiscoveryService.host("http://example.com/a b|c"));
    }
}
