package org.netpreserve.archivescope.fetch;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.archivescope.cache.CacheKeys;
import org.netpreserve.archivescope.cache.CacheManager;
import org.netpreserve.archivescope.index.CrawlSnapshot;
import org.netpreserve.archivescope.index.IndexClient;
import org.netpreserve.archivescope.index.IndexRecord;
import org.netpreserve.archivescope.index.MatchType;
import org.netpreserve.archivescope.record.ArchiveRecord;
import org.netpreserve.archivescope.record.HttpPayload;
import org.netpreserve.archivescope.record.RecordParser;
import org.netpreserve.archivescope.store.S3ObjectClient;
import org.netpreserve.archivescope.util.BoundedFanOut;
import org.netpreserve.archivescope.util.Gzip;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.zip.GZIPInputStream;

/**
 * Fetches archived pages: index lookup, ranged segment download, record location and HTTP
 * reconstruction. Pages are cached for a day under {@code page:{url}:{snapshotId}}.
 * <p>
 * Not-found at any stage yields an empty result. Object store failures other than
 * not-found propagate as {@link org.netpreserve.archivescope.store.ObjectStoreException}.
 */
public class PageFetcher implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PageFetcher.class);
    static final Duration PAGE_TTL = Duration.ofHours(24);
    private static final Pattern CHARSET = Pattern.compile("(?i)charset\\s*=\\s*\"?([\\w.:-]+)");
    private final IndexClient index;
    private final S3ObjectClient store;
    private final RecordParser parser;
    private final CacheManager cache;
    private final BoundedFanOut fanOut = new BoundedFanOut("fetch");

    public PageFetcher(IndexClient index, S3ObjectClient store, RecordParser parser, CacheManager cache) {
        this.index = index;
        this.store = store;
        this.parser = parser;
        this.cache = cache;
    }

    /**
     * Fetches the capture an index record points at.
     */
    public Optional<FetchedPage> fetch(IndexRecord capture, String snapshotId) {
        String key = CacheKeys.of("page", capture.url(), snapshotId);
        var cached = cache.getJson(key, FetchedPage.class);
        if (cached.isPresent()) return cached;
        return download(capture, snapshotId, key);
    }

    /**
     * Looks {@code url} up with an exact index query and fetches the first capture.
     *
     * @param snapshotId snapshot to fetch from, or null for the latest
     */
    public Optional<FetchedPage> fetch(String url, @Nullable String snapshotId) {
        if (snapshotId == null) {
            snapshotId = latestSnapshotId().orElse(null);
            if (snapshotId == null) return Optional.empty();
        }
        String key = CacheKeys.of("page", url, snapshotId);
        var cached = cache.getJson(key, FetchedPage.class);
        if (cached.isPresent()) return cached;

        var captures = index.search(url, snapshotId, 1, MatchType.EXACT);
        if (captures.isEmpty()) {
            log.debug("{} not found in {}", url, snapshotId);
            return Optional.empty();
        }
        return download(captures.get(0), snapshotId, key);
    }

    /**
     * Fetches several URLs, at most {@code maxConcurrent} at a time. A URL that fails doesn't
     * affect the others.
     */
    public BatchFetchResult batchFetch(List<String> urls, @Nullable String snapshotId, int maxConcurrent) {
        String snapshot = snapshotId != null ? snapshotId : latestSnapshotId().orElse(null);
        if (snapshot == null) {
            return new BatchFetchResult(urls.size(), 0, urls.size(), Map.of(), List.copyOf(urls));
        }
        var batch = fanOut.run(urls, maxConcurrent, url -> fetch(url, snapshot));
        log.info("Batch fetch from {}: {} of {} pages fetched", snapshot, batch.succeeded(), batch.attempted());
        return new BatchFetchResult(batch.attempted(), batch.succeeded(), batch.failures().size(),
                batch.results(), batch.failures());
    }

    /**
     * Describes the raw response record for {@code url} without decoding its payload.
     */
    public Optional<RecordSummary> fetchRecord(String url, @Nullable String snapshotId) {
        if (snapshotId == null) {
            snapshotId = latestSnapshotId().orElse(null);
            if (snapshotId == null) return Optional.empty();
        }
        var captures = index.search(url, snapshotId, 1, MatchType.EXACT);
        if (captures.isEmpty()) return Optional.empty();
        IndexRecord capture = captures.get(0);
        var record = locate(capture);
        if (record.isEmpty()) return Optional.empty();
        ArchiveRecord r = record.get();
        return Optional.of(new RecordSummary(url, snapshotId, r.recordId(), r.recordType(), r.contentType(),
                r.contentLength(), r.date(), r.httpHeaders(), r.payload().length, capture.segmentFilename(),
                capture.offset(), capture.length()));
    }

    private Optional<FetchedPage> download(IndexRecord capture, String snapshotId, String key) {
        var record = locate(capture);
        if (record.isEmpty()) return Optional.empty();
        var http = parser.toHttpResponse(record.get());
        if (http.isEmpty()) {
            log.warn("Record for {} in {} is not an HTTP response", capture.url(), capture.segmentFilename());
            return Optional.empty();
        }
        HttpPayload payload = http.get();
        var page = new FetchedPage(capture.url(), snapshotId, payload.statusCode(), payload.headers(),
                decodeBody(payload), capture.mimeType(), capture.captureTimestamp(), capture.length(),
                payload.statusAssumed());
        cache.setJson(key, page, PAGE_TTL);
        log.atInfo().addKeyValue("url", capture.url())
                .addKeyValue("status", page.statusCode())
                .addKeyValue("bytes", capture.length())
                .log("Fetched page");
        return Optional.of(page);
    }

    private Optional<ArchiveRecord> locate(IndexRecord capture) {
        var bytes = store.downloadRange(capture.segmentFilename(), capture.offset(), capture.lastByte());
        if (bytes.isEmpty()) {
            log.warn("Segment {} missing for {}", capture.segmentFilename(), capture.url());
            return Optional.empty();
        }
        var record = parser.locateResponse(bytes.get(), capture.url());
        if (record.isEmpty()) {
            log.warn("No response record for {} in {} at offset {}", capture.url(), capture.segmentFilename(),
                    capture.offset());
        }
        return record;
    }

    private Optional<String> latestSnapshotId() {
        var latest = index.latestSnapshot();
        if (latest.isEmpty()) log.warn("No snapshots available");
        return latest.map(CrawlSnapshot::id);
    }

    static String decodeBody(HttpPayload payload) {
        byte[] body = payload.body();
        if (Gzip.isGzip(body)) {
            try (var in = new GZIPInputStream(new ByteArrayInputStream(body))) {
                body = in.readAllBytes();
            } catch (IOException e) {
                log.debug("Body looks gzipped but doesn't decompress: {}", e.getMessage());
            }
        }
        return new String(body, charset(payload.header("content-type")));
    }

    static Charset charset(@Nullable String contentType) {
        if (contentType != null) {
            Matcher matcher = CHARSET.matcher(contentType);
            if (matcher.find()) {
                try {
                    return Charset.forName(matcher.group(1));
                } catch (IllegalArgumentException e) {
                    log.debug("Unknown charset {}, using UTF-8", matcher.group(1));
                }
            }
        }
        return StandardCharsets.UTF_8;
    }

    @Override
    public void close() {
        fanOut.close();
    }
}
