package org.netpreserve.archivescope.index;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.archivescope.util.RequestGate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse.BodyHandlers;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.*;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Client for a CDX index server such as {@code https://index.commoncrawl.org}.
 * All requests pass through a shared {@link RequestGate}.
 */
public class IndexClient {
    private static final Logger log = LoggerFactory.getLogger(IndexClient.class);
    private static final String USER_AGENT = "archivescope/0.1 (+https://github.com/iipc)";
    private final HttpClient httpClient;
    private final String baseUrl;
    private final RequestGate gate;
    private final Duration timeout;
    private final int maxResults;
    private final int pageSize;
    private final Clock clock;
    private final ObjectMapper mapper = new ObjectMapper();

    public IndexClient(HttpClient httpClient, URI baseUri, RequestGate gate, Duration timeout, int maxResults,
                       int pageSize) {
        this(httpClient, baseUri, gate, timeout, maxResults, pageSize, Clock.systemUTC());
    }

    public IndexClient(HttpClient httpClient, URI baseUri, RequestGate gate, Duration timeout, int maxResults,
                       int pageSize, Clock clock) {
        this.httpClient = httpClient;
        this.baseUrl = baseUri.toString().replaceAll("/+$", "");
        this.gate = gate;
        this.timeout = timeout;
        this.maxResults = maxResults;
        this.pageSize = pageSize;
        this.clock = clock;
    }

    /**
     * Lists the snapshots published by the index server. Returns an empty list if the
     * listing can't be retrieved.
     */
    public List<CrawlSnapshot> listSnapshots() {
        JsonNode root;
        try {
            root = mapper.readTree(get(URI.create(baseUrl + "/collinfo.json")));
        } catch (IndexQueryException | JsonProcessingException e) {
            log.error("Error listing snapshots: {}", e.getMessage());
            return List.of();
        }
        if (!root.isArray()) {
            log.warn("Unexpected collection listing: {}", root.getNodeType());
            return List.of();
        }
        var today = LocalDate.now(clock);
        var snapshots = new ArrayList<CrawlSnapshot>();
        for (JsonNode node : root) {
            String id = node.path("id").asText("");
            if (id.isBlank()) {
                log.warn("Skipping collection without id: {}", node);
                continue;
            }
            snapshots.add(new CrawlSnapshot(id, node.path("name").asText(id),
                    CrawlSnapshot.dateFromId(id, today), SnapshotStatus.COMPLETE,
                    node.hasNonNull("cdx-api") ? node.get("cdx-api").asText() : null));
        }
        log.info("Retrieved {} snapshots from {}", snapshots.size(), baseUrl);
        return snapshots;
    }

    /**
     * The snapshot with the greatest decoded date. Among equal dates the first listed wins.
     */
    public Optional<CrawlSnapshot> latestSnapshot() {
        CrawlSnapshot latest = null;
        for (var snapshot : listSnapshots()) {
            if (latest == null || snapshot.date().isAfter(latest.date())) {
                latest = snapshot;
            }
        }
        return Optional.ofNullable(latest);
    }

    /**
     * Queries one snapshot's index.
     *
     * @param query      URL or URL pattern
     * @param snapshotId snapshot to query, or null for the latest
     * @param limit      maximum number of records, capped at the configured maximum
     * @param matchType  how the server should match the query
     * @return matching records, empty if nothing matched or the request failed
     */
    public List<IndexRecord> search(String query, @Nullable String snapshotId, int limit, MatchType matchType) {
        if (snapshotId == null) {
            var latest = latestSnapshot();
            if (latest.isEmpty()) {
                log.warn("No snapshots available to search for {}", query);
                return List.of();
            }
            snapshotId = latest.get().id();
        }
        int effectiveLimit = Math.min(limit, maxResults);
        if (effectiveLimit <= 0) return List.of();

        var params = new LinkedHashMap<String, String>();
        params.put("url", query);
        params.put("output", "json");
        params.put("limit", Integer.toString(effectiveLimit));
        if (matchType != MatchType.EXACT) {
            params.put("matchType", matchType.parameter());
        }

        String body;
        try {
            body = get(indexUri(snapshotId, params));
        } catch (IndexQueryException e) {
            if (e.statusCode() == 404) {
                log.debug("No captures of {} in {}", query, snapshotId);
            } else {
                log.error("Error searching {} for {}: {}", snapshotId, query, e.getMessage());
            }
            return List.of();
        }
        var records = parseLines(body);
        if (records.size() > effectiveLimit) {
            records = records.subList(0, effectiveLimit);
        }
        log.info("Found {} index records for {} in {}", records.size(), query, snapshotId);
        return records;
    }

    /**
     * Lazily pages through every capture under a domain. Each call issues a fresh sequence of
     * requests starting from page 0. The stream ends at the first empty or failed page or
     * once {@code limit} records have been produced.
     */
    public Stream<IndexRecord> streamDomain(String domain, String snapshotId, @Nullable Integer limit) {
        var pager = new DomainPager(domain, snapshotId, limit);
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(pager,
                Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    private URI indexUri(String snapshotId, Map<String, String> params) {
        var builder = new StringBuilder(baseUrl).append('/').append(snapshotId).append("-index?");
        boolean first = true;
        for (var entry : params.entrySet()) {
            if (!first) builder.append('&');
            builder.append(entry.getKey()).append('=')
                    .append(URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8));
            first = false;
        }
        return URI.create(builder.toString());
    }

    private String get(URI uri) throws IndexQueryException {
        var request = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("User-Agent", USER_AGENT)
                .GET()
                .build();
        try (var permit = gate.acquire()) {
            var response = httpClient.send(request, BodyHandlers.ofString(StandardCharsets.UTF_8));
            if (response.statusCode() != 200) {
                throw new IndexQueryException("HTTP " + response.statusCode() + " from " + uri,
                        response.statusCode());
            }
            return response.body();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IndexQueryException("Interrupted requesting " + uri, e);
        } catch (IOException e) {
            throw new IndexQueryException("Error requesting " + uri + ": " + e.getMessage(), e);
        }
    }

    private List<IndexRecord> parseLines(String body) {
        var records = new ArrayList<IndexRecord>();
        for (String line : body.split("\n")) {
            if (line.isBlank()) continue;
            try {
                records.add(parseLine(line));
            } catch (JsonProcessingException | IllegalArgumentException e) {
                log.warn("Skipping malformed index line: {} ({})", line, e.getMessage());
            }
        }
        return records;
    }

    /**
     * Parses one line of {@code output=json}. Accepts the object form emitted by pywb
     * ({@code {"url": ..., "offset": ...}}) and the 9-field array form
     * {@code [urlkey, timestamp, url, mime, status, digest, length, offset, filename]}.
     *
     * @throws IllegalArgumentException if a required field is missing or not numeric
     */
    IndexRecord parseLine(String line) throws JsonProcessingException {
        JsonNode node = mapper.readTree(line);
        if (node.isArray()) {
            if (node.size() < 9) throw new IllegalArgumentException("expected 9 fields, got " + node.size());
            return new IndexRecord(
                    text(node.get(2)),
                    text(node.get(3)),
                    Integer.parseInt(text(node.get(4))),
                    text(node.get(5)),
                    text(node.get(1)),
                    Long.parseLong(text(node.get(6))),
                    Long.parseLong(text(node.get(7))),
                    text(node.get(8)));
        } else if (node.isObject()) {
            return new IndexRecord(
                    required(node, "url"),
                    node.path("mime").asText(""),
                    Integer.parseInt(required(node, "status")),
                    node.path("digest").asText(""),
                    required(node, "timestamp"),
                    Long.parseLong(required(node, "length")),
                    Long.parseLong(required(node, "offset")),
                    required(node, "filename"));
        }
        throw new IllegalArgumentException("expected array or object");
    }

    private static String required(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) throw new IllegalArgumentException("missing " + field);
        return value.asText();
    }

    private static String text(JsonNode value) {
        if (value == null || value.isNull()) throw new IllegalArgumentException("missing field");
        return value.asText();
    }

    private class DomainPager implements Iterator<IndexRecord> {
        private final String domain;
        private final String snapshotId;
        private final Integer limit;
        private Iterator<IndexRecord> buffer = Collections.emptyIterator();
        private int page;
        private int produced;
        private boolean exhausted;

        DomainPager(String domain, String snapshotId, Integer limit) {
            this.domain = domain;
            this.snapshotId = snapshotId;
            this.limit = limit;
        }

        @Override
        public boolean hasNext() {
            if (limit != null && produced >= limit) return false;
            while (!buffer.hasNext() && !exhausted) {
                fetchPage();
            }
            return buffer.hasNext();
        }

        @Override
        public IndexRecord next() {
            if (!hasNext()) throw new NoSuchElementException();
            produced++;
            return buffer.next();
        }

        private void fetchPage() {
            var params = new LinkedHashMap<String, String>();
            params.put("url", domain);
            params.put("output", "json");
            params.put("matchType", MatchType.DOMAIN.parameter());
            params.put("limit", Integer.toString(pageSize));
            params.put("page", Integer.toString(page));
            List<IndexRecord> records;
            try {
                records = parseLines(get(indexUri(snapshotId, params)));
            } catch (IndexQueryException e) {
                if (e.statusCode() != 404) {
                    log.error("Error fetching page {} of {} in {}: {}", page, domain, snapshotId, e.getMessage());
                }
                exhausted = true;
                return;
            }
            log.debug("Page {} of {} in {}: {} records", page, domain, snapshotId, records.size());
            if (records.isEmpty()) {
                exhausted = true;
                return;
            }
            buffer = records.iterator();
            page++;
        }
    }
}
