package org.netpreserve.archivescope.index;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.netpreserve.archivescope.util.RequestGate;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class IndexClientTest {
    private HttpServer httpServer;
    private IndexClient client;
    private final List<Map<String, String>> requests = new CopyOnWriteArrayList<>();
    private final Map<String, String> pages = new HashMap<>();
    private String collinfo = "[]";

    @BeforeEach
    void setUp() throws IOException {
        httpServer = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        httpServer.createContext("/", this::handle);
        httpServer.start();
        var clock = Clock.fixed(Instant.parse("2025-06-15T00:00:00Z"), ZoneOffset.UTC);
        client = new IndexClient(HttpClient.newHttpClient(),
                URI.create("http://127.0.0.1:" + httpServer.getAddress().getPort() + "/"),
                new RequestGate(5, 1000), Duration.ofSeconds(5), 1000, 2, clock);
    }

    @AfterEach
    void tearDown() {
        httpServer.stop(0);
    }

    private void handle(HttpExchange exchange) throws IOException {
        String path = exchange.getRequestURI().getPath();
        var params = parseQuery(exchange.getRequestURI().getRawQuery());
        params.put("path", path);
        requests.add(params);
        String body;
        int status = 200;
        if (path.equals("/collinfo.json")) {
            body = collinfo;
        } else {
            body = pages.get(params.getOrDefault("page", "0") + ":" + params.get("url"));
            if (body == null) {
                status = 404;
                body = "No Captures found for: " + params.get("url");
            }
        }
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
        exchange.getResponseBody().write(bytes);
        exchange.close();
    }

    private static Map<String, String> parseQuery(String query) {
        var params = new LinkedHashMap<String, String>();
        if (query == null) return params;
        for (String pair : query.split("&")) {
            int eq = pair.indexOf('=');
            params.put(URLDecoder.decode(pair.substring(0, eq), StandardCharsets.UTF_8),
                    URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8));
        }
        return params;
    }

    private static String line(String url, String timestamp, String offset) {
        return "{\"urlkey\": \"com,example)/\", \"timestamp\": \"" + timestamp + "\", \"url\": \"" + url +
               "\", \"mime\": \"text/html\", \"status\": \"200\", \"digest\": \"SHA1\", \"length\": \"1234\"," +
               " \"offset\": \"" + offset + "\", \"filename\": \"crawl-data/seg.warc.gz\"}\n";
    }

    @Test
    public void testListSnapshots() {
        collinfo = """
                [{"id": "CC-MAIN-2024-10", "name": "March 2024 Index", "cdx-api": "https://index.commoncrawl.org/CC-MAIN-2024-10-index"},
                 {"id": "CC-MAIN-2024-18", "name": "April 2024 Index"},
                 {"id": "CC-MAIN-2012", "name": "Legacy"},
                 {"id": "weird", "name": "Odd one"},
                 {"name": "no id"}]
                """;
        var snapshots = client.listSnapshots();
        assertEquals(4, snapshots.size());
        assertEquals(LocalDate.of(2024, 3, 4), snapshots.get(0).date());
        assertEquals(SnapshotStatus.COMPLETE, snapshots.get(0).status());
        assertEquals("https://index.commoncrawl.org/CC-MAIN-2024-10-index", snapshots.get(0).cdxApi());
        assertEquals(LocalDate.of(2012, 1, 1), snapshots.get(2).date());
        assertEquals(LocalDate.of(2025, 6, 15), snapshots.get(3).date(), "unparseable ids decode to now");

        // "weird" decodes to today, which is later than every real snapshot
        assertEquals("weird", client.latestSnapshot().orElseThrow().id());
    }

    @Test
    public void testLatestSnapshotOfEmptyListing() {
        assertTrue(client.latestSnapshot().isEmpty());
        assertTrue(client.search("example.com", null, 10, MatchType.EXACT).isEmpty());
    }

    @Test
    public void testSearch() {
        pages.put("0:example.com", line("http://example.com/", "20240301000000", "100") +
                                   "this is not json\n" +
                                   "{\"url\": \"http://example.com/x\", \"status\": \"-\"}\n" +
                                   line("http://example.com/a", "20240302000000", "200"));
        var records = client.search("example.com", "CC-MAIN-2024-10", 50, MatchType.DOMAIN);
        assertEquals(2, records.size());
        var first = records.get(0);
        assertEquals("http://example.com/", first.url());
        assertEquals(200, first.statusCode());
        assertEquals(100, first.offset());
        assertEquals(1234, first.length());
        assertEquals(1333, first.lastByte());
        assertEquals("crawl-data/seg.warc.gz", first.segmentFilename());

        var request = requests.get(0);
        assertEquals("/CC-MAIN-2024-10-index", request.get("path"));
        assertEquals("json", request.get("output"));
        assertEquals("domain", request.get("matchType"));
        assertEquals("50", request.get("limit"));
    }

    @Test
    public void testSearchExactOmitsMatchTypeAndCapsLimit() {
        pages.put("0:http://example.com/", line("http://example.com/", "20240301000000", "0"));
        var records = client.search("http://example.com/", "CC-MAIN-2024-10", 5000, MatchType.EXACT);
        assertEquals(1, records.size());
        assertFalse(requests.get(0).containsKey("matchType"));
        assertEquals("1000", requests.get(0).get("limit"));
    }

    @Test
    public void testSearchArrayFormat() throws Exception {
        var record = client.parseLine("[\"com,example)/\", \"20240301000000\", \"http://example.com/\", \"text/html\"," +
                                      " \"301\", \"DIGEST\", \"500\", \"42\", \"seg.warc.gz\"]");
        assertEquals("http://example.com/", record.url());
        assertEquals(301, record.statusCode());
        assertEquals(42, record.offset());
        assertEquals("20240301000000", record.captureTimestamp());
        assertThrows(IllegalArgumentException.class, () -> client.parseLine("[\"too\", \"short\"]"));
    }

    @Test
    public void testSearchNoCaptures() {
        assertTrue(client.search("nothing.test", "CC-MAIN-2024-10", 10, MatchType.EXACT).isEmpty());
    }

    @Test
    public void testStreamDomainPagesUntilEmpty() {
        pages.put("0:example.com", line("http://example.com/1", "20240301000000", "1") +
                                   line("http://example.com/2", "20240301000000", "2"));
        pages.put("1:example.com", line("http://example.com/3", "20240301000000", "3"));
        pages.put("2:example.com", "");

        List<String> urls;
        try (var stream = client.streamDomain("example.com", "CC-MAIN-2024-10", null)) {
            urls = stream.map(IndexRecord::url).toList();
        }
        assertEquals(List.of("http://example.com/1", "http://example.com/2", "http://example.com/3"), urls);
        assertEquals(3, requests.size());
        assertEquals("2", requests.get(0).get("limit"));
        assertEquals("domain", requests.get(0).get("matchType"));
        assertEquals("2", requests.get(2).get("page"));
    }

    @Test
    public void testStreamDomainStopsAtLimit() {
        pages.put("0:example.com", line("http://example.com/1", "20240301000000", "1") +
                                   line("http://example.com/2", "20240301000000", "2"));
        pages.put("1:example.com", line("http://example.com/3", "20240301000000", "3"));

        assertEquals(2, client.streamDomain("example.com", "CC-MAIN-2024-10", 2).count());
        assertEquals(1, requests.size(), "no request beyond the limit");

        requests.clear();
        assertEquals(3, client.streamDomain("example.com", "CC-MAIN-2024-10", 10).count(),
                "missing page ends the stream");
        assertEquals(3, requests.size());
    }
}
