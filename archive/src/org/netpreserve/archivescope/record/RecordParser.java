package org.netpreserve.archivescope.record;

import org.netpreserve.archivescope.util.Gzip;
import org.netpreserve.jwarc.WarcReader;
import org.netpreserve.jwarc.WarcRecord;
import org.netpreserve.jwarc.WarcResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.time.DateTimeException;
import java.util.*;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Reads archive records out of segment bytes (plain or gzipped WARC) and reconstructs
 * HTTP responses from response records. Records that fail to parse are skipped.
 */
public class RecordParser {
    private static final Logger log = LoggerFactory.getLogger(RecordParser.class);
    private static final byte[] CRLFCRLF = {'\r', '\n', '\r', '\n'};
    private static final byte[] LFLF = {'\n', '\n'};
    private final AtomicLong assumedStatusCount = new AtomicLong();
    private final AtomicLong skippedRecordCount = new AtomicLong();

    /**
     * Lazily parses every record. The returned stream is single-use.
     */
    public Stream<ArchiveRecord> parse(byte[] segmentBytes) {
        return parse(new ByteArrayInputStream(segmentBytes));
    }

    /**
     * Lazily parses every record from a stream. Closing the returned stream closes the input.
     */
    public Stream<ArchiveRecord> parse(InputStream input) {
        InputStream in;
        try {
            in = Gzip.maybeGunzip(input instanceof BufferedInputStream buffered ? buffered
                    : new BufferedInputStream(input));
        } catch (IOException e) {
            log.warn("Unable to read segment: {}", e.getMessage());
            return Stream.empty();
        }
        var records = new RecordIterator(new RecordFramer(in));
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(records,
                        Spliterator.ORDERED | Spliterator.NONNULL), false)
                .onClose(() -> {
                    try {
                        in.close();
                    } catch (IOException e) {
                        log.warn("Error closing segment stream", e);
                    }
                });
    }

    /**
     * Finds the first record whose target URI equals {@code targetUri}.
     */
    public Optional<ArchiveRecord> locate(byte[] segmentBytes, String targetUri) {
        try (var records = parse(segmentBytes)) {
            return records.filter(record -> targetUri.equals(record.targetUri())).findFirst();
        }
    }

    /**
     * Finds the response record for {@code targetUri}. Falls back to the first response record
     * when no record carries that exact URI, since an index entry's byte range holds a single
     * capture whose WARC-Target-URI may differ in normalization from the indexed URL.
     */
    public Optional<ArchiveRecord> locateResponse(byte[] segmentBytes, String targetUri) {
        ArchiveRecord firstResponse = null;
        try (var records = parse(segmentBytes)) {
            for (var iterator = records.filter(ArchiveRecord::isResponse).iterator(); iterator.hasNext(); ) {
                var record = iterator.next();
                if (targetUri.equals(record.targetUri())) return Optional.of(record);
                if (firstResponse == null) firstResponse = record;
            }
        }
        if (firstResponse != null) {
            log.debug("No response for {}, using {}", targetUri, firstResponse.targetUri());
        }
        return Optional.ofNullable(firstResponse);
    }

    /**
     * Counts records by WARC-Type in order of first appearance.
     */
    public Map<String, Long> countByType(byte[] segmentBytes) {
        try (var records = parse(segmentBytes)) {
            return records.collect(Collectors.groupingBy(ArchiveRecord::recordType, LinkedHashMap::new,
                    Collectors.counting()));
        }
    }

    /**
     * Splits a response record's block into status, headers and body. The header/body
     * boundary is the first CRLFCRLF, or failing that the first LFLF. When there's no
     * boundary the whole block is the body and status 200 is assumed.
     */
    public Optional<HttpPayload> toHttpResponse(ArchiveRecord record) {
        if (!record.isResponse() || record.payload() == null) return Optional.empty();
        var payload = splitHttp(record.payload());
        if (payload.statusAssumed()) {
            assumedStatusCount.incrementAndGet();
            log.debug("No HTTP status line in {}, assuming 200", record.targetUri());
        }
        return Optional.of(payload);
    }

    /**
     * Number of responses so far where the status was assumed rather than read.
     */
    public long assumedStatusCount() {
        return assumedStatusCount.get();
    }

    public long skippedRecordCount() {
        return skippedRecordCount.get();
    }

    static HttpPayload splitHttp(byte[] block) {
        int boundary = indexOf(block, CRLFCRLF);
        int bodyStart = boundary + CRLFCRLF.length;
        if (boundary < 0) {
            boundary = indexOf(block, LFLF);
            bodyStart = boundary + LFLF.length;
        }
        if (boundary < 0) {
            return new HttpPayload(200, Map.of(), block, true);
        }

        String head = new String(block, 0, boundary, StandardCharsets.ISO_8859_1);
        String[] lines = head.split("\r?\n");
        Integer status = parseStatusLine(lines[0]);
        var headers = new LinkedHashMap<String, String>();
        String lastName = null;
        for (int i = 1; i < lines.length; i++) {
            String line = lines[i];
            if (line.isEmpty()) continue;
            if ((line.charAt(0) == ' ' || line.charAt(0) == '\t') && lastName != null) {
                headers.merge(lastName, line.trim(), (a, b) -> a + " " + b);
                continue;
            }
            int colon = line.indexOf(':');
            if (colon <= 0) continue;
            lastName = line.substring(0, colon).trim().toLowerCase(Locale.ROOT);
            headers.merge(lastName, line.substring(colon + 1).trim(), (a, b) -> a + ", " + b);
        }
        byte[] body = Arrays.copyOfRange(block, bodyStart, block.length);
        return new HttpPayload(status == null ? 200 : status, headers, body, status == null);
    }

    private static Integer parseStatusLine(String line) {
        if (!line.startsWith("HTTP/")) return null;
        String[] parts = line.split(" ", 3);
        if (parts.length < 2) return null;
        try {
            return Integer.parseInt(parts[1].trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static int indexOf(byte[] haystack, byte[] needle) {
        outer:
        for (int i = 0; i <= haystack.length - needle.length; i++) {
            for (int j = 0; j < needle.length; j++) {
                if (haystack[i + j] != needle[j]) continue outer;
            }
            return i;
        }
        return -1;
    }

    private Optional<ArchiveRecord> decode(RecordFramer.Frame frame) {
        var bytes = new ByteArrayOutputStream(frame.header().length + frame.block().length + CRLFCRLF.length);
        bytes.writeBytes(frame.header());
        bytes.writeBytes(frame.block());
        bytes.writeBytes(CRLFCRLF);
        try (var reader = new WarcReader(new ByteArrayInputStream(bytes.toByteArray()))) {
            var next = reader.next();
            if (next.isEmpty()) return Optional.empty();
            WarcRecord record = next.get();
            var headers = record.headers();
            Map<String, String> httpHeaders = null;
            if (record instanceof WarcResponse response) {
                httpHeaders = httpHeaders(response);
            }
            return Optional.of(new ArchiveRecord(
                    headers.first("WARC-Record-ID").map(RecordParser::stripAngleBrackets).orElse(null),
                    record.type(),
                    headers.first("WARC-Target-URI").map(RecordParser::stripAngleBrackets).orElse(null),
                    record.date(),
                    headers.first("Content-Type").orElse(null),
                    frame.block().length,
                    httpHeaders,
                    frame.block()));
        } catch (IOException | IllegalArgumentException | DateTimeException | NoSuchElementException e) {
            skippedRecordCount.incrementAndGet();
            log.debug("Skipping unparseable record: {}", e.toString());
            return Optional.empty();
        }
    }

    private static Map<String, String> httpHeaders(WarcResponse response) {
        try {
            var map = new LinkedHashMap<String, String>();
            response.http().headers().map().forEach((name, values) ->
                    map.put(name.toLowerCase(Locale.ROOT), String.join(", ", values)));
            return map;
        } catch (IOException e) {
            log.debug("Response block of {} is not HTTP: {}", response.target(), e.getMessage());
            return null;
        }
    }

    private static String stripAngleBrackets(String value) {
        if (value.startsWith("<") && value.endsWith(">")) return value.substring(1, value.length() - 1);
        return value;
    }

    private class RecordIterator implements Iterator<ArchiveRecord> {
        private final RecordFramer framer;
        private ArchiveRecord next;
        private boolean done;

        RecordIterator(RecordFramer framer) {
            this.framer = framer;
        }

        @Override
        public boolean hasNext() {
            while (next == null && !done) {
                RecordFramer.Frame frame;
                try {
                    frame = framer.next();
                } catch (IOException e) {
                    log.warn("Segment ended abruptly: {}", e.getMessage());
                    frame = null;
                }
                if (frame == null) {
                    done = true;
                } else {
                    next = decode(frame).orElse(null);
                }
            }
            return next != null;
        }

        @Override
        public ArchiveRecord next() {
            if (!hasNext()) throw new NoSuchElementException();
            var record = next;
            next = null;
            return record;
        }
    }
}
