package org.netpreserve.archivescope.record;

import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.Map;

/**
 * One framed record from a segment file.
 *
 * @param recordId      WARC-Record-ID without angle brackets
 * @param recordType    WARC-Type, e.g. {@code response}, {@code request}, {@code metadata}
 * @param targetUri     WARC-Target-URI, null for records without a target
 * @param date          WARC-Date
 * @param contentType   Content-Type of the record block
 * @param contentLength length of the record block
 * @param httpHeaders   lower-cased HTTP response headers, present for response records
 *                      whose block parses as HTTP
 * @param payload       the raw record block
 */
public record ArchiveRecord(
        String recordId,
        String recordType,
        @Nullable String targetUri,
        @Nullable Instant date,
        @Nullable String contentType,
        long contentLength,
        @Nullable Map<String, String> httpHeaders,
        byte[] payload
) {
    public boolean isResponse() {
        return "response".equals(recordType);
    }
}
