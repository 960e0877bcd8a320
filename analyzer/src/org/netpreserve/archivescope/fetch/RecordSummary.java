package org.netpreserve.archivescope.fetch;

import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.Map;

/**
 * Metadata of a raw archive record, without its payload.
 */
public record RecordSummary(
        String url,
        String snapshotId,
        String recordId,
        String recordType,
        @Nullable String contentType,
        long contentLength,
        @Nullable Instant date,
        @Nullable Map<String, String> httpHeaders,
        int payloadSize,
        String segmentFilename,
        long offset,
        long length
) {
}
