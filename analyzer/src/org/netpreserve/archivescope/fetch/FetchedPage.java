package org.netpreserve.archivescope.fetch;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.jetbrains.annotations.Nullable;

import java.net.URI;
import java.util.Locale;
import java.util.Map;

/**
 * An archived page as reconstructed from its response record.
 *
 * @param url              the captured URL as listed in the index
 * @param snapshotId       snapshot the capture belongs to
 * @param statusCode       HTTP status of the capture
 * @param headers          HTTP response headers keyed by lower-cased name
 * @param body             entity body decoded as text
 * @param mimeType         MIME type reported by the index
 * @param captureTimestamp 14-digit capture timestamp
 * @param length           compressed record length
 * @param statusAssumed    true when the record had no status line and 200 was assumed
 */
public record FetchedPage(
        String url,
        String snapshotId,
        int statusCode,
        Map<String, String> headers,
        String body,
        String mimeType,
        String captureTimestamp,
        long length,
        boolean statusAssumed
) {
    public @Nullable String header(String name) {
        return headers.get(name.toLowerCase(Locale.ROOT));
    }

    /**
     * Lower-cased host of {@link #url()}, or null if it doesn't parse.
     */
    @JsonIgnore
    public @Nullable String host() {
        try {
            String host = URI.create(url).getHost();
            return host == null ? null : host.toLowerCase(Locale.ROOT);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
