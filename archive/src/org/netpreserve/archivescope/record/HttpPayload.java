package org.netpreserve.archivescope.record;

import org.jetbrains.annotations.Nullable;

import java.util.Locale;
import java.util.Map;

/**
 * An HTTP response reconstructed from a response record's block.
 *
 * @param statusCode     HTTP status
 * @param headers        header fields keyed by lower-cased name, repeated fields joined with ", "
 * @param body           entity body as stored (not content-decoded)
 * @param statusAssumed  true when no status line could be recovered and 200 was assumed
 */
public record HttpPayload(int statusCode, Map<String, String> headers, byte[] body, boolean statusAssumed) {
    public @Nullable String header(String name) {
        return headers.get(name.toLowerCase(Locale.ROOT));
    }
}
