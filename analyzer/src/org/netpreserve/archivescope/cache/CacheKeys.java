package org.netpreserve.archivescope.cache;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Maps logical cache keys to hashes and blob locations. Blobs are sharded two levels deep by
 * the first four hex characters of the hash.
 */
public final class CacheKeys {
    private CacheKeys() {
    }

    public static String hash(String key) {
        try {
            var digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(key.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }

    /**
     * Blob location relative to the cache directory, e.g. {@code ab/cd/abcd...cache}.
     */
    public static String relativeBlobPath(String hash) {
        return hash.substring(0, 2) + "/" + hash.substring(2, 4) + "/" + hash + ".cache";
    }

    public static Path blobPath(Path directory, String hash) {
        return directory.resolve(relativeBlobPath(hash));
    }

    /**
     * Joins parts into a key. Null parts are written as an empty segment so that
     * {@code (a, null)} and {@code (a, "")} collide but {@code (a, b)} and {@code (ab)} don't.
     */
    public static String of(String namespace, Object... parts) {
        var builder = new StringBuilder(namespace);
        for (Object part : parts) {
            builder.append(':').append(part == null ? "" : part);
        }
        return builder.toString();
    }
}
