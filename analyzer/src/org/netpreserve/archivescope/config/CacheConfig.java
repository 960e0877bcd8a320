package org.netpreserve.archivescope.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.netpreserve.archivescope.util.ByteSizeDeserializer;
import org.netpreserve.archivescope.util.DurationDeserializer;

import java.time.Duration;

/**
 * Tiered cache settings.
 *
 * @param directory        root of the persistent tier
 * @param maxSize          persisted size above which least recently used entries are evicted
 * @param memoryMaxBytes   byte bound of the in-process tier
 * @param memoryMaxEntries entry bound of the in-process tier
 * @param defaultTtl       time to live for writes that don't specify one
 */
public record CacheConfig(
        String directory,
        @JsonDeserialize(using = ByteSizeDeserializer.class)
        long maxSize,
        @JsonDeserialize(using = ByteSizeDeserializer.class)
        long memoryMaxBytes,
        int memoryMaxEntries,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration defaultTtl
) {
}
