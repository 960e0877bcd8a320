package org.netpreserve.archivescope.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.netpreserve.archivescope.util.DurationDeserializer;

import java.time.Duration;

/**
 * Optional shared cache tier.
 *
 * @param enabled   whether to use Redis at all
 * @param url       e.g. {@code redis://localhost:6379/0}
 * @param ttl       expiry for entries written without an explicit time to live
 * @param keyPrefix namespace for all keys written
 */
public record RedisConfig(
        boolean enabled,
        String url,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration ttl,
        String keyPrefix
) {
}
