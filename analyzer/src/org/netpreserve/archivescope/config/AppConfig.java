package org.netpreserve.archivescope.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Root configuration. The built-in {@code defaults.yaml} is merged with the user's file so
 * a user file only needs the settings it changes.
 *
 * @param cache       tiered cache
 * @param index       CDX index server
 * @param store       object store holding segment files
 * @param rateLimit   limits shared by all remote requests
 * @param redis       optional shared cache tier
 * @param aggregation report computation
 */
public record AppConfig(
        CacheConfig cache,
        IndexConfig index,
        StoreConfig store,
        RateLimitConfig rateLimit,
        RedisConfig redis,
        AggregationConfig aggregation
) {
    public static ObjectMapper yamlMapper() {
        return new ObjectMapper(new YAMLFactory())
                .findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    /**
     * Loads the defaults, overlays {@code file} if given and validates the result.
     */
    public static AppConfig load(@Nullable Path file) throws ConfigException {
        var mapper = yamlMapper();
        JsonNode tree;
        try (InputStream defaults = Objects.requireNonNull(AppConfig.class.getResourceAsStream("defaults.yaml"),
                "missing defaults.yaml")) {
            tree = mapper.readTree(defaults);
        } catch (IOException e) {
            throw new ConfigException("Unable to read built-in defaults", e);
        }
        if (file != null) {
            if (!Files.exists(file)) throw new ConfigException("Config file not found: " + file);
            try {
                tree = deepMerge(tree, mapper.readTree(file.toFile()));
            } catch (IOException e) {
                throw new ConfigException("Unable to parse " + file + ": " + e.getMessage(), e);
            }
        }
        AppConfig config;
        try {
            config = mapper.treeToValue(tree, AppConfig.class);
        } catch (IOException e) {
            throw new ConfigException("Invalid configuration: " + e.getMessage(), e);
        }
        config.validate();
        return config;
    }

    static JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (override == null || override.isMissingNode() || override.isNull()) return base;
        if (!base.isObject() || !override.isObject()) {
            // scalars and arrays are replaced wholesale
            return override;
        }
        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            JsonNode baseValue = merged.get(entry.getKey());
            merged.set(entry.getKey(), baseValue == null ? entry.getValue() : deepMerge(baseValue, entry.getValue()));
        });
        return merged;
    }

    /**
     * Rejects settings that would make the cache, clients or reports misbehave.
     */
    public void validate() throws ConfigException {
        var problems = new ArrayList<String>();
        if (cache == null || index == null || store == null || rateLimit == null || redis == null
            || aggregation == null) {
            throw new ConfigException("Incomplete configuration: " + this);
        }
        check(problems, cache.directory() != null && !cache.directory().isBlank(), "cache.directory is required");
        check(problems, cache.maxSize() > 0, "cache.maxSize must be positive");
        check(problems, cache.memoryMaxBytes() >= 0, "cache.memoryMaxBytes must not be negative");
        check(problems, cache.memoryMaxEntries() >= 0, "cache.memoryMaxEntries must not be negative");
        check(problems, isPositive(cache.defaultTtl()), "cache.defaultTtl must be positive");
        check(problems, index.baseUrl() != null, "index.baseUrl is required");
        check(problems, isPositive(index.timeout()), "index.timeout must be positive");
        check(problems, index.maxResults() >= 1, "index.maxResults must be at least 1");
        check(problems, index.pageSize() >= 1, "index.pageSize must be at least 1");
        check(problems, store.bucket() != null && !store.bucket().isBlank(), "store.bucket is required");
        check(problems, store.region() != null && !store.region().isBlank(), "store.region is required");
        check(problems, isPositive(store.timeout()), "store.timeout must be positive");
        check(problems, store.costPerGb() >= 0, "store.costPerGb must not be negative");
        check(problems, rateLimit.maxConcurrent() >= 1, "rateLimit.maxConcurrent must be at least 1");
        check(problems, rateLimit.requestsPerSecond() > 0, "rateLimit.requestsPerSecond must be positive");
        if (redis.enabled()) {
            check(problems, redis.url() != null && !redis.url().isBlank(), "redis.url is required when enabled");
            check(problems, isPositive(redis.ttl()), "redis.ttl must be positive");
        }
        check(problems, aggregation.concurrency() >= 1, "aggregation.concurrency must be at least 1");
        check(problems, aggregation.timelineConcurrency() >= 1, "aggregation.timelineConcurrency must be at least 1");
        check(problems, aggregation.timelineSample() >= 1, "aggregation.timelineSample must be at least 1");
        check(problems, isPositive(aggregation.reportTtl()), "aggregation.reportTtl must be positive");
        check(problems, aggregation.pagerankIterations() >= 1, "aggregation.pagerankIterations must be at least 1");
        check(problems, aggregation.damping() > 0 && aggregation.damping() < 1,
                "aggregation.damping must be between 0 and 1");
        check(problems, aggregation.hubPages() >= 1, "aggregation.hubPages must be at least 1");
        if (!problems.isEmpty()) {
            throw new ConfigException("Invalid configuration: " + String.join("; ", problems));
        }
    }

    private static void check(List<String> problems, boolean ok, String message) {
        if (!ok) problems.add(message);
    }

    private static boolean isPositive(Duration duration) {
        return duration != null && !duration.isNegative() && !duration.isZero();
    }
}
