package org.netpreserve.archivescope.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.jdbi.v3.core.JdbiException;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.archivescope.Database;
import org.netpreserve.archivescope.config.CacheConfig;
import org.netpreserve.archivescope.db.CacheEntry;
import org.netpreserve.archivescope.db.CacheEntryDAO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.*;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/**
 * Three-tier cache: an in-process LRU, an optional shared {@link RemoteTier} and a persistent
 * tier of blob files indexed by a SQLite metadata table.
 * <p>
 * Reads check the tiers fastest first and copy a hit into every faster tier. Writes go to
 * every tier. The persistent tier enforces time to live when an entry is read and, after a
 * write pushes the total persisted size over the bound, evicts the least recently accessed
 * tenth of its entries. Blob files and metadata rows that have lost their counterpart are
 * removed when found and the read is reported as a miss.
 */
public class CacheManager implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CacheManager.class);
    private final Path directory;
    private final Database db;
    private final CacheEntryDAO entries;
    private final MemoryTier memory;
    private final @Nullable RemoteTier remote;
    private final long maxSizeBytes;
    private final Duration defaultTtl;
    private final Clock clock;
    private final ObjectMapper json = new ObjectMapper()
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();
    private final AtomicBoolean evicting = new AtomicBoolean();

    public CacheManager(Path directory, Database db, @Nullable RemoteTier remote, CacheConfig config,
                        Clock clock) throws IOException {
        this.directory = directory;
        this.db = db;
        this.entries = db.cacheEntries();
        this.memory = new MemoryTier(config.memoryMaxEntries(), config.memoryMaxBytes());
        this.remote = remote;
        this.maxSizeBytes = config.maxSize();
        this.defaultTtl = config.defaultTtl();
        this.clock = clock;
        Files.createDirectories(directory);
    }

    /**
     * Opens the cache in {@code config.directory()}, creating it if needed.
     */
    public static CacheManager open(CacheConfig config, @Nullable RemoteTier remote) throws IOException {
        Path directory = Path.of(config.directory());
        Files.createDirectories(directory);
        return new CacheManager(directory, Database.open(directory.resolve("cache_metadata.sqlite3")), remote,
                config, Clock.systemUTC());
    }

    public Optional<byte[]> get(String key) {
        Instant now = clock.instant();
        Optional<byte[]> value = memory.get(key, now);
        if (value.isPresent()) {
            hits.incrementAndGet();
            log.debug("Memory hit {}", key);
            return value;
        }

        if (remote != null) {
            try {
                value = remote.get(key);
            } catch (RemoteTierException e) {
                log.warn("Remote cache read failed for {}: {}", key, e.getMessage());
                value = Optional.empty();
            }
            if (value.isPresent()) {
                hits.incrementAndGet();
                log.debug("Remote hit {}", key);
                memory.put(key, value.get(), now.plus(remote.defaultTtl()));
                return value;
            }
        }

        var persisted = readPersisted(key, now);
        if (persisted.isPresent()) {
            hits.incrementAndGet();
            log.debug("Disk hit {}", key);
            byte[] data = persisted.get().data();
            Instant expiresAt = persisted.get().expiresAt();
            memory.put(key, data, expiresAt);
            writeRemote(key, data, Duration.between(now, expiresAt));
            return Optional.of(data);
        }

        misses.incrementAndGet();
        log.debug("Miss {}", key);
        return Optional.empty();
    }

    public void set(String key, byte[] value) {
        set(key, value, null);
    }

    /**
     * Stores a value in every tier.
     *
     * @param ttl time to live, or null for the configured default
     */
    public void set(String key, byte[] value, @Nullable Duration ttl) {
        Duration effectiveTtl = ttl == null ? defaultTtl : ttl;
        if (effectiveTtl.isNegative() || effectiveTtl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive: " + effectiveTtl);
        }
        Instant now = clock.instant();
        memory.put(key, value, now.plus(effectiveTtl));
        writeRemote(key, value, effectiveTtl);
        if (writePersisted(key, value, effectiveTtl, now)) {
            evictIfNeeded();
        }
    }

    /**
     * Reads a JSON encoded value. An entry that no longer decodes as {@code type} is dropped and
     * reported as a miss.
     */
    public <T> Optional<T> getJson(String key, Class<T> type) {
        var data = get(key);
        if (data.isEmpty()) return Optional.empty();
        try {
            return Optional.of(json.readValue(data.get(), type));
        } catch (IOException e) {
            log.warn("Dropping cache entry {} that doesn't decode as {}: {}", key, type.getSimpleName(),
                    e.getMessage());
            remove(key);
            return Optional.empty();
        }
    }

    public void setJson(String key, Object value, @Nullable Duration ttl) {
        byte[] data;
        try {
            data = json.writeValueAsBytes(value);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to encode " + value.getClass().getSimpleName(), e);
        }
        set(key, data, ttl);
    }

    private void remove(String key) {
        memory.remove(key);
        if (remote != null) {
            try {
                remote.delete(key);
            } catch (RemoteTierException e) {
                log.warn("Remote cache delete failed for {}: {}", key, e.getMessage());
            }
        }
        String hash = CacheKeys.hash(key);
        deleteEntry(hash);
        deleteBlob(CacheKeys.blobPath(directory, hash));
    }

    private void deleteEntry(String hash) {
        try {
            entries.delete(hash);
        } catch (JdbiException e) {
            log.warn("Unable to delete cache metadata {}: {}", hash, e.getMessage());
        }
    }

    private record Persisted(byte[] data, Instant expiresAt) {
    }

    private Optional<Persisted> readPersisted(String key, Instant now) {
        String hash = CacheKeys.hash(key);
        Path blob = CacheKeys.blobPath(directory, hash);
        Optional<CacheEntry> entry;
        try {
            entry = entries.find(hash);
        } catch (JdbiException e) {
            log.error("Cache metadata lookup failed for {}", key, e);
            return Optional.empty();
        }
        if (entry.isEmpty()) {
            if (Files.exists(blob)) {
                log.warn("Removing cache blob without metadata: {}", blob);
                deleteBlob(blob);
            }
            return Optional.empty();
        }
        if (entry.get().isExpired(now)) {
            log.debug("Expired {}", key);
            deleteEntry(hash);
            deleteBlob(blob);
            return Optional.empty();
        }
        byte[] data;
        try {
            data = Files.readAllBytes(blob);
        } catch (NoSuchFileException e) {
            log.warn("Removing cache metadata without blob: {}", key);
            deleteEntry(hash);
            return Optional.empty();
        } catch (IOException e) {
            log.warn("Unable to read cache blob {}: {}", blob, e.getMessage());
            return Optional.empty();
        }
        try {
            entries.touch(hash, now.toEpochMilli());
        } catch (JdbiException e) {
            log.warn("Unable to record access to {}: {}", key, e.getMessage());
        }
        return Optional.of(new Persisted(data, entry.get().expiresAt()));
    }

    private boolean writePersisted(String key, byte[] value, Duration ttl, Instant now) {
        String hash = CacheKeys.hash(key);
        String filename = CacheKeys.relativeBlobPath(hash);
        Path blob = directory.resolve(filename);
        try {
            Files.createDirectories(blob.getParent());
            Path tmp = Files.createTempFile(blob.getParent(), hash, ".tmp");
            try {
                Files.write(tmp, value);
                Files.move(tmp, blob, REPLACE_EXISTING, ATOMIC_MOVE);
            } finally {
                Files.deleteIfExists(tmp);
            }
            long nowMillis = now.toEpochMilli();
            entries.upsert(new CacheEntry(hash, filename, value.length, nowMillis, nowMillis, 0,
                    Math.max(1, ttl.toSeconds())));
            return true;
        } catch (IOException | JdbiException e) {
            log.error("Unable to persist cache entry {}", key, e);
            return false;
        }
    }

    private void writeRemote(String key, byte[] value, Duration ttl) {
        if (remote == null) return;
        try {
            remote.set(key, value, ttl);
        } catch (RemoteTierException e) {
            log.warn("Remote cache write failed for {}: {}", key, e.getMessage());
        }
    }

    /**
     * Evicts the least recently accessed 10% (at least one) of persisted entries if their
     * total size exceeds the bound. Only one eviction pass runs at a time; a write that
     * arrives during a pass doesn't start another.
     */
    void evictIfNeeded() {
        if (!evicting.compareAndSet(false, true)) return;
        try {
            long total = entries.totalSize();
            if (total <= maxSizeBytes) return;
            long count = entries.count();
            int toEvict = (int) Math.max(1, count / 10);
            List<CacheEntry> victims = entries.leastRecentlyAccessed(toEvict);
            for (CacheEntry victim : victims) {
                entries.delete(victim.keyHash());
                deleteBlob(directory.resolve(victim.filename()));
                evictions.incrementAndGet();
            }
            log.info("Evicted {} of {} cache entries, {} bytes over {} byte limit", victims.size(), count,
                    total - maxSizeBytes, maxSizeBytes);
        } catch (JdbiException e) {
            log.error("Cache eviction failed", e);
        } finally {
            evicting.set(false);
        }
    }

    private void deleteBlob(Path blob) {
        try {
            Files.deleteIfExists(blob);
        } catch (IOException e) {
            log.warn("Unable to delete cache blob {}: {}", blob, e.getMessage());
        }
    }

    /**
     * Empties every tier and resets the statistics.
     */
    public void clear() {
        memory.clear();
        if (remote != null) {
            try {
                remote.clear();
            } catch (RemoteTierException e) {
                log.warn("Remote cache clear failed: {}", e.getMessage());
            }
        }
        int rows = entries.deleteAll();
        try (Stream<Path> files = Files.walk(directory)) {
            files.sorted(Comparator.reverseOrder())
                    .filter(path -> !path.equals(directory))
                    .filter(path -> Files.isDirectory(path) || path.toString().endsWith(".cache")
                                    || path.toString().endsWith(".tmp"))
                    .forEach(this::deleteBlobOrEmptyDirectory);
        } catch (IOException e) {
            log.warn("Unable to walk cache directory {}: {}", directory, e.getMessage());
        }
        hits.set(0);
        misses.set(0);
        evictions.set(0);
        log.info("Cleared cache ({} persisted entries)", rows);
    }

    private void deleteBlobOrEmptyDirectory(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (DirectoryNotEmptyException e) {
            log.debug("Keeping non-empty directory {}", path);
        } catch (IOException e) {
            log.warn("Unable to delete {}: {}", path, e.getMessage());
        }
    }

    public CacheStats stats() {
        long hits = this.hits.get();
        long misses = this.misses.get();
        return new CacheStats(hits, misses, CacheStats.hitRatePercent(hits, misses), evictions.get(),
                entries.count(), entries.totalSize(), maxSizeBytes, memory.size());
    }

    public Path directory() {
        return directory;
    }

    @Override
    public void close() {
        if (remote != null) {
            try {
                remote.close();
            } catch (Exception e) {
                log.error("Failed to close remote cache tier", e);
            }
        }
        try {
            db.close();
        } catch (Exception e) {
            log.error("Failed to close cache metadata database", e);
        }
    }
}
