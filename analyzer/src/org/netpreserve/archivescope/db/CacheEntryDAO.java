package org.netpreserve.archivescope.db;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.BindMethods;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.List;
import java.util.Optional;

@RegisterConstructorMapper(CacheEntry.class)
public interface CacheEntryDAO {
    @SqlQuery("SELECT * FROM cache_metadata WHERE key_hash = ?")
    Optional<CacheEntry> find(String keyHash);

    @SqlUpdate("""
            INSERT INTO cache_metadata (key_hash, filename, size_bytes, created_at, last_accessed_at, access_count, ttl_seconds)
            VALUES (:keyHash, :filename, :sizeBytes, :createdAt, :lastAccessedAt, :accessCount, :ttlSeconds)
            ON CONFLICT (key_hash) DO UPDATE SET
                filename = excluded.filename,
                size_bytes = excluded.size_bytes,
                created_at = excluded.created_at,
                last_accessed_at = excluded.last_accessed_at,
                access_count = excluded.access_count,
                ttl_seconds = excluded.ttl_seconds
            """)
    void upsert(@BindMethods CacheEntry entry);

    @SqlUpdate("UPDATE cache_metadata SET last_accessed_at = :now, access_count = access_count + 1 WHERE key_hash = :keyHash")
    void touch(String keyHash, long now);

    @SqlUpdate("DELETE FROM cache_metadata WHERE key_hash = ?")
    int delete(String keyHash);

    @SqlUpdate("DELETE FROM cache_metadata")
    int deleteAll();

    @SqlQuery("SELECT COUNT(*) FROM cache_metadata")
    long count();

    @SqlQuery("SELECT COALESCE(SUM(size_bytes), 0) FROM cache_metadata")
    long totalSize();

    @SqlQuery("SELECT * FROM cache_metadata ORDER BY last_accessed_at, key_hash LIMIT ?")
    List<CacheEntry> leastRecentlyAccessed(int limit);
}
