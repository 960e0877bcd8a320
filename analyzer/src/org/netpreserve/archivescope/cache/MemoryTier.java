package org.netpreserve.archivescope.cache;

import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Bounded in-process LRU tier. Both the entry count and the total value size are bounded;
 * values larger than the byte bound are not kept at all.
 */
class MemoryTier {
    private final int maxEntries;
    private final long maxBytes;
    private final LinkedHashMap<String, Entry> entries = new LinkedHashMap<>(16, 0.75f, true);
    private long bytes;

    private record Entry(byte[] value, Instant expiresAt) {
    }

    MemoryTier(int maxEntries, long maxBytes) {
        this.maxEntries = maxEntries;
        this.maxBytes = maxBytes;
    }

    synchronized Optional<byte[]> get(String key, Instant now) {
        Entry entry = entries.get(key);
        if (entry == null) return Optional.empty();
        if (!now.isBefore(entry.expiresAt())) {
            remove(key);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    synchronized void put(String key, byte[] value, Instant expiresAt) {
        remove(key);
        if (maxEntries == 0 || value.length > maxBytes) return;
        entries.put(key, new Entry(value, expiresAt));
        bytes += value.length;
        Iterator<Map.Entry<String, Entry>> eldest = entries.entrySet().iterator();
        while ((entries.size() > maxEntries || bytes > maxBytes) && eldest.hasNext()) {
            bytes -= eldest.next().getValue().value().length;
            eldest.remove();
        }
    }

    synchronized void remove(String key) {
        Entry removed = entries.remove(key);
        if (removed != null) bytes -= removed.value().length;
    }

    synchronized void clear() {
        entries.clear();
        bytes = 0;
    }

    synchronized int size() {
        return entries.size();
    }

    synchronized long bytes() {
        return bytes;
    }
}
