package ca.purps.offlinestorage.cache;

import java.time.Clock;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import lombok.Synchronized;
import lombok.Value;

/**
 * Bounded map with a time-to-live per entry. Expired entries are dropped when read; when full,
 * inserting a new key evicts the entry that was inserted first (insertion order, not access order).
 */
public class ExpiringCache<V> {

    @Value
    private static class CacheEntry<V> {
        private final V value;
        private final long insertedAt;
    }

    private final Map<String, CacheEntry<V>> entries = new LinkedHashMap<>();
    private final int maxSize;
    private final long ttlMs;
    private final Clock clock;

    public ExpiringCache(int maxSize, long ttlMs, Clock clock) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive");
        }
        this.maxSize = maxSize;
        this.ttlMs = ttlMs;
        this.clock = clock;
    }

    @Synchronized
    public Optional<V> get(String key) {
        CacheEntry<V> entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }

        if (clock.millis() - entry.getInsertedAt() > ttlMs) {
            entries.remove(key);
            return Optional.empty();
        }

        return Optional.of(entry.getValue());
    }

    @Synchronized
    public void put(String key, V value) {
        if (entries.size() >= maxSize && !entries.containsKey(key)) {
            Iterator<String> oldest = entries.keySet().iterator();
            oldest.next();
            oldest.remove();
        }

        entries.put(key, new CacheEntry<>(value, clock.millis()));
    }

    @Synchronized
    public void remove(String key) {
        entries.remove(key);
    }

    @Synchronized
    public boolean containsKey(String key) {
        return entries.containsKey(key);
    }

    @Synchronized
    public void clear() {
        entries.clear();
    }

    @Synchronized
    public int size() {
        return entries.size();
    }

}
