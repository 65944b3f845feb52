package org.geoserve.server.geolocation;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bounded map from normalized IP address to serialized lookup result with least-recently-used eviction.
 * <p>
 * Not thread-safe: accessed only from the {@link LookupCoordinator} context.
 */
public class ResponseCache {

    public static final int DEFAULT_CAPACITY = 50_000;

    private final int capacity;
    private final LinkedHashMap<String, byte[]> entries;

    public ResponseCache(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Response cache capacity must be positive, but was: " + capacity);
        }

        this.capacity = capacity;
        this.entries = new LinkedHashMap<>(Math.min(capacity, 1024), 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, byte[]> eldest) {
                return size() > ResponseCache.this.capacity;
            }
        };
    }

    /**
     * Returns cached value or null, marking the entry as most recently used.
     */
    public byte[] get(String key) {
        return entries.get(key);
    }

    public void put(String key, byte[] value) {
        entries.put(key, value);
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    public int capacity() {
        return capacity;
    }
}
