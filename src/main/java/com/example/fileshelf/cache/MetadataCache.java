package com.example.fileshelf.cache;

import lombok.extern.slf4j.Slf4j;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * In-memory read-through cache in front of the store, with per-entry TTL and LRU eviction.
 * <p>
 * Mutating services invalidate or rewrite the keys they touched once their database
 * transaction has committed (see {@link #afterCommit(Runnable)}). A reader racing that
 * window may see the previous value until its TTL runs out.
 */
@Slf4j
public class MetadataCache {

    private final int maxEntries;
    private final Duration defaultTtl;
    private final Clock clock;
    private final Object lock = new Object();

    // accessOrder=true so iteration starts at the least recently used key
    private final LinkedHashMap<CacheKey, CacheValue> map = new LinkedHashMap<>(128, 0.75f, true);

    public MetadataCache(int maxEntries, Duration defaultTtl, Clock clock) {
        this.maxEntries = Math.max(1, maxEntries);
        this.defaultTtl = defaultTtl;
        this.clock = clock;
    }

    /**
     * Returns the cached value for {@code key}, or loads, stores and returns it.
     * Exceptions from the loader propagate and leave the cache untouched.
     */
    public <V> V read(CacheKey key, Supplier<V> loader, Duration ttl) {
        V cached = get(key);
        if (cached != null) {
            log.debug("Cache hit {}", key);
            return cached;
        }
        log.debug("Cache miss {}", key);
        V value = loader.get();
        write(key, value, ttl);
        return value;
    }

    public <V> V read(CacheKey key, Supplier<V> loader) {
        return read(key, loader, defaultTtl);
    }

    public void write(CacheKey key, Object value, Duration ttl) {
        if (value == null) {
            return;
        }
        long expiresAt = clock.millis() + ttl.toMillis();
        synchronized (lock) {
            map.put(key, new CacheValue(value, expiresAt));
            while (map.size() > maxEntries) {
                Iterator<Map.Entry<CacheKey, CacheValue>> it = map.entrySet().iterator();
                it.next();
                it.remove();
            }
        }
    }

    public void write(CacheKey key, Object value) {
        write(key, value, defaultTtl);
    }

    public void invalidate(CacheKey... keys) {
        synchronized (lock) {
            for (CacheKey key : keys) {
                map.remove(key);
            }
        }
        if (log.isDebugEnabled()) {
            log.debug("Invalidated {}", Arrays.toString(keys));
        }
    }

    /**
     * Drops every key of the given kind and id, whatever its qualifier. Used to clear all
     * cached list variants of one owner without knowing which filters were queried.
     */
    public int invalidateAll(CacheKind kind, String id) {
        int removed = 0;
        synchronized (lock) {
            Iterator<CacheKey> it = map.keySet().iterator();
            while (it.hasNext()) {
                if (it.next().sameGroup(kind, id)) {
                    it.remove();
                    removed++;
                }
            }
        }
        log.debug("Invalidated {} key(s) in group {}:{}", removed, kind, id);
        return removed;
    }

    public void clear() {
        synchronized (lock) {
            map.clear();
        }
    }

    public boolean contains(CacheKey key) {
        return get(key) != null;
    }

    public int size() {
        synchronized (lock) {
            return map.size();
        }
    }

    /**
     * Runs {@code action} once the current Spring transaction commits, or right away when
     * no transaction is active. Nothing runs on rollback.
     */
    public void afterCommit(Runnable action) {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    action.run();
                }
            });
        } else {
            action.run();
        }
    }

    @SuppressWarnings("unchecked")
    private <V> V get(CacheKey key) {
        long now = clock.millis();
        synchronized (lock) {
            CacheValue value = map.get(key);
            if (value == null) {
                return null;
            }
            if (value.expiresAtMs <= now) {
                map.remove(key);
                return null;
            }
            return (V) value.value;
        }
    }

    private record CacheValue(Object value, long expiresAtMs) {
    }
}
