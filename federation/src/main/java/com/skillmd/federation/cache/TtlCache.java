package com.skillmd.federation.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory key/value store whose entries expire after a fixed TTL.
 *
 * Expiry is checked on every read, so a stale entry is a miss even if the
 * background sweep has not removed it yet. The sweep only bounds memory: it
 * runs on its own interval, is started by the constructor and stopped by
 * {@link #close()}.
 *
 * Reads take the shared lock, writes the exclusive one.
 */
public class TtlCache<K, V> implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TtlCache.class);

    private final String name;
    private final Duration defaultTtl;
    private final Clock clock;
    private final Map<K, CacheEntry<V>> entries = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final ScheduledExecutorService sweeper;

    /**
     * @param name          used for the sweeper thread name and in logs
     * @param defaultTtl    TTL applied by {@link #put(Object, Object)}
     * @param sweepInterval how often expired entries are purged;
     *                      {@link Duration#ZERO} disables the sweeper
     * @param clock         time source for expiry decisions
     */
    public TtlCache(String name, Duration defaultTtl, Duration sweepInterval, Clock clock) {
        if (defaultTtl.isNegative() || defaultTtl.isZero()) {
            throw new IllegalArgumentException("TTL must be positive: " + defaultTtl);
        }
        this.name       = name;
        this.defaultTtl = defaultTtl;
        this.clock      = clock;

        if (sweepInterval.isZero()) {
            this.sweeper = null;
        } else {
            this.sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, name + "-sweeper");
                t.setDaemon(true);
                return t;
            });
            long millis = sweepInterval.toMillis();
            sweeper.scheduleWithFixedDelay(this::sweepSafely, millis, millis, TimeUnit.MILLISECONDS);
        }
    }

    public TtlCache(String name, Duration defaultTtl, Duration sweepInterval) {
        this(name, defaultTtl, sweepInterval, Clock.systemUTC());
    }

    public Optional<V> get(K key) {
        lock.readLock().lock();
        try {
            CacheEntry<V> entry = entries.get(key);
            if (entry == null || entry.isExpired(clock.instant())) {
                return Optional.empty();
            }
            return Optional.of(entry.value());
        } finally {
            lock.readLock().unlock();
        }
    }

    public void put(K key, V value) {
        put(key, value, defaultTtl);
    }

    public void put(K key, V value, Duration ttl) {
        Instant expiresAt = clock.instant().plus(ttl);
        lock.writeLock().lock();
        try {
            entries.put(key, new CacheEntry<>(value, expiresAt));
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void remove(K key) {
        lock.writeLock().lock();
        try {
            entries.remove(key);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            entries.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Number of stored entries, including expired ones not yet swept. */
    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Remove every entry that has expired; returns how many were dropped. */
    public int removeExpired() {
        Instant now = clock.instant();
        lock.writeLock().lock();
        try {
            int before = entries.size();
            entries.values().removeIf(e -> e.isExpired(now));
            return before - entries.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void close() {
        if (sweeper != null) {
            sweeper.shutdownNow();
        }
    }

    private void sweepSafely() {
        // An exception escaping here would cancel all future sweeps.
        try {
            int removed = removeExpired();
            if (removed > 0) {
                log.debug("Cache '{}' swept {} expired entries", name, removed);
            }
        } catch (RuntimeException e) {
            log.warn("Cache '{}' sweep failed: {}", name, e.getMessage(), e);
        }
    }
}
