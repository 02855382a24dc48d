package com.skillmd.federation.cache;

import com.skillmd.federation.source.ExternalSkill;
import com.skillmd.federation.source.SourceType;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Individual skills keyed by (source, id). Ids are only unique within a
 * source, so the source is always part of the key.
 */
public class SkillCache implements AutoCloseable {

    public static final Duration DEFAULT_TTL = Duration.ofMinutes(10);

    record Key(SourceType source, String id) {}

    private final TtlCache<Key, ExternalSkill> cache;

    public SkillCache(Duration ttl, Duration sweepInterval, Clock clock) {
        this.cache = new TtlCache<>("skill-cache", ttl, sweepInterval, clock);
    }

    public SkillCache(Duration ttl, Duration sweepInterval) {
        this(ttl, sweepInterval, Clock.systemUTC());
    }

    public Optional<ExternalSkill> get(SourceType source, String id) {
        return cache.get(new Key(source, id));
    }

    public void put(SourceType source, String id, ExternalSkill skill) {
        cache.put(new Key(source, id), skill);
    }

    public void clear() {
        cache.clear();
    }

    public int size() {
        return cache.size();
    }

    @Override
    public void close() {
        cache.close();
    }
}
