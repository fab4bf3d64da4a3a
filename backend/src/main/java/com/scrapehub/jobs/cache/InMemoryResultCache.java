package com.scrapehub.jobs.cache;

import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryResultCache implements ResultCache {
    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryResultCache() {
        this(Clock.systemUTC());
    }

    InMemoryResultCache(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Cache key must not be blank");
        }
        if (value == null) {
            entries.remove(key);
            return;
        }
        Instant expiresAt = ttl == null || ttl.isZero() || ttl.isNegative() ? null : clock.instant().plus(ttl);
        entries.put(key, new Entry(value, expiresAt));
    }

    @Override
    public Optional<String> get(String key) {
        if (key == null) {
            return Optional.empty();
        }
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    @Override
    public void delete(String key) {
        if (key != null) {
            entries.remove(key);
        }
    }

    int size() {
        return entries.size();
    }

    private record Entry(String value, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return expiresAt != null && !expiresAt.isAfter(now);
        }
    }
}
