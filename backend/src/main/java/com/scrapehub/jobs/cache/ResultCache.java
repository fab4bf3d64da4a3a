package com.scrapehub.jobs.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Key-value store for derived, disposable data. Implementations may drop entries at any time.
 */
public interface ResultCache {

    /**
     * @param ttl entry lifetime, or {@code null} for no expiry
     * @throws CacheUnavailableException when the backing store cannot be written
     */
    void set(String key, String value, Duration ttl);

    Optional<String> get(String key);

    void delete(String key);
}
