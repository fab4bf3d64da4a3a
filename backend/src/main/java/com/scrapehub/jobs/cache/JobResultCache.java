package com.scrapehub.jobs.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scrapehub.config.ScrapeHubProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Latest successful result per job, keyed {@code <prefix><jobId>}.
 */
@Service
public class JobResultCache {
    private static final Logger log = LoggerFactory.getLogger(JobResultCache.class);

    private final ResultCache cache;
    private final ObjectMapper objectMapper;
    private final ScrapeHubProperties properties;

    public JobResultCache(ResultCache cache, ObjectMapper objectMapper, ScrapeHubProperties properties) {
        this.cache = cache;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public void putLatest(String jobId, JsonNode content) {
        String serialized;
        try {
            serialized = objectMapper.writeValueAsString(content);
        } catch (JsonProcessingException e) {
            throw new CacheUnavailableException("Result for job " + jobId + " is not serializable", e);
        }
        cache.set(keyFor(jobId), serialized, properties.getCache().getTtl());
    }

    public Optional<JsonNode> getLatest(String jobId) {
        Optional<String> raw = cache.get(keyFor(jobId));
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readTree(raw.get()));
        } catch (JsonProcessingException e) {
            log.warn("Dropping malformed cache entry for job {}", jobId);
            cache.delete(keyFor(jobId));
            return Optional.empty();
        }
    }

    public void evict(String jobId) {
        cache.delete(keyFor(jobId));
    }

    String keyFor(String jobId) {
        return properties.getCache().getKeyPrefix() + jobId;
    }
}
