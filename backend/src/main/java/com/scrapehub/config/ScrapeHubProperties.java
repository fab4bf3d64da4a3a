package com.scrapehub.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;

@ConfigurationProperties(prefix = "scrapehub")
public class ScrapeHubProperties {
    public static final String DEFAULT_TIME_ZONE = "America/New_York";
    private static final String DEFAULT_USER_AGENT = "scrape-hub/0.1 (+contact)";

    private String timeZone = DEFAULT_TIME_ZONE;
    private int workerCount = 4;
    private int triggerPoolSize = 2;
    private Reconciliation reconciliation = new Reconciliation();
    private Scraper scraper = new Scraper();
    private Cache cache = new Cache();
    private Api api = new Api();

    public String getTimeZone() {
        return normalizeZoneId(timeZone).getId();
    }

    public void setTimeZone(String timeZone) {
        this.timeZone = normalizeZoneId(timeZone).getId();
    }

    public ZoneId getZoneId() {
        return normalizeZoneId(timeZone);
    }

    public int getWorkerCount() {
        return Math.max(1, workerCount);
    }

    public void setWorkerCount(int workerCount) {
        this.workerCount = Math.max(1, workerCount);
    }

    public int getTriggerPoolSize() {
        return Math.max(1, triggerPoolSize);
    }

    public void setTriggerPoolSize(int triggerPoolSize) {
        this.triggerPoolSize = Math.max(1, triggerPoolSize);
    }

    public Reconciliation getReconciliation() {
        return reconciliation;
    }

    public void setReconciliation(Reconciliation reconciliation) {
        this.reconciliation = reconciliation;
    }

    public Scraper getScraper() {
        return scraper;
    }

    public void setScraper(Scraper scraper) {
        this.scraper = scraper;
    }

    public Cache getCache() {
        return cache;
    }

    public void setCache(Cache cache) {
        this.cache = cache;
    }

    public Api getApi() {
        return api;
    }

    public void setApi(Api api) {
        this.api = api;
    }

    public static ZoneId normalizeZoneId(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return ZoneId.of(DEFAULT_TIME_ZONE);
        }
        try {
            return ZoneId.of(candidate.trim());
        } catch (DateTimeException e) {
            return ZoneId.of(DEFAULT_TIME_ZONE);
        }
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Reconciliation {
        private boolean runOnStartup = true;
        private Integer pollIntervalSeconds = 900;

        public boolean isRunOnStartup() {
            return runOnStartup;
        }

        public void setRunOnStartup(boolean runOnStartup) {
            this.runOnStartup = runOnStartup;
        }

        /**
         * Polling interval, or {@code null} when polling is disabled and reconciliation only
         * happens at startup or on demand.
         */
        public Integer getPollIntervalSeconds() {
            return isPollingEnabled() ? pollIntervalSeconds : null;
        }

        public void setPollIntervalSeconds(Integer pollIntervalSeconds) {
            this.pollIntervalSeconds = pollIntervalSeconds;
        }

        public boolean isPollingEnabled() {
            return pollIntervalSeconds != null && pollIntervalSeconds > 0;
        }
    }

    public static class Scraper {
        private String apiUrl;
        private String apiToken;
        private String userAgent;
        private int requestTimeoutSeconds = 120;

        public String getApiUrl() {
            return apiUrl;
        }

        public void setApiUrl(String apiUrl) {
            this.apiUrl = apiUrl == null ? null : apiUrl.trim();
        }

        public String getApiToken() {
            return apiToken;
        }

        public void setApiToken(String apiToken) {
            this.apiToken = apiToken;
        }

        public String getUserAgent() {
            return normalizeUserAgent(userAgent);
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = normalizeUserAgent(userAgent);
        }

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
        }
    }

    public static class Cache {
        private String keyPrefix = "scrapingJob:";
        private Long ttlSeconds;

        public String getKeyPrefix() {
            return keyPrefix;
        }

        public void setKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix == null ? "" : keyPrefix;
        }

        public Long getTtlSeconds() {
            return ttlSeconds;
        }

        public void setTtlSeconds(Long ttlSeconds) {
            this.ttlSeconds = ttlSeconds;
        }

        /** Entry lifetime, or {@code null} when cached results never expire. */
        public Duration getTtl() {
            if (ttlSeconds == null || ttlSeconds <= 0) {
                return null;
            }
            return Duration.ofSeconds(ttlSeconds);
        }
    }

    public static class Api {
        private int defaultHistoryLimit = 20;
        private int maxHistoryLimit = 200;

        public int getDefaultHistoryLimit() {
            return Math.max(1, Math.min(defaultHistoryLimit, getMaxHistoryLimit()));
        }

        public void setDefaultHistoryLimit(int defaultHistoryLimit) {
            this.defaultHistoryLimit = defaultHistoryLimit;
        }

        public int getMaxHistoryLimit() {
            return Math.max(1, maxHistoryLimit);
        }

        public void setMaxHistoryLimit(int maxHistoryLimit) {
            this.maxHistoryLimit = maxHistoryLimit;
        }
    }
}
