package com.scrapehub.jobs.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scrapehub.jobs.model.ExecutionRecord;
import com.scrapehub.jobs.model.JobDefinition;
import com.scrapehub.jobs.model.JobUpsertRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public class JdbcJobStore implements JobStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcJobStore.class);

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    public JdbcJobStore(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<JobDefinition> listJobs() {
        try {
            return jdbc.query(
                """
                    SELECT id, user_id, href, selector, description, cron_schedule
                    FROM scraping_jobs
                    ORDER BY created_at ASC, id ASC
                    """,
                new MapSqlParameterSource(),
                this::mapJob
            );
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to list scraping jobs", e);
        }
    }

    @Override
    public Optional<JobDefinition> getJob(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        try {
            List<JobDefinition> rows = jdbc.query(
                """
                    SELECT id, user_id, href, selector, description, cron_schedule
                    FROM scraping_jobs
                    WHERE id = :id
                    """,
                new MapSqlParameterSource().addValue("id", id),
                this::mapJob
            );
            return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to load scraping job " + id, e);
        }
    }

    public List<JobDefinition> listJobsByUser(String userId) {
        try {
            return jdbc.query(
                """
                    SELECT id, user_id, href, selector, description, cron_schedule
                    FROM scraping_jobs
                    WHERE user_id = :userId
                    ORDER BY created_at ASC, id ASC
                    """,
                new MapSqlParameterSource().addValue("userId", userId),
                this::mapJob
            );
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to list scraping jobs for user " + userId, e);
        }
    }

    public JobDefinition createJob(JobUpsertRequest request) {
        String id = UUID.randomUUID().toString();
        Instant now = Instant.now();
        MapSqlParameterSource params = jobParams(request)
            .addValue("id", id)
            .addValue("now", Timestamp.from(now));
        try {
            jdbc.update(
                """
                    INSERT INTO scraping_jobs (id, user_id, href, selector, description, cron_schedule, created_at, updated_at)
                    VALUES (:id, :userId, :href, :selector, :description, :cronSchedule, :now, :now)
                    """,
                params
            );
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to create scraping job", e);
        }
        return new JobDefinition(
            id,
            request.userId(),
            request.href(),
            request.selector(),
            request.description(),
            request.cronSchedule()
        );
    }

    public Optional<JobDefinition> updateJob(String id, JobUpsertRequest request) {
        MapSqlParameterSource params = jobParams(request)
            .addValue("id", id)
            .addValue("now", Timestamp.from(Instant.now()));
        int updated;
        try {
            updated = jdbc.update(
                """
                    UPDATE scraping_jobs
                    SET user_id = :userId,
                        href = :href,
                        selector = :selector,
                        description = :description,
                        cron_schedule = :cronSchedule,
                        updated_at = :now
                    WHERE id = :id
                    """,
                params
            );
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to update scraping job " + id, e);
        }
        if (updated == 0) {
            return Optional.empty();
        }
        return Optional.of(new JobDefinition(
            id,
            request.userId(),
            request.href(),
            request.selector(),
            request.description(),
            request.cronSchedule()
        ));
    }

    public boolean deleteJob(String id) {
        try {
            return jdbc.update(
                """
                    DELETE FROM scraping_jobs
                    WHERE id = :id
                    """,
                new MapSqlParameterSource().addValue("id", id)
            ) > 0;
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to delete scraping job " + id, e);
        }
    }

    @Override
    public String appendHistory(String jobId, Instant startedAt, Instant endedAt, boolean successful, JsonNode content) {
        String id = UUID.randomUUID().toString();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("jobId", jobId)
            .addValue("startedAt", Timestamp.from(startedAt))
            .addValue("endedAt", Timestamp.from(endedAt))
            .addValue("successful", successful)
            .addValue("content", writeContent(content))
            .addValue("now", Timestamp.from(Instant.now()));
        try {
            jdbc.update(
                """
                    INSERT INTO scraping_job_histories (id, scraping_job_id, started_at, ended_at, successful, content, created_at)
                    VALUES (:id, :jobId, :startedAt, :endedAt, :successful, :content, :now)
                    """,
                params
            );
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to append history for scraping job " + jobId, e);
        }
        return id;
    }

    /** Newest first; overlapping runs are ordered by their timestamps. */
    public List<ExecutionRecord> findHistory(String jobId, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("limit", Math.max(1, limit));
        try {
            return jdbc.query(
                """
                    SELECT id, scraping_job_id, started_at, ended_at, successful, content
                    FROM scraping_job_histories
                    WHERE scraping_job_id = :jobId
                    ORDER BY started_at DESC, ended_at DESC, id DESC
                    LIMIT :limit
                    """,
                params,
                historyMapper()
            );
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to load history for scraping job " + jobId, e);
        }
    }

    public Optional<ExecutionRecord> findLatestSuccessfulHistory(String jobId) {
        try {
            List<ExecutionRecord> rows = jdbc.query(
                """
                    SELECT id, scraping_job_id, started_at, ended_at, successful, content
                    FROM scraping_job_histories
                    WHERE scraping_job_id = :jobId
                      AND successful = TRUE
                    ORDER BY ended_at DESC, started_at DESC, id DESC
                    LIMIT 1
                    """,
                new MapSqlParameterSource().addValue("jobId", jobId),
                historyMapper()
            );
            return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to load latest result for scraping job " + jobId, e);
        }
    }

    long countHistory(String jobId) {
        try {
            Long value = jdbc.queryForObject(
                """
                    SELECT COUNT(*)
                    FROM scraping_job_histories
                    WHERE scraping_job_id = :jobId
                    """,
                new MapSqlParameterSource().addValue("jobId", jobId),
                Long.class
            );
            return value == null ? 0L : value;
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to count history for scraping job " + jobId, e);
        }
    }

    private MapSqlParameterSource jobParams(JobUpsertRequest request) {
        return new MapSqlParameterSource()
            .addValue("userId", trimToNull(request.userId()))
            .addValue("href", request.href().trim())
            .addValue("selector", request.selector().trim())
            .addValue("description", trimToNull(request.description()))
            .addValue("cronSchedule", request.cronSchedule().trim());
    }

    private JobDefinition mapJob(ResultSet rs, int rowNum) throws SQLException {
        String id = rs.getString("id");
        if (id == null || id.isBlank()) {
            throw new StoreMalformedResponseException("scraping_jobs row " + rowNum + " has no id");
        }
        return new JobDefinition(
            id,
            rs.getString("user_id"),
            rs.getString("href"),
            rs.getString("selector"),
            rs.getString("description"),
            rs.getString("cron_schedule")
        );
    }

    private RowMapper<ExecutionRecord> historyMapper() {
        return (rs, rowNum) -> {
            String id = rs.getString("id");
            return new ExecutionRecord(
                id,
                rs.getString("scraping_job_id"),
                toInstant(rs.getTimestamp("started_at")),
                toInstant(rs.getTimestamp("ended_at")),
                rs.getBoolean("successful"),
                readContent(id, rs.getString("content"))
            );
        };
    }

    private String writeContent(JsonNode content) {
        if (content == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(content);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("History content is not serializable", e);
        }
    }

    private JsonNode readContent(String recordId, String raw) {
        if (raw == null) {
            return null;
        }
        try {
            return objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse stored content for history record {}", recordId);
            return null;
        }
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    private static String trimToNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }
}
