package com.baleen.corpus.ingest.persistence;

import com.baleen.corpus.ingest.model.ExtractionStatus;
import com.baleen.corpus.ingest.model.FeedOutcome;
import com.baleen.corpus.ingest.model.FeedOutcomeStatus;
import com.baleen.corpus.ingest.model.FeedRecord;
import com.baleen.corpus.ingest.model.FeedRegistration;
import com.baleen.corpus.ingest.model.FeedStatus;
import com.baleen.corpus.ingest.model.IngestionJob;
import com.baleen.corpus.ingest.model.JobStatus;
import com.baleen.corpus.ingest.model.JobTotals;
import com.baleen.corpus.ingest.model.PostDraft;
import com.baleen.corpus.ingest.model.PostRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * JDBC access to feeds, posts and ingestion jobs. Unique-key conflicts surface as normal results,
 * connectivity failures as {@link StorageUnavailableException}; anything else propagates.
 */
@Repository
public class IngestJdbcRepository {
    private static final Logger log = LoggerFactory.getLogger(IngestJdbcRepository.class);
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
    private static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<>() {};
    private static final int FEED_ID_BATCH = 500;

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    public IngestJdbcRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    public boolean isDbReachable() {
        try {
            Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
            return value != null && value == 1;
        } catch (RuntimeException e) {
            log.warn("Database connectivity check failed: {}", e.getMessage());
            return false;
        }
    }

    public Map<String, Long> tableCounts() {
        return storage("tableCounts", () -> {
            Map<String, Long> counts = new LinkedHashMap<>();
            counts.put("feeds", countTable("feeds"));
            counts.put("posts", countTable("posts"));
            counts.put("ingestion_jobs", countTable("ingestion_jobs"));
            counts.put("ingestion_job_outcomes", countTable("ingestion_job_outcomes"));
            return counts;
        });
    }

    public long countTable(String tableName) {
        Long count = jdbc.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM " + tableName, Long.class);
        return count == null ? 0L : count;
    }

    // ---- feeds ----

    public long upsertFeed(FeedRegistration registration, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("url", registration.url())
            .addValue("title", registration.title(), Types.VARCHAR)
            .addValue("htmlUrl", registration.htmlUrl(), Types.VARCHAR)
            .addValue("categories", registration.categories().isEmpty() ? null : toJson(new TreeSet<>(registration.categories())), Types.VARCHAR)
            .addValue("extensions", registration.extensions().isEmpty() ? null : toJson(new TreeMap<>(registration.extensions())), Types.VARCHAR)
            .addValue("now", toTimestamp(now));

        return storage("upsertFeed", () -> {
            int updated = updateFeedRegistration(params);
            if (updated == 0) {
                try {
                    jdbc.update(
                        """
                            INSERT INTO feeds (url, title, html_url, categories, extensions, status, consecutive_errors, created_at, updated_at)
                            VALUES (:url, :title, :htmlUrl, :categories, :extensions, 'ACTIVE', 0, :now, :now)
                            """,
                        params
                    );
                } catch (DuplicateKeyException e) {
                    updateFeedRegistration(params);
                }
            }
            Long id = jdbc.queryForObject(
                """
                    SELECT id
                    FROM feeds
                    WHERE url = :url
                    """,
                params,
                Long.class
            );
            if (id == null) {
                throw new IllegalStateException("Failed to upsert feed for url " + registration.url());
            }
            return id;
        });
    }

    private int updateFeedRegistration(MapSqlParameterSource params) {
        return jdbc.update(
            """
                UPDATE feeds
                SET title = COALESCE(:title, title),
                    html_url = COALESCE(:htmlUrl, html_url),
                    categories = COALESCE(:categories, categories),
                    extensions = COALESCE(:extensions, extensions),
                    updated_at = :now
                WHERE url = :url
                """,
            params
        );
    }

    public List<FeedRecord> findActiveFeeds() {
        return storage("findActiveFeeds", () -> jdbc.query(
            """
                SELECT *
                FROM feeds
                WHERE status <> 'INACTIVE'
                ORDER BY id
                """,
            new MapSqlParameterSource(),
            feedRowMapper()
        ));
    }

    public FeedRecord findFeedById(long feedId) {
        List<FeedRecord> rows = storage("findFeedById", () -> jdbc.query(
            "SELECT * FROM feeds WHERE id = :id",
            new MapSqlParameterSource("id", feedId),
            feedRowMapper()
        ));
        return rows.isEmpty() ? null : rows.get(0);
    }

    public FeedRecord findFeedByUrl(String url) {
        List<FeedRecord> rows = storage("findFeedByUrl", () -> jdbc.query(
            "SELECT * FROM feeds WHERE url = :url",
            new MapSqlParameterSource("url", url),
            feedRowMapper()
        ));
        return rows.isEmpty() ? null : rows.get(0);
    }

    public List<FeedRecord> findFeeds(FeedStatus status, String category) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        StringBuilder sql = new StringBuilder("SELECT * FROM feeds");
        if (status != null) {
            sql.append(" WHERE status = :status");
            params.addValue("status", status.name());
        }
        sql.append(" ORDER BY id");
        List<FeedRecord> feeds = storage("findFeeds", () -> jdbc.query(sql.toString(), params, feedRowMapper()));
        if (category == null || category.isBlank()) {
            return feeds;
        }
        String wanted = category.trim();
        return feeds.stream()
            .filter(feed -> feed.categories().contains(wanted))
            .toList();
    }

    public void recordFetchSuccess(long feedId, String etag, String lastModified, Instant fetchedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", feedId)
            .addValue("etag", etag, Types.VARCHAR)
            .addValue("lastModified", lastModified, Types.VARCHAR)
            .addValue("fetchedAt", toTimestamp(fetchedAt));
        storage("recordFetchSuccess", () -> jdbc.update(
            """
                UPDATE feeds
                SET etag = COALESCE(:etag, etag),
                    last_modified = COALESCE(:lastModified, last_modified),
                    last_fetched_at = :fetchedAt,
                    status = CASE WHEN status = 'INACTIVE' THEN status ELSE 'ACTIVE' END,
                    consecutive_errors = 0,
                    last_error = NULL,
                    updated_at = :fetchedAt
                WHERE id = :id
                """,
            params
        ));
    }

    public void recordFetchFailure(long feedId, String lastError, Instant fetchedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", feedId)
            .addValue("lastError", truncate(lastError, 2048), Types.VARCHAR)
            .addValue("fetchedAt", toTimestamp(fetchedAt));
        storage("recordFetchFailure", () -> jdbc.update(
            """
                UPDATE feeds
                SET status = CASE WHEN status = 'INACTIVE' THEN status ELSE 'ERROR' END,
                    consecutive_errors = consecutive_errors + 1,
                    last_error = :lastError,
                    last_fetched_at = :fetchedAt,
                    updated_at = :fetchedAt
                WHERE id = :id
                """,
            params
        ));
    }

    public boolean setFeedStatus(long feedId, FeedStatus status, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", feedId)
            .addValue("status", status.name())
            .addValue("resetErrors", status == FeedStatus.ACTIVE)
            .addValue("now", toTimestamp(now));
        int updated = storage("setFeedStatus", () -> jdbc.update(
            """
                UPDATE feeds
                SET status = :status,
                    consecutive_errors = CASE WHEN :resetErrors THEN 0 ELSE consecutive_errors END,
                    updated_at = :now
                WHERE id = :id
                """,
            params
        ));
        return updated > 0;
    }

    // ---- posts ----

    public boolean postExists(String fingerprint) {
        Long count = storage("postExists", () -> jdbc.queryForObject(
            "SELECT COUNT(*) FROM posts WHERE fingerprint = :fingerprint",
            new MapSqlParameterSource("fingerprint", fingerprint),
            Long.class
        ));
        return count != null && count > 0;
    }

    public InsertResult insertPostIfNew(PostDraft draft, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("feedId", draft.feedId())
            .addValue("url", draft.url())
            .addValue("title", truncate(draft.title(), 2048), Types.VARCHAR)
            .addValue("publishedAt", draft.publishedAt() == null ? null : Timestamp.from(draft.publishedAt().toInstant()), Types.TIMESTAMP)
            .addValue("content", draft.content() == null ? "" : draft.content())
            .addValue("extractionStatus", draft.extractionStatus().name())
            .addValue("fingerprint", draft.fingerprint())
            .addValue("guid", truncate(draft.guid(), 2048), Types.VARCHAR)
            .addValue("now", toTimestamp(now));
        return storage("insertPostIfNew", () -> {
            try {
                jdbc.update(
                    """
                        INSERT INTO posts (
                            feed_id, url, title, published_at, content, extraction_status, fingerprint, guid, created_at, updated_at
                        )
                        VALUES (
                            :feedId, :url, :title, :publishedAt, :content, :extractionStatus, :fingerprint, :guid, :now, :now
                        )
                        """,
                    params
                );
                return InsertResult.INSERTED;
            } catch (DuplicateKeyException e) {
                return InsertResult.ALREADY_EXISTS;
            }
        });
    }

    public PostRecord findPostByFingerprint(String fingerprint) {
        List<PostRecord> rows = storage("findPostByFingerprint", () -> jdbc.query(
            "SELECT * FROM posts WHERE fingerprint = :fingerprint",
            new MapSqlParameterSource("fingerprint", fingerprint),
            postRowMapper()
        ));
        return rows.isEmpty() ? null : rows.get(0);
    }

    public List<PostRecord> findDegradedPosts(int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("status", ExtractionStatus.DEGRADED_SUMMARY.name())
            .addValue("limit", Math.max(1, limit));
        return storage("findDegradedPosts", () -> jdbc.query(
            """
                SELECT *
                FROM posts
                WHERE extraction_status = :status
                ORDER BY id
                LIMIT :limit
                """,
            params,
            postRowMapper()
        ));
    }

    /**
     * Upgrades a degraded post. Only {@code DEGRADED_SUMMARY} rows are touched, so a post that is
     * already {@code FULL} stays immutable.
     */
    public boolean updatePostExtraction(long postId, String content, ExtractionStatus status, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", postId)
            .addValue("content", content == null ? "" : content)
            .addValue("status", status.name())
            .addValue("degraded", ExtractionStatus.DEGRADED_SUMMARY.name())
            .addValue("now", toTimestamp(now));
        int updated = storage("updatePostExtraction", () -> jdbc.update(
            """
                UPDATE posts
                SET content = :content,
                    extraction_status = :status,
                    updated_at = :now
                WHERE id = :id
                  AND extraction_status = :degraded
                """,
            params
        ));
        return updated > 0;
    }

    public void forEachPostInFeeds(Collection<Long> feedIds, Consumer<PostRecord> consumer) {
        if (feedIds == null || feedIds.isEmpty()) {
            return;
        }
        List<Long> ids = new ArrayList<>(feedIds);
        RowMapper<PostRecord> mapper = postRowMapper();
        for (int i = 0; i < ids.size(); i += FEED_ID_BATCH) {
            List<Long> slice = ids.subList(i, Math.min(ids.size(), i + FEED_ID_BATCH));
            storage("forEachPostInFeeds", () -> {
                jdbc.query(
                    """
                        SELECT *
                        FROM posts
                        WHERE feed_id IN (:feedIds)
                        ORDER BY id
                        """,
                    new MapSqlParameterSource("feedIds", slice),
                    rs -> {
                        consumer.accept(mapper.mapRow(rs, 0));
                    }
                );
                return null;
            });
        }
    }

    // ---- jobs ----

    public long startJob(Instant startedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("startedAt", toTimestamp(startedAt))
            .addValue("status", JobStatus.RUNNING.name());
        return storage("startJob", () -> {
            KeyHolder keyHolder = new GeneratedKeyHolder();
            jdbc.update(
                """
                    INSERT INTO ingestion_jobs (started_at, status)
                    VALUES (:startedAt, :status)
                    """,
                params,
                keyHolder,
                new String[]{"id"}
            );
            Number key = keyHolder.getKey();
            if (key == null) {
                throw new IllegalStateException("Failed to insert ingestion job");
            }
            return key.longValue();
        });
    }

    /**
     * Appends an outcome to a job that has not been finalized yet.
     *
     * @throws IllegalStateException when the job is unknown or already finalized
     */
    public void appendJobOutcome(long jobId, FeedOutcome outcome) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("feedId", outcome.feedId())
            .addValue("feedUrl", truncate(outcome.feedUrl(), 2048), Types.VARCHAR)
            .addValue("newCount", outcome.newCount())
            .addValue("duplicateCount", outcome.duplicateCount())
            .addValue("failedCount", outcome.failedCount())
            .addValue("status", outcome.status().name())
            .addValue("reasonCode", outcome.reasonCode(), Types.VARCHAR)
            .addValue("message", truncate(outcome.message(), 2048), Types.VARCHAR)
            .addValue("completedAt", toTimestamp(outcome.completedAt()));
        int inserted = storage("appendJobOutcome", () -> jdbc.update(
            """
                INSERT INTO ingestion_job_outcomes (
                    job_id, feed_id, feed_url, new_count, duplicate_count, failed_count,
                    status, reason_code, message, completed_at
                )
                SELECT id,
                       CAST(:feedId AS BIGINT),
                       CAST(:feedUrl AS VARCHAR(2048)),
                       CAST(:newCount AS INTEGER),
                       CAST(:duplicateCount AS INTEGER),
                       CAST(:failedCount AS INTEGER),
                       CAST(:status AS VARCHAR(32)),
                       CAST(:reasonCode AS VARCHAR(64)),
                       CAST(:message AS VARCHAR(2048)),
                       CAST(:completedAt AS TIMESTAMP WITH TIME ZONE)
                FROM ingestion_jobs
                WHERE id = :jobId
                  AND finished_at IS NULL
                """,
            params
        ));
        if (inserted == 0) {
            throw new IllegalStateException("Ingestion job " + jobId + " is finalized or missing");
        }
    }

    public void finalizeJob(long jobId, Instant finishedAt, JobStatus status, String notes, JobTotals totals) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("finishedAt", toTimestamp(finishedAt))
            .addValue("status", status.name())
            .addValue("notes", truncate(notes, 2048), Types.VARCHAR)
            .addValue("feedsProcessed", totals.feedsProcessed())
            .addValue("feedsFailed", totals.feedsFailed())
            .addValue("newCount", totals.newCount())
            .addValue("duplicateCount", totals.duplicateCount())
            .addValue("failedCount", totals.failedCount());
        int updated = storage("finalizeJob", () -> jdbc.update(
            """
                UPDATE ingestion_jobs
                SET finished_at = :finishedAt,
                    status = :status,
                    notes = :notes,
                    feeds_processed = :feedsProcessed,
                    feeds_failed = :feedsFailed,
                    new_count = :newCount,
                    duplicate_count = :duplicateCount,
                    failed_count = :failedCount
                WHERE id = :jobId
                  AND finished_at IS NULL
                """,
            params
        ));
        if (updated == 0) {
            throw new IllegalStateException("Ingestion job " + jobId + " is already finalized or missing");
        }
    }

    public IngestionJob findJob(long jobId) {
        List<IngestionJob> rows = storage("findJob", () -> jdbc.query(
            "SELECT * FROM ingestion_jobs WHERE id = :jobId",
            new MapSqlParameterSource("jobId", jobId),
            jobRowMapper()
        ));
        if (rows.isEmpty()) {
            return null;
        }
        IngestionJob job = rows.get(0);
        return withOutcomes(job, findJobOutcomes(jobId));
    }

    public IngestionJob findMostRecentJob() {
        List<IngestionJob> rows = storage("findMostRecentJob", () -> jdbc.query(
            """
                SELECT *
                FROM ingestion_jobs
                ORDER BY started_at DESC, id DESC
                LIMIT 1
                """,
            new MapSqlParameterSource(),
            jobRowMapper()
        ));
        return rows.isEmpty() ? null : rows.get(0);
    }

    public List<IngestionJob> findJobs(Instant from, Instant to, JobStatus status, Long feedId, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("limit", Math.max(1, Math.min(limit, 500)));
        StringBuilder sql = new StringBuilder("SELECT * FROM ingestion_jobs j WHERE 1 = 1");
        if (from != null) {
            sql.append(" AND j.started_at >= :from");
            params.addValue("from", toTimestamp(from));
        }
        if (to != null) {
            sql.append(" AND j.started_at < :to");
            params.addValue("to", toTimestamp(to));
        }
        if (status != null) {
            sql.append(" AND j.status = :status");
            params.addValue("status", status.name());
        }
        if (feedId != null) {
            sql.append(" AND EXISTS (SELECT 1 FROM ingestion_job_outcomes o WHERE o.job_id = j.id AND o.feed_id = :feedId)");
            params.addValue("feedId", feedId);
        }
        sql.append(" ORDER BY j.started_at DESC, j.id DESC LIMIT :limit");
        return storage("findJobs", () -> jdbc.query(sql.toString(), params, jobRowMapper()));
    }

    public List<Long> findUnfinishedJobIds() {
        return storage("findUnfinishedJobIds", () -> jdbc.queryForList(
            "SELECT id FROM ingestion_jobs WHERE finished_at IS NULL ORDER BY id",
            new MapSqlParameterSource(),
            Long.class
        ));
    }

    public List<FeedOutcome> findJobOutcomes(long jobId) {
        return storage("findJobOutcomes", () -> jdbc.query(
            """
                SELECT *
                FROM ingestion_job_outcomes
                WHERE job_id = :jobId
                ORDER BY id
                """,
            new MapSqlParameterSource("jobId", jobId),
            (rs, rowNum) -> new FeedOutcome(
                rs.getLong("feed_id"),
                rs.getString("feed_url"),
                rs.getInt("new_count"),
                rs.getInt("duplicate_count"),
                rs.getInt("failed_count"),
                FeedOutcomeStatus.valueOf(rs.getString("status")),
                rs.getString("reason_code"),
                rs.getString("message"),
                toInstant(rs.getTimestamp("completed_at"))
            )
        ));
    }

    // ---- helpers ----

    private <T> T storage(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessResourceFailureException | TransientDataAccessException | RecoverableDataAccessException e) {
            log.warn("Storage unavailable during {}: {}", operation, e.getMessage());
            throw new StorageUnavailableException("Storage unavailable during " + operation, e);
        }
    }

    private IngestionJob withOutcomes(IngestionJob job, List<FeedOutcome> outcomes) {
        return new IngestionJob(job.id(), job.startedAt(), job.finishedAt(), job.status(), job.notes(), job.totals(), outcomes);
    }

    private RowMapper<FeedRecord> feedRowMapper() {
        return (rs, rowNum) -> new FeedRecord(
            rs.getLong("id"),
            rs.getString("url"),
            rs.getString("title"),
            rs.getString("html_url"),
            readCategories(rs.getString("categories")),
            rs.getString("etag"),
            rs.getString("last_modified"),
            toInstant(rs.getTimestamp("last_fetched_at")),
            FeedStatus.fromDb(rs.getString("status")),
            rs.getInt("consecutive_errors"),
            rs.getString("last_error"),
            readExtensions(rs.getString("extensions")),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("updated_at"))
        );
    }

    private RowMapper<PostRecord> postRowMapper() {
        return (rs, rowNum) -> {
            Timestamp published = rs.getTimestamp("published_at");
            return new PostRecord(
                rs.getLong("id"),
                rs.getLong("feed_id"),
                rs.getString("url"),
                rs.getString("title"),
                published == null ? null : OffsetDateTime.ofInstant(published.toInstant(), ZoneOffset.UTC),
                rs.getString("content"),
                ExtractionStatus.valueOf(rs.getString("extraction_status")),
                rs.getString("fingerprint"),
                rs.getString("guid"),
                toInstant(rs.getTimestamp("created_at")),
                toInstant(rs.getTimestamp("updated_at"))
            );
        };
    }

    private RowMapper<IngestionJob> jobRowMapper() {
        return (rs, rowNum) -> new IngestionJob(
            rs.getLong("id"),
            toInstant(rs.getTimestamp("started_at")),
            toInstant(rs.getTimestamp("finished_at")),
            JobStatus.valueOf(rs.getString("status")),
            rs.getString("notes"),
            new JobTotals(
                rs.getInt("feeds_processed"),
                rs.getInt("feeds_failed"),
                rs.getInt("new_count"),
                rs.getInt("duplicate_count"),
                rs.getInt("failed_count")
            ),
            List.of()
        );
    }

    private Set<String> readCategories(String json) {
        if (json == null || json.isBlank()) {
            return Set.of();
        }
        try {
            return new TreeSet<>(objectMapper.readValue(json, STRING_LIST));
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable categories column: {}", e.getOriginalMessage());
            return Set.of();
        }
    }

    private Map<String, String> readExtensions(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, STRING_MAP);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable extensions column: {}", e.getOriginalMessage());
            return Map.of();
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unable to serialize " + value, e);
        }
    }

    private String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
