package com.di.pgproof.job;

import com.di.pgproof.sql.JsonColumns;
import com.di.pgproof.sql.SqlQueriesProperties;
import com.di.pgproof.util.InputValidator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Jobs in the {@code pgproof_jobs} table of the metadata database.
 */
@Component
@ConditionalOnProperty(name = "pgproof.store.persistence-enabled", havingValue = "true")
public class JdbcJobStore implements JobStore {

    private static final int MAX_LIMIT = 1000;

    private final JdbcTemplate jdbc;
    private final SqlQueriesProperties sql;
    private final JsonColumns json;
    private final Clock clock;
    private final RowMapper<Job> rowMapper;

    public JdbcJobStore(JdbcTemplate jdbcTemplate, SqlQueriesProperties sql, JsonColumns json, Clock clock) {
        this.jdbc = jdbcTemplate;
        this.sql = sql;
        this.json = json;
        this.clock = clock;
        this.rowMapper = (rs, rowNum) -> Job.builder()
                .id(rs.getString("id"))
                .recommendationId(rs.getString("recommendation_id"))
                .jobType(JobType.fromCode(rs.getString("job_type")))
                .status(JobStatus.fromCode(rs.getString("status")))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .startedAt(toInstant(rs.getTimestamp("started_at")))
                .completedAt(toInstant(rs.getTimestamp("completed_at")))
                .result(json.readMap(rs.getString("result")))
                .errorMessage(rs.getString("error_message"))
                .build();
    }

    @Override
    public Job create(String recommendationId, JobType jobType) {
        Job job = Job.builder()
                .id(UUID.randomUUID().toString())
                .recommendationId(recommendationId)
                .jobType(jobType)
                .status(JobStatus.PENDING)
                .createdAt(clock.instant())
                .build();
        jdbc.update(sql.getJob().getInsert(),
                job.getId(),
                job.getRecommendationId(),
                job.getJobType().getCode(),
                job.getStatus().getCode(),
                Timestamp.from(job.getCreatedAt()));
        return job;
    }

    @Override
    public boolean updateStatus(String jobId, JobStatus status, Map<String, Object> result, String errorMessage) {
        Timestamp now = Timestamp.from(clock.instant());
        int updated;
        if (status == JobStatus.RUNNING) {
            updated = jdbc.update(sql.getJob().getMarkRunning(), status.getCode(), now, jobId);
        } else if (status.isTerminal()) {
            updated = jdbc.update(sql.getJob().getMarkFinished(),
                    status.getCode(), now, json.write(result), errorMessage, jobId);
        } else {
            updated = jdbc.update(sql.getJob().getUpdateStatus(), status.getCode(), jobId);
        }
        return updated > 0;
    }

    @Override
    public Optional<Job> get(String jobId) {
        if (jobId == null || jobId.isBlank()) return Optional.empty();
        return jdbc.query(sql.getJob().getFindById(), rowMapper, jobId).stream().findFirst();
    }

    @Override
    public List<Job> list(JobFilter filter) {
        int limit = InputValidator.clampLimit(filter.getLimit(), MAX_LIMIT);
        if (filter.getStatus() == null) {
            return jdbc.query(sql.getJob().getFindRecent(), rowMapper, limit);
        }
        return jdbc.query(sql.getJob().getFindByStatus(), rowMapper, filter.getStatus().getCode(), limit);
    }

    @Override
    public List<Job> findByRecommendation(String recommendationId) {
        if (recommendationId == null || recommendationId.isBlank()) return List.of();
        return jdbc.query(sql.getJob().getFindByRecommendation(), rowMapper, recommendationId);
    }

    @Override
    public int deleteOlderThan(Duration age) {
        Timestamp cutoff = Timestamp.from(clock.instant().minus(age));
        return jdbc.update(sql.getJob().getDeleteFinishedBefore(), cutoff);
    }

    @Override
    public JobStatistics statistics() {
        Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
        RowCallbackHandler countRow = rs -> counts.put(JobStatus.fromCode(rs.getString("status")), rs.getLong("cnt"));
        jdbc.query(sql.getJob().getCountByStatus(), countRow);
        long total = counts.values().stream().mapToLong(Long::longValue).sum();
        Timestamp last = jdbc.queryForObject(sql.getJob().getLastActivity(), Timestamp.class);
        Double avg = jdbc.queryForObject(sql.getJob().getAverageDurationMs(), Double.class);
        return JobStatistics.builder()
                .total(total)
                .countsByStatus(counts)
                .lastActivity(toInstant(last))
                .averageDurationMs(avg)
                .build();
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }
}
