package com.websubrelay.repository;

import com.websubrelay.model.JobRecord;
import com.websubrelay.model.JobStatus;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable bookkeeping for the event queue ({@code queue_jobs}).
 *
 * <p>SQS carries the messages; this table owns job identity. A row exists from
 * enqueue until the job succeeds, which makes enqueue idempotent per item id,
 * and it keeps lock, attempt and stall counters that SQS cannot. Failed jobs
 * stay here for inspection until the retention sweep removes them.
 */
@Repository
public class JobLedgerRepository {

    private static final String COLUMNS =
            "item_id, source_id, payload, status, attempts, stall_count, locked_until, last_error, created_at, updated_at, failed_at";

    private static final RowMapper<JobRecord> ROW_MAPPER = (rs, rowNum) -> new JobRecord(
            rs.getString("item_id"),
            rs.getString("source_id"),
            rs.getString("payload"),
            JobStatus.valueOf(rs.getString("status")),
            rs.getInt("attempts"),
            rs.getInt("stall_count"),
            toInstant(rs.getTimestamp("locked_until")),
            rs.getString("last_error"),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("updated_at")),
            toInstant(rs.getTimestamp("failed_at"))
    );

    private final JdbcTemplate jdbc;

    public JobLedgerRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    /**
     * @return {@code true} if the job was registered, {@code false} if a job with
     *         this item id is already queued, running or parked as failed
     */
    public boolean insertIfAbsent(String itemId, String sourceId, String payload, Instant now) {
        int rows = jdbc.update("""
                INSERT INTO queue_jobs (item_id, source_id, payload, status, attempts, stall_count, created_at, updated_at)
                VALUES (?, ?, CAST(? AS jsonb), 'QUEUED', 0, 0, ?, ?)
                ON CONFLICT (item_id) DO NOTHING
                """, itemId, sourceId, payload, ts(now), ts(now));
        return rows == 1;
    }

    /**
     * Locks a job for one worker. Succeeds for a queued job, or for an active
     * job whose lock expired, in which case the stall counter is incremented.
     *
     * @return the claimed row, or empty if the job is missing, failed or locked
     */
    public Optional<JobRecord> claim(String itemId, String token, Instant now, Instant lockUntil) {
        List<JobRecord> rows = jdbc.query("""
                UPDATE queue_jobs SET
                  stall_count = stall_count + CASE WHEN status = 'ACTIVE' THEN 1 ELSE 0 END,
                  status = 'ACTIVE',
                  lock_token = ?,
                  locked_until = ?,
                  updated_at = ?
                WHERE item_id = ?
                  AND (status = 'QUEUED' OR (status = 'ACTIVE' AND locked_until < ?))
                RETURNING %s
                """.formatted(COLUMNS), ROW_MAPPER, token, ts(lockUntil), ts(now), itemId, ts(now));
        return rows.stream().findFirst();
    }

    public boolean renewLock(String itemId, String token, Instant lockUntil, Instant now) {
        return jdbc.update("""
                UPDATE queue_jobs SET locked_until = ?, updated_at = ?
                WHERE item_id = ? AND lock_token = ? AND status = 'ACTIVE'
                """, ts(lockUntil), ts(now), itemId, token) == 1;
    }

    /**
     * Removes a job after it succeeded.
     *
     * @return {@code false} if the lock had already been lost
     */
    public boolean complete(String itemId, String token) {
        return jdbc.update("DELETE FROM queue_jobs WHERE item_id = ? AND lock_token = ?", itemId, token) == 1;
    }

    /**
     * Counts a failed attempt and puts the job back to queued.
     *
     * @return the new attempt count, or -1 if the lock had been lost
     */
    public int recordFailure(String itemId, String token, String error, Instant now) {
        List<Integer> attempts = jdbc.query("""
                UPDATE queue_jobs SET
                  attempts = attempts + 1,
                  last_error = ?,
                  status = 'QUEUED',
                  lock_token = NULL,
                  locked_until = NULL,
                  updated_at = ?
                WHERE item_id = ? AND lock_token = ?
                RETURNING attempts
                """, (rs, rowNum) -> rs.getInt(1), error, ts(now), itemId, token);
        return attempts.isEmpty() ? -1 : attempts.get(0);
    }

    public void markFailed(String itemId, String error, Instant now) {
        jdbc.update("""
                UPDATE queue_jobs SET
                  status = 'FAILED',
                  last_error = ?,
                  lock_token = NULL,
                  locked_until = NULL,
                  failed_at = ?,
                  updated_at = ?
                WHERE item_id = ?
                """, error, ts(now), ts(now), itemId);
    }

    public void delete(String itemId) {
        jdbc.update("DELETE FROM queue_jobs WHERE item_id = ?", itemId);
    }

    public Optional<JobRecord> find(String itemId) {
        return jdbc.query("SELECT " + COLUMNS + " FROM queue_jobs WHERE item_id = ?", ROW_MAPPER, itemId)
                .stream()
                .findFirst();
    }

    public List<JobRecord> findFailed(int limit) {
        return jdbc.query("SELECT " + COLUMNS + " FROM queue_jobs WHERE status = 'FAILED' ORDER BY failed_at DESC LIMIT ?",
                ROW_MAPPER, limit);
    }

    public int purgeFailedBefore(Instant cutoff) {
        return jdbc.update("DELETE FROM queue_jobs WHERE status = 'FAILED' AND failed_at < ?", ts(cutoff));
    }

    /**
     * Removes queued jobs that nobody touched since {@code cutoff}. Such a row
     * has no message behind it and would otherwise reject every later
     * delivery of its item.
     */
    public int purgeStaleQueuedBefore(Instant cutoff) {
        return jdbc.update("DELETE FROM queue_jobs WHERE status = 'QUEUED' AND lock_token IS NULL AND updated_at < ?",
                ts(cutoff));
    }

    private static Timestamp ts(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
