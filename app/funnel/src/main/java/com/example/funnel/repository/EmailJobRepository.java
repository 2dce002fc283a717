/*
 * Where: Funnel data access
 * What: Inserts, claims and finalizes rows of email_jobs
 * Why: Every state change is a conditional UPDATE so concurrent runners cannot double-send
 */
package com.example.funnel.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.funnel.model.EmailJob;
import com.example.funnel.model.EmailJobStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class EmailJobRepository {

  private static final String RETURNING_COLUMNS =
      """
      id, user_id, to_email, template_key, subject, payload::text AS payload_text, status,
      attempts, max_retries, scheduled_at, last_error, locked_by, locked_at, lease_until,
      created_at, sent_at, provider_message_id
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public UUID insert(EmailJob job) {
    final String sql =
        """
        INSERT INTO email_jobs (
          id, user_id, to_email, template_key, subject, payload, status, attempts, max_retries,
          scheduled_at, last_error, locked_by, locked_at, lease_until, created_at, sent_at,
          provider_message_id
        ) VALUES (
          :id, :userId, :toEmail, :templateKey, :subject, :payload::jsonb, :status, :attempts,
          :maxRetries, :scheduledAt, :lastError, :lockedBy, :lockedAt, :leaseUntil, :createdAt,
          :sentAt, :providerMessageId
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", job.id())
            .addValue("userId", job.userId())
            .addValue("toEmail", job.toEmail())
            .addValue("templateKey", job.templateKey())
            .addValue("subject", job.subject())
            .addValue("payload", job.payloadJson())
            .addValue("status", job.status().name())
            .addValue("attempts", job.attempts())
            .addValue("maxRetries", job.maxRetries())
            .addValue("scheduledAt", toTimestamp(job.scheduledAt()))
            .addValue("lastError", job.lastError())
            .addValue("lockedBy", job.lockedBy())
            .addValue("lockedAt", toTimestamp(job.lockedAt()))
            .addValue("leaseUntil", toTimestamp(job.leaseUntil()))
            .addValue("createdAt", toTimestamp(job.createdAt()))
            .addValue("sentAt", toTimestamp(job.sentAt()))
            .addValue("providerMessageId", job.providerMessageId());
    jdbcTemplate.update(sql, params);
    return job.id();
  }

  public Optional<EmailJob> findById(UUID id) {
    final String sql = "SELECT " + RETURNING_COLUMNS + " FROM email_jobs WHERE id = :id";
    return jdbcTemplate.query(sql, new MapSqlParameterSource("id", id), this::mapRow).stream()
        .findFirst();
  }

  /**
   * Moves up to {@code limit} due PENDING jobs to SENDING, oldest first. Rows locked by another
   * runner are skipped, and the UPDATE re-checks the status, so each job is claimed once.
   */
  public List<EmailJob> claimPending(int limit, Instant now, Instant leaseUntil, String lockedBy) {
    final String sql =
        """
        WITH cte AS (
          SELECT id
          FROM email_jobs
          WHERE status = 'PENDING'
            AND scheduled_at <= :now
          ORDER BY scheduled_at, created_at
          LIMIT :limit
          FOR UPDATE SKIP LOCKED
        )
        UPDATE email_jobs j
        SET status = 'SENDING',
            attempts = j.attempts + 1,
            locked_by = :lockedBy,
            locked_at = :now,
            lease_until = :leaseUntil
        FROM cte
        WHERE j.id = cte.id
          AND j.status = 'PENDING'
        RETURNING j.id, j.user_id, j.to_email, j.template_key, j.subject,
                  j.payload::text AS payload_text, j.status, j.attempts, j.max_retries,
                  j.scheduled_at, j.last_error, j.locked_by, j.locked_at, j.lease_until,
                  j.created_at, j.sent_at, j.provider_message_id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("leaseUntil", toTimestamp(leaseUntil))
            .addValue("lockedBy", lockedBy)
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int markSent(UUID id, Instant sentAt, String providerMessageId, String lockedBy) {
    final String sql =
        """
        UPDATE email_jobs
        SET status = 'SENT',
            sent_at = :sentAt,
            provider_message_id = :providerMessageId,
            last_error = NULL,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL
        WHERE id = :id
          AND status = 'SENDING'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("sentAt", toTimestamp(sentAt))
            .addValue("providerMessageId", providerMessageId)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  public int markFailed(UUID id, String lastError, String lockedBy) {
    final String sql =
        """
        UPDATE email_jobs
        SET status = 'FAILED',
            last_error = :lastError,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL
        WHERE id = :id
          AND status = 'SENDING'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("lastError", lastError)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  /** Returns a claimed job to PENDING; only used when the queue's retry policy allows it. */
  public int markRetry(UUID id, Instant scheduledAt, String lastError, String lockedBy) {
    final String sql =
        """
        UPDATE email_jobs
        SET status = 'PENDING',
            scheduled_at = :scheduledAt,
            last_error = :lastError,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL
        WHERE id = :id
          AND status = 'SENDING'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("scheduledAt", toTimestamp(scheduledAt))
            .addValue("lastError", lastError)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  /** Returns a claimed job to PENDING without counting the attempt. */
  public int release(UUID id, String lockedBy) {
    final String sql =
        """
        UPDATE email_jobs
        SET status = 'PENDING',
            attempts = GREATEST(attempts - 1, 0),
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL
        WHERE id = :id
          AND status = 'SENDING'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("id", id).addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  /**
   * Fails SENDING jobs whose lease ran out. Whether the provider accepted them is unknown, so
   * they are never re-sent automatically.
   */
  public int failExpiredLeases(Instant now, String lastError) {
    final String sql =
        """
        UPDATE email_jobs
        SET status = 'FAILED',
            last_error = :lastError,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL
        WHERE status = 'SENDING'
          AND (lease_until IS NULL OR lease_until <= :now)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("lastError", lastError);
    return jdbcTemplate.update(sql, params);
  }

  public int countPending() {
    final Integer count =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM email_jobs WHERE status = 'PENDING'",
            new MapSqlParameterSource(),
            Integer.class);
    return count == null ? 0 : count;
  }

  private EmailJob mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new EmailJob(
        UUID.fromString(rs.getString("id")),
        rs.getString("user_id"),
        rs.getString("to_email"),
        rs.getString("template_key"),
        rs.getString("subject"),
        rs.getString("payload_text"),
        EmailJobStatus.valueOf(rs.getString("status")),
        rs.getInt("attempts"),
        rs.getInt("max_retries"),
        toInstant(rs.getTimestamp("scheduled_at")),
        rs.getString("last_error"),
        rs.getString("locked_by"),
        toInstant(rs.getTimestamp("locked_at")),
        toInstant(rs.getTimestamp("lease_until")),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("sent_at")),
        rs.getString("provider_message_id"));
  }
}
