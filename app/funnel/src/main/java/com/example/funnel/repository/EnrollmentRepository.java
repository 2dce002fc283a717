/*
 * Where: Funnel data access
 * What: Upserts and advances rows of email_enrollments
 * Why: Updates compare the expected current_step so two schedulers cannot both advance a user
 */
package com.example.funnel.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.funnel.model.Enrollment;
import com.example.funnel.model.EnrollmentStatus;
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
public class EnrollmentRepository {

  private static final String COLUMNS =
      """
      id, user_id, sequence_key, current_step, step_attempts, status, next_run_at, context::text AS context_text,
      created_at, updated_at, last_sent_at, last_error
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** Inserts a new ACTIVE enrollment unless one exists for the pair; returns true when inserted. */
  public boolean insertIfAbsent(
      UUID id,
      String userId,
      String sequenceKey,
      String contextJson,
      Instant nextRunAt,
      Instant createdAt) {
    final String sql =
        """
        INSERT INTO email_enrollments (
          id, user_id, sequence_key, current_step, step_attempts, status, next_run_at, context,
          created_at, updated_at
        ) VALUES (
          :id, :userId, :sequenceKey, 0, 'ACTIVE', :nextRunAt, :context::jsonb,
          :createdAt, :createdAt
        )
        ON CONFLICT (user_id, sequence_key) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("userId", userId)
            .addValue("sequenceKey", sequenceKey)
            .addValue("nextRunAt", toTimestamp(nextRunAt))
            .addValue("context", contextJson)
            .addValue("createdAt", toTimestamp(createdAt));
    return jdbcTemplate.update(sql, params) > 0;
  }

  public Optional<Enrollment> findByUserAndSequence(String userId, String sequenceKey) {
    final String sql =
        "SELECT " + COLUMNS
            + " FROM email_enrollments WHERE user_id = :userId AND sequence_key = :sequenceKey";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("userId", userId).addValue("sequenceKey", sequenceKey);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<Enrollment> findDue(Instant now, int limit) {
    final String sql =
        "SELECT " + COLUMNS
            + """
             FROM email_enrollments
            WHERE status = 'ACTIVE'
              AND next_run_at <= :now
            ORDER BY next_run_at, id
            LIMIT :limit
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("now", toTimestamp(now)).addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  /**
   * Reserves a due enrollment for one caller by pushing {@code next_run_at} to {@code leaseUntil}.
   * Only the caller that still sees the polled {@code next_run_at} gets 1; every other gets 0.
   */
  public int claim(
      UUID id, int expectedStep, Instant expectedNextRunAt, Instant leaseUntil, Instant updatedAt) {
    final String sql =
        """
        UPDATE email_enrollments
        SET next_run_at = :leaseUntil,
            updated_at = :updatedAt
        WHERE id = :id
          AND status = 'ACTIVE'
          AND current_step = :expectedStep
          AND next_run_at = :expectedNextRunAt
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("expectedStep", expectedStep)
            .addValue("expectedNextRunAt", toTimestamp(expectedNextRunAt))
            .addValue("leaseUntil", toTimestamp(leaseUntil))
            .addValue("updatedAt", toTimestamp(updatedAt));
    return jdbcTemplate.update(sql, params);
  }

  /**
   * Moves the cursor past the expected step. {@code lastSentAt} is null when the step was skipped
   * without a send, which keeps the previous send as the relative anchor.
   */
  public int markAdvanced(
      UUID id,
      int expectedStep,
      Instant lastSentAt,
      Instant nextRunAt,
      Instant updatedAt) {
    final String sql =
        """
        UPDATE email_enrollments
        SET current_step = current_step + 1,
            step_attempts = 0,
            last_sent_at = COALESCE(:lastSentAt, last_sent_at),
            next_run_at = :nextRunAt,
            last_error = NULL,
            updated_at = :updatedAt
        WHERE id = :id
          AND status = 'ACTIVE'
          AND current_step = :expectedStep
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("expectedStep", expectedStep)
            .addValue("lastSentAt", toTimestamp(lastSentAt))
            .addValue("nextRunAt", toTimestamp(nextRunAt))
            .addValue("updatedAt", toTimestamp(updatedAt));
    return jdbcTemplate.update(sql, params);
  }

  public int markCompleted(UUID id, int expectedStep, Instant updatedAt) {
    final String sql =
        """
        UPDATE email_enrollments
        SET status = 'COMPLETED',
            updated_at = :updatedAt
        WHERE id = :id
          AND status = 'ACTIVE'
          AND current_step = :expectedStep
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("expectedStep", expectedStep)
            .addValue("updatedAt", toTimestamp(updatedAt));
    return jdbcTemplate.update(sql, params);
  }

  public int markRetry(
      UUID id, int expectedStep, Instant nextRunAt, String lastError, Instant updatedAt) {
    final String sql =
        """
        UPDATE email_enrollments
        SET next_run_at = :nextRunAt,
            step_attempts = step_attempts + 1,
            last_error = :lastError,
            updated_at = :updatedAt
        WHERE id = :id
          AND status = 'ACTIVE'
          AND current_step = :expectedStep
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("expectedStep", expectedStep)
            .addValue("nextRunAt", toTimestamp(nextRunAt))
            .addValue("lastError", lastError)
            .addValue("updatedAt", toTimestamp(updatedAt));
    return jdbcTemplate.update(sql, params);
  }

  private Enrollment mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new Enrollment(
        UUID.fromString(rs.getString("id")),
        rs.getString("user_id"),
        rs.getString("sequence_key"),
        rs.getInt("current_step"),
        rs.getInt("step_attempts"),
        EnrollmentStatus.valueOf(rs.getString("status")),
        toInstant(rs.getTimestamp("next_run_at")),
        rs.getString("context_text"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")),
        toInstant(rs.getTimestamp("last_sent_at")),
        rs.getString("last_error"));
  }
}
