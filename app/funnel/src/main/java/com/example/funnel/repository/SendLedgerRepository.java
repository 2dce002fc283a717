/*
 * Where: Funnel data access
 * What: Reads and writes email_send_ledger
 * Why: The (user_id, step_key) primary key is what makes a send happen at most once
 */
package com.example.funnel.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.funnel.model.SendMeta;
import com.example.funnel.model.SendRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class SendLedgerRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;

  public boolean exists(String userId, String stepKey) {
    final String sql =
        """
        SELECT EXISTS (
          SELECT 1 FROM email_send_ledger
          WHERE user_id = :userId AND step_key = :stepKey
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("userId", userId).addValue("stepKey", stepKey);
    return Boolean.TRUE.equals(jdbcTemplate.queryForObject(sql, params, Boolean.class));
  }

  public boolean insertIfAbsent(String userId, String stepKey, Instant sentAt, SendMeta meta) {
    final String sql =
        """
        INSERT INTO email_send_ledger (user_id, step_key, sent_at, meta)
        VALUES (:userId, :stepKey, :sentAt, :meta::jsonb)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("stepKey", stepKey)
            .addValue("sentAt", toTimestamp(sentAt))
            .addValue("meta", writeMeta(meta));
    try {
      return jdbcTemplate.update(sql, params) > 0;
    } catch (DuplicateKeyException ex) {
      return false;
    }
  }

  public List<SendRecord> findByUserId(String userId) {
    final String sql =
        """
        SELECT user_id, step_key, sent_at, meta::text AS meta_text
        FROM email_send_ledger
        WHERE user_id = :userId
        ORDER BY sent_at, step_key
        """;
    return jdbcTemplate.query(
        sql, new MapSqlParameterSource().addValue("userId", userId), this::mapRow);
  }

  private String writeMeta(SendMeta meta) {
    if (meta == null) {
      return "{}";
    }
    try {
      return objectMapper.writeValueAsString(meta);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("send meta serialization failure", ex);
    }
  }

  private SendRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String metaText = rs.getString("meta_text");
    SendMeta meta;
    try {
      meta = metaText == null ? null : objectMapper.readValue(metaText, SendMeta.class);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("send meta parse failure", ex);
    }
    return new SendRecord(
        rs.getString("user_id"),
        rs.getString("step_key"),
        toInstant(rs.getTimestamp("sent_at")),
        meta);
  }
}
