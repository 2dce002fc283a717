/*
 * Where: Funnel data access
 * What: Key/value settings stored as JSON in app_settings
 * Why: Operators flip the automation switch without a redeploy
 */
package com.example.funnel.repository;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class AppSettingsRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<String> findValueJson(String key) {
    final String sql = "SELECT value::text FROM app_settings WHERE key = :key";
    final List<String> values =
        jdbcTemplate.queryForList(sql, new MapSqlParameterSource("key", key), String.class);
    return values.stream().findFirst();
  }

  public void upsert(String key, String valueJson, Instant updatedAt) {
    final String sql =
        """
        INSERT INTO app_settings (key, value, updated_at)
        VALUES (:key, :value::jsonb, :updatedAt)
        ON CONFLICT (key) DO UPDATE
        SET value = EXCLUDED.value,
            updated_at = EXCLUDED.updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("key", key)
            .addValue("value", valueJson)
            .addValue("updatedAt", toTimestamp(updatedAt));
    jdbcTemplate.update(sql, params);
  }
}
