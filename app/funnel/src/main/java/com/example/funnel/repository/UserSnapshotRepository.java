/*
 * Where: Funnel data access
 * What: Loads user snapshots from user_profiles
 * Why: The automation pass pages through recent signups; the enrollment pass loads one user
 */
package com.example.funnel.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.funnel.model.UserSnapshot;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class UserSnapshotRepository {

  private static final String COLUMNS =
      "id, email, first_name, full_name, plan, created_at, last_login_at";

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<UserSnapshot> findById(String userId) {
    final String sql = "SELECT " + COLUMNS + " FROM user_profiles WHERE id = :userId";
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource("userId", userId), this::mapRow)
        .stream()
        .findFirst();
  }

  /**
   * Keyset page of users with an email, ordered by signup. The first page starts at
   * {@code (signedUpSince, "")}; later pages pass the last row's created_at and id.
   */
  public List<UserSnapshot> findCandidatesPage(Instant afterCreatedAt, String afterId, int limit) {
    final String sql =
        """
        SELECT id, email, first_name, full_name, plan, created_at, last_login_at
        FROM user_profiles
        WHERE email IS NOT NULL
          AND email <> ''
          AND (created_at, id) > (:afterCreatedAt, :afterId)
        ORDER BY created_at, id
        LIMIT :limit
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("afterCreatedAt", toTimestamp(afterCreatedAt))
            .addValue("afterId", afterId)
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private UserSnapshot mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new UserSnapshot(
        rs.getString("id"),
        rs.getString("email"),
        rs.getString("first_name"),
        rs.getString("full_name"),
        rs.getString("plan"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("last_login_at")));
  }
}
