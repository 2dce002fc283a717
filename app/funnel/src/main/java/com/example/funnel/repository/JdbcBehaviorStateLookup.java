/*
 * Where: Funnel data access
 * What: Answers behavioral predicates with EXISTS queries over product tables
 * Why: Each trigger flag needs one cheap indexed lookup per user
 */
package com.example.funnel.repository;

import com.example.funnel.service.BehaviorStateLookup;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JdbcBehaviorStateLookup implements BehaviorStateLookup {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Override
  public boolean hasSmartLink(String userId) {
    return exists("SELECT EXISTS (SELECT 1 FROM smart_links WHERE user_id = :userId)", userId);
  }

  @Override
  public boolean hasUsedAi(String userId) {
    return exists("SELECT EXISTS (SELECT 1 FROM ai_conversations WHERE user_id = :userId)", userId);
  }

  @Override
  public boolean hasCalendarConnected(String userId) {
    return exists(
        "SELECT EXISTS (SELECT 1 FROM calendar_connections WHERE user_id = :userId)", userId);
  }

  @Override
  public boolean hasAdCampaign(String userId) {
    return exists("SELECT EXISTS (SELECT 1 FROM ad_campaigns WHERE user_id = :userId)", userId);
  }

  private boolean exists(String sql, String userId) {
    return Boolean.TRUE.equals(
        jdbcTemplate.queryForObject(sql, new MapSqlParameterSource("userId", userId), Boolean.class));
  }
}
