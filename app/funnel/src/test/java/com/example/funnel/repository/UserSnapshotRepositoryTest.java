/*
 * Where: Product read model integration tests
 * What: Candidate paging, profile lookup, behavior flags and the settings table
 * Why: The automation pass reads these tables on every tick
 */
package com.example.funnel.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.common.JdbcTimestampUtils;
import com.example.funnel.AbstractPostgresContainerTest;
import com.example.funnel.model.UserSnapshot;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class UserSnapshotRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant NOW = Instant.now().truncatedTo(ChronoUnit.MILLIS);

  @Autowired private UserSnapshotRepository userSnapshotRepository;
  @Autowired private JdbcBehaviorStateLookup behaviorStateLookup;
  @Autowired private AppSettingsRepository appSettingsRepository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    final MapSqlParameterSource none = new MapSqlParameterSource();
    jdbcTemplate.update("DELETE FROM smart_links", none);
    jdbcTemplate.update("DELETE FROM user_profiles", none);
  }

  @Test
  void candidatePagesFollowSignupOrderAndSkipUsersWithoutEmail() {
    final Instant base = NOW.minus(Duration.ofDays(2));
    insertUser("u-a", "a@example.com", base);
    insertUser("u-b", "b@example.com", base);
    insertUser("u-c", null, base.plusSeconds(10));
    insertUser("u-d", "d@example.com", base.plusSeconds(20));
    insertUser("u-old", "old@example.com", NOW.minus(Duration.ofDays(90)));

    final Instant since = NOW.minus(Duration.ofDays(45));
    final List<UserSnapshot> first = userSnapshotRepository.findCandidatesPage(since, "", 2);
    final UserSnapshot last = first.get(first.size() - 1);
    final List<UserSnapshot> second =
        userSnapshotRepository.findCandidatesPage(last.createdAt(), last.id(), 2);

    assertThat(first).extracting(UserSnapshot::id).containsExactly("u-a", "u-b");
    assertThat(second).extracting(UserSnapshot::id).containsExactly("u-d");
  }

  @Test
  void findByIdMapsProfileColumns() {
    insertUser("u-a", "a@example.com", NOW);

    final UserSnapshot user = userSnapshotRepository.findById("u-a").orElseThrow();

    assertThat(user.email()).isEqualTo("a@example.com");
    assertThat(user.firstName()).isEqualTo("First");
    assertThat(user.createdAt()).isEqualTo(NOW);
    assertThat(userSnapshotRepository.findById("missing")).isEmpty();
  }

  @Test
  void smartLinkFlagReflectsRows() {
    jdbcTemplate.update(
        "INSERT INTO smart_links (user_id) VALUES (:userId)",
        new MapSqlParameterSource("userId", "u-a"));

    assertThat(behaviorStateLookup.hasSmartLink("u-a")).isTrue();
    assertThat(behaviorStateLookup.hasSmartLink("u-b")).isFalse();
    assertThat(behaviorStateLookup.hasAdCampaign("u-a")).isFalse();
  }

  @Test
  void automationSwitchIsSeededDisabledAndCanBeUpdated() {
    appSettingsRepository.upsert("email_automation", "{\"enabled\": false}", NOW);
    assertThat(appSettingsRepository.findValueJson("email_automation"))
        .hasValueSatisfying(value -> assertThat(value).contains("false"));

    appSettingsRepository.upsert("email_automation", "{\"enabled\": true}", NOW);

    assertThat(appSettingsRepository.findValueJson("email_automation"))
        .hasValueSatisfying(value -> assertThat(value).contains("true"));
    assertThat(appSettingsRepository.findValueJson("unknown_key")).isEmpty();
  }

  private void insertUser(String id, String email, Instant createdAt) {
    jdbcTemplate.update(
        """
        INSERT INTO user_profiles (id, email, first_name, full_name, plan, created_at)
        VALUES (:id, :email, 'First', 'First Last', 'free', :createdAt)
        """,
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("email", email)
            .addValue("createdAt", JdbcTimestampUtils.toTimestamp(createdAt)));
  }
}
