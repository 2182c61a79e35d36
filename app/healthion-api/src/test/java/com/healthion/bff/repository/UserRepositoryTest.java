/*
 * どこで: Healthion リポジトリの統合テスト
 * 何を: users テーブルへの挿入・email 更新・upstream 連携の条件付き UPDATE を Postgres で検証する
 * なぜ: ON CONFLICT と IS NULL 条件の挙動が DB 方言で崩れないことを保証するため
 */
package com.healthion.bff.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.healthion.bff.AbstractPostgresContainerTest;
import com.healthion.bff.model.UserRecord;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class UserRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant BASE_TIME = Instant.parse("2026-01-17T00:00:00Z");

  @Autowired private UserRepository userRepository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM users", new MapSqlParameterSource());
  }

  @Test
  void insertIfAbsentIgnoresDuplicateExternalIdentity() {
    final int first = userRepository.insertIfAbsent(user("u-1", "auth0|1", "a@example.com"));
    final int second = userRepository.insertIfAbsent(user("u-2", "auth0|1", "b@example.com"));

    assertThat(first).isEqualTo(1);
    assertThat(second).isZero();
    final Optional<UserRecord> stored = userRepository.findByExternalIdentityId("auth0|1");
    assertThat(stored).isPresent();
    assertThat(stored.get().id()).isEqualTo("u-1");
    assertThat(stored.get().email()).isEqualTo("a@example.com");
    assertThat(stored.get().createdAt()).isEqualTo(BASE_TIME);
    assertThat(stored.get().isLinkedUpstream()).isFalse();
  }

  @Test
  void insertIfAbsentPropagatesEmailConflict() {
    userRepository.insertIfAbsent(user("u-1", "auth0|1", "a@example.com"));

    assertThatThrownBy(
            () -> userRepository.insertIfAbsent(user("u-2", "auth0|2", "a@example.com")))
        .isInstanceOf(DataIntegrityViolationException.class);
  }

  @Test
  void updateEmailReturnsUpdatedRow() {
    userRepository.insertIfAbsent(user("u-1", "auth0|1", "a@example.com"));
    final Instant later = BASE_TIME.plusSeconds(60);

    final Optional<UserRecord> updated =
        userRepository.updateEmail("u-1", "new@example.com", later);

    assertThat(updated).isPresent();
    assertThat(updated.get().email()).isEqualTo("new@example.com");
    assertThat(updated.get().updatedAt()).isEqualTo(later);
    assertThat(userRepository.updateEmail("missing", "x@example.com", later)).isEmpty();
  }

  @Test
  void linkUpstreamUserIfAbsentWritesOnlyOnce() {
    userRepository.insertIfAbsent(user("u-1", "auth0|1", "a@example.com"));

    final int first = userRepository.linkUpstreamUserIfAbsent("u-1", "ow-1", BASE_TIME);
    final int second = userRepository.linkUpstreamUserIfAbsent("u-1", "ow-2", BASE_TIME);

    assertThat(first).isEqualTo(1);
    assertThat(second).isZero();
    assertThat(userRepository.findById("u-1"))
        .get()
        .extracting(UserRecord::upstreamUserId)
        .isEqualTo("ow-1");
  }

  @Test
  void findByIdReturnsEmptyForUnknownUser() {
    assertThat(userRepository.findById("missing")).isEmpty();
  }

  private static UserRecord user(String id, String externalIdentityId, String email) {
    return new UserRecord(id, externalIdentityId, email, null, BASE_TIME, BASE_TIME);
  }
}
