/*
 * どこで: Healthion サービス層の統合テスト
 * 何を: 同一ユーザーの初回アクセスが並行した場合の users 行と upstream 連携の収束を検証する
 * なぜ: 並行リクエストでも users 行と upstream_user_id がそれぞれ 1 つに定まることを保証するため
 */
package com.healthion.bff.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

import com.healthion.bff.AbstractPostgresContainerTest;
import com.healthion.bff.model.RegistrationOutcome;
import com.healthion.bff.model.RegistrationResult;
import com.healthion.bff.model.UpstreamUser;
import com.healthion.bff.model.UserRecord;
import com.healthion.bff.repository.UserRepository;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

@SpringBootTest
@ActiveProfiles("test")
class RegistrationConcurrencyIntegrationTest extends AbstractPostgresContainerTest {

  private static final int THREADS = 8;

  @Autowired private IdentityResolveService identityResolveService;
  @Autowired private UpstreamRegistrationService upstreamRegistrationService;
  @Autowired private UserRepository userRepository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @MockitoBean private UpstreamUserClient upstreamUserClient;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM users", new MapSqlParameterSource());
  }

  @Test
  void concurrentFirstResolveCreatesSingleRow() throws Exception {
    final List<UserRecord> resolved =
        runConcurrently(() -> identityResolveService.resolve("auth0|race", "race@example.com"));

    final Set<String> ids = new HashSet<>();
    resolved.forEach(user -> ids.add(user.id()));
    assertThat(ids).hasSize(1);
    assertThat(
            jdbcTemplate.queryForObject(
                "SELECT count(*) FROM users WHERE external_identity_id = :id",
                new MapSqlParameterSource("id", "auth0|race"),
                Integer.class))
        .isEqualTo(1);
  }

  @Test
  void concurrentRegistrationLinksExactlyOnce() throws Exception {
    final UserRecord user = identityResolveService.resolve("auth0|link", "link@example.com");
    when(upstreamUserClient.createOrFindUser(eq("auth0|link"), eq("link@example.com")))
        .thenReturn(new UpstreamUser("ow-123", "auth0|link", "link@example.com"));

    final List<RegistrationResult> results =
        runConcurrently(() -> upstreamRegistrationService.ensureRegistered(user));

    assertThat(results).allSatisfy(r -> assertThat(r.upstreamUserId()).isEqualTo("ow-123"));
    assertThat(results)
        .filteredOn(r -> r.outcome() == RegistrationOutcome.LINKED)
        .hasSize(1);
    assertThat(results)
        .filteredOn(r -> r.outcome() == RegistrationOutcome.LINKED_CONCURRENTLY)
        .hasSize(THREADS - 1);
    assertThat(userRepository.findById(user.id()))
        .get()
        .extracting(UserRecord::upstreamUserId)
        .isEqualTo("ow-123");
  }

  private <T> List<T> runConcurrently(Callable<T> task) throws Exception {
    final ExecutorService executor = Executors.newFixedThreadPool(THREADS);
    final CountDownLatch start = new CountDownLatch(1);
    try {
      final List<Future<T>> futures = new ArrayList<>();
      for (int i = 0; i < THREADS; i++) {
        futures.add(
            executor.submit(
                () -> {
                  start.await();
                  return task.call();
                }));
      }
      start.countDown();
      final List<T> results = new ArrayList<>();
      for (Future<T> future : futures) {
        results.add(future.get(30, TimeUnit.SECONDS));
      }
      return results;
    } finally {
      executor.shutdownNow();
    }
  }
}
