/*
 * どこで: Healthion サービス層
 * 何を: ローカルユーザーを wearables platform のユーザーへ一度だけ紐付ける
 * なぜ: 同時リクエストでも users.upstream_user_id が最初の書き込みのまま変わらないようにするため
 */
package com.healthion.bff.service;

import com.healthion.bff.model.RegistrationOutcome;
import com.healthion.bff.model.RegistrationResult;
import com.healthion.bff.model.UpstreamUser;
import com.healthion.bff.model.UserRecord;
import com.healthion.bff.repository.UserRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class UpstreamRegistrationService {

  private static final Logger logger = LoggerFactory.getLogger(UpstreamRegistrationService.class);

  private final UpstreamUserClient upstreamUserClient;
  private final UserRepository userRepository;
  private final HealthionMetrics metrics;
  private final Clock clock;

  /**
   * ユーザーが upstream に未登録なら登録し、紐付けを保存する。
   *
   * <p>upstream 呼び出し中は DB のトランザクションもロックも保持しない。保存は {@code upstream_user_id IS NULL}
   * を条件にした単一 UPDATE で行い、更新件数 0 は他リクエストが先に紐付けたことを意味する。その場合は保存済みの値を返す。
   *
   * @param user 解決済みのローカルユーザー
   * @return 保存後のユーザーと結果種別
   * @throws UpstreamIntegrationException upstream 呼び出しに失敗した場合。ローカルの書き込みは行わない
   * @throws UserPersistenceException 条件付き UPDATE または再読込に失敗した場合
   */
  public RegistrationResult ensureRegistered(@NonNull UserRecord user) {
    if (user.isLinkedUpstream()) {
      metrics.recordRegistration("already_linked");
      return new RegistrationResult(user, RegistrationOutcome.ALREADY_LINKED);
    }

    final UpstreamUser upstreamUser;
    try {
      upstreamUser = upstreamUserClient.createOrFindUser(user.externalIdentityId(), user.email());
    } catch (UpstreamIntegrationException ex) {
      metrics.recordRegistration("upstream_error");
      logger.warn(
          "upstream registration failed user_id={} reason={}", user.id(), ex.reason());
      throw new UpstreamIntegrationException(
          ex.reason(),
          "ensure registered failed for user_id=" + user.id() + ": " + ex.getMessage(),
          ex);
    }

    final int updated;
    try {
      updated =
          userRepository.linkUpstreamUserIfAbsent(
              user.id(), upstreamUser.id(), Instant.now(clock));
    } catch (DataAccessException ex) {
      metrics.recordRegistration("persistence_error");
      logger.error("upstream link write failed user_id={}", user.id(), ex);
      throw new UserPersistenceException(user.id(), "link upstream user", ex);
    }

    final UserRecord stored = reload(user.id());
    if (updated == 0) {
      if (!stored.isLinkedUpstream()) {
        metrics.recordRegistration("persistence_error");
        throw new UserPersistenceException(
            user.id(), "link upstream user", "no row updated and no link stored");
      }
      metrics.recordRegistration("linked_concurrently");
      logger.info(
          "upstream link already stored by another request user_id={} stored={} discarded={}",
          user.id(),
          stored.upstreamUserId(),
          upstreamUser.id());
      return new RegistrationResult(stored, RegistrationOutcome.LINKED_CONCURRENTLY);
    }

    metrics.recordRegistration("linked");
    logger.info(
        "upstream link stored user_id={} upstream_user_id={}", user.id(), stored.upstreamUserId());
    return new RegistrationResult(stored, RegistrationOutcome.LINKED);
  }

  private UserRecord reload(String userId) {
    final Optional<UserRecord> stored;
    try {
      stored = userRepository.findById(userId);
    } catch (DataAccessException ex) {
      metrics.recordRegistration("persistence_error");
      throw new UserPersistenceException(userId, "reload user", ex);
    }
    if (stored.isEmpty()) {
      metrics.recordRegistration("persistence_error");
      throw new UserPersistenceException(userId, "reload user", "row not found");
    }
    return stored.get();
  }
}
