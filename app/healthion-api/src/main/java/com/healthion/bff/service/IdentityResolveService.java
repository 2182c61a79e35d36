package com.healthion.bff.service;

import com.healthion.bff.model.UserRecord;
import com.healthion.bff.repository.UserRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** 外部 IdP の subject からローカルユーザーを取得または作成する。 */
@Service
@RequiredArgsConstructor
public class IdentityResolveService {

  private static final Logger logger = LoggerFactory.getLogger(IdentityResolveService.class);

  private final UserRepository userRepository;
  private final Clock clock;

  @Transactional
  public UserRecord resolve(String externalIdentityId, String email) {
    if (isBlank(externalIdentityId)) {
      throw new IllegalArgumentException("externalIdentityId is required");
    }
    if (isBlank(email)) {
      throw new IllegalArgumentException("email is required");
    }

    try {
      final Optional<UserRecord> existing =
          userRepository.findByExternalIdentityId(externalIdentityId);
      if (existing.isPresent()) {
        return refreshEmail(existing.get(), email);
      }

      final Instant now = Instant.now(clock);
      final UserRecord candidate =
          new UserRecord(UUID.randomUUID().toString(), externalIdentityId, email, null, now, now);
      final int inserted = userRepository.insertIfAbsent(candidate);
      final UserRecord stored =
          userRepository
              .findByExternalIdentityId(externalIdentityId)
              .orElseThrow(
                  () ->
                      new UserPersistenceException(
                          candidate.id(), "resolve identity", "row not found after insert"));
      if (inserted == 1) {
        logger.info("user created user_id={}", stored.id());
      } else if (!stored.email().equals(email)) {
        return refreshEmail(stored, email);
      }
      return stored;
    } catch (DataIntegrityViolationException ex) {
      logger.warn("email is already bound to another identity");
      throw new IdentityConflictException("email is already used by another account", ex);
    } catch (DataAccessException ex) {
      throw UserPersistenceException.forIdentity(externalIdentityId, "resolve identity", ex);
    }
  }

  private UserRecord refreshEmail(UserRecord user, String email) {
    if (user.email().equals(email)) {
      return user;
    }
    final UserRecord updated =
        userRepository
            .updateEmail(user.id(), email, Instant.now(clock))
            .orElseThrow(
                () -> new UserPersistenceException(user.id(), "update email", "row not found"));
    logger.info("user email updated user_id={}", user.id());
    return updated;
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
