/*
 * どこで: Healthion サービス層
 * 何を: email 単位のプロセス内ロックを払い出す
 * なぜ: 同一 JVM 内で upstream の find→create が並走し重複作成されるのを抑えるため
 */
package com.healthion.bff.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.google.common.annotations.VisibleForTesting;
import com.healthion.bff.config.RegistrationLockProperties;
import java.util.Locale;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.springframework.stereotype.Component;

/**
 * email ごとの {@link ReentrantLock} を上限付きで保持する。
 *
 * <p>エントリは件数上限とアクセス後の期限で破棄される。保持中のロックが破棄された場合は同一 email に新しいロックが払い出されるため、直列化は
 * 最適化としてのみ扱う。整合性は users テーブルの条件付き UPDATE が保証する。
 */
@Component
public class RegistrationLocks {

  private final Cache<String, ReentrantLock> locks;

  public RegistrationLocks(RegistrationLockProperties properties) {
    this.locks =
        Caffeine.newBuilder()
            .maximumSize(properties.lockMaxKeys())
            .expireAfterAccess(properties.lockExpireAfterAccess())
            .build();
  }

  public <T> T withLock(String email, Supplier<T> action) {
    final ReentrantLock lock = locks.get(normalize(email), ignored -> new ReentrantLock());
    lock.lock();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }

  @VisibleForTesting
  long estimatedSize() {
    locks.cleanUp();
    return locks.estimatedSize();
  }

  private String normalize(String email) {
    if (email == null || email.isBlank()) {
      throw new IllegalArgumentException("email is required");
    }
    return email.trim().toLowerCase(Locale.ROOT);
  }
}
