package com.healthion.bff.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "healthion.registration")
public record RegistrationLockProperties(long lockMaxKeys, Duration lockExpireAfterAccess) {

  public RegistrationLockProperties {
    lockMaxKeys = lockMaxKeys <= 0 ? 10_000L : lockMaxKeys;
    lockExpireAfterAccess =
        lockExpireAfterAccess == null
                || lockExpireAfterAccess.isNegative()
                || lockExpireAfterAccess.isZero()
            ? Duration.ofMinutes(10)
            : lockExpireAfterAccess;
  }
}
