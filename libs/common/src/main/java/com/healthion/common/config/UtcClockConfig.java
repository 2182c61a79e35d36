package com.healthion.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** アプリ全体で共有する UTC の {@link Clock}。テストでは固定 Clock に差し替える。 */
@Configuration(proxyBeanMethods = false)
public class UtcClockConfig {

  @Bean
  public Clock utcClock() {
    return Clock.systemUTC();
  }
}
