package com.healthion.bff.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.test.util.ReflectionTestUtils;

class IdentityProviderClientConfigTest {

  @Test
  void userinfoRequestsAreBoundedByConfiguredTimeouts() {
    final IdentityProviderProperties properties =
        new IdentityProviderProperties(
            "https://issuer.test/",
            "",
            null,
            null,
            null,
            Duration.ofMillis(1500),
            Duration.ofSeconds(4));

    final SimpleClientHttpRequestFactory factory =
        IdentityProviderClientConfig.userinfoRequestFactory(properties);

    assertThat(ReflectionTestUtils.getField(factory, "connectTimeout")).isEqualTo(1500);
    assertThat(ReflectionTestUtils.getField(factory, "readTimeout")).isEqualTo(4000);
  }

  @Test
  void unsetTimeoutsFallBackToDefaults() {
    final SimpleClientHttpRequestFactory factory =
        IdentityProviderClientConfig.userinfoRequestFactory(
            new IdentityProviderProperties("https://issuer.test/", "", null, null, null));

    assertThat(ReflectionTestUtils.getField(factory, "connectTimeout")).isEqualTo(5000);
    assertThat(ReflectionTestUtils.getField(factory, "readTimeout")).isEqualTo(10000);
  }
}
