/*
 * どこで: Healthion 設定
 * 何を: 外部 IdP (bearer token 発行元) の検証設定を保持する
 * なぜ: issuer/audience/JWK の URL を環境ごとに外部化するため
 */
package com.healthion.bff.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "healthion.identity")
public record IdentityProviderProperties(
    String issuer,
    String audience,
    String jwkSetUri,
    String userinfoPath,
    String fallbackEmailDomain,
    Duration connectTimeout,
    Duration readTimeout) {

  @ConstructorBinding
  public IdentityProviderProperties {
    issuer =
        issuer == null || issuer.isBlank() ? "https://healthion.local/" : withTrailingSlash(issuer);
    audience = audience == null ? "" : audience;
    jwkSetUri =
        jwkSetUri == null || jwkSetUri.isBlank() ? issuer + ".well-known/jwks.json" : jwkSetUri;
    userinfoPath = userinfoPath == null || userinfoPath.isBlank() ? "userinfo" : userinfoPath;
    fallbackEmailDomain =
        fallbackEmailDomain == null || fallbackEmailDomain.isBlank()
            ? "unknown.com"
            : fallbackEmailDomain;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(5) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(10) : readTimeout;
  }

  public IdentityProviderProperties(
      String issuer,
      String audience,
      String jwkSetUri,
      String userinfoPath,
      String fallbackEmailDomain) {
    this(issuer, audience, jwkSetUri, userinfoPath, fallbackEmailDomain, null, null);
  }

  public String namespacedEmailClaim() {
    if (audience.isBlank()) {
      return "email";
    }
    return audience + "/email";
  }

  private static String withTrailingSlash(String value) {
    return value.endsWith("/") ? value : value + "/";
  }
}
