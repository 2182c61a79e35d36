package com.healthion.bff.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "healthion.upstream")
public record UpstreamClientProperties(
    String baseUrl,
    String apiKey,
    String apiKeyHeaderName,
    Duration connectTimeout,
    Duration readTimeout,
    Duration importReadTimeout) {

  @ConstructorBinding
  public UpstreamClientProperties {
    baseUrl =
        baseUrl == null || baseUrl.isBlank()
            ? "http://open-wearables:8000"
            : stripTrailingSlash(baseUrl);
    apiKey = apiKey == null ? "" : apiKey;
    apiKeyHeaderName =
        apiKeyHeaderName == null || apiKeyHeaderName.isBlank()
            ? "X-Open-Wearables-API-Key"
            : apiKeyHeaderName;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(5) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(30) : readTimeout;
    importReadTimeout = importReadTimeout == null ? Duration.ofMinutes(5) : importReadTimeout;
  }

  public UpstreamClientProperties(String baseUrl, String apiKey) {
    this(baseUrl, apiKey, null, null, null, null);
  }

  public boolean isConfigured() {
    return !apiKey.isBlank();
  }

  private static String stripTrailingSlash(String value) {
    String result = value;
    while (result.endsWith("/")) {
      result = result.substring(0, result.length() - 1);
    }
    return result;
  }
}
