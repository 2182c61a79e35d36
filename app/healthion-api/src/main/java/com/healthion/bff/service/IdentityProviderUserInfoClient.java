package com.healthion.bff.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.healthion.bff.config.IdentityProviderProperties;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/** token に email が無い場合の補完用。失敗は空として返し、呼び出し側が代替値を決める。 */
@Service
@RequiredArgsConstructor
public class IdentityProviderUserInfoClient {

  private static final Logger logger =
      LoggerFactory.getLogger(IdentityProviderUserInfoClient.class);

  private final RestClient identityProviderRestClient;
  private final IdentityProviderProperties properties;

  public Optional<String> fetchEmail(String accessToken) {
    if (accessToken == null || accessToken.isBlank()) {
      return Optional.empty();
    }
    try {
      final JsonNode response =
          identityProviderRestClient
              .get()
              .uri(properties.userinfoPath())
              .header(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken)
              .retrieve()
              .body(JsonNode.class);
      if (response == null) {
        logger.warn("identity provider userinfo returned empty body");
        return Optional.empty();
      }
      final String email = response.path("email").asText("");
      return email.isBlank() ? Optional.empty() : Optional.of(email);
    } catch (RestClientException ex) {
      logger.warn("identity provider userinfo failed: {}", ex.getMessage());
      return Optional.empty();
    }
  }
}
