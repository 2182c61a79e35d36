package com.healthion.bff.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.healthion.bff.config.UpstreamClientProperties;
import com.healthion.bff.model.UpstreamUser;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;

/** wearables platform のユーザー作成・検索。 */
@Service
@RequiredArgsConstructor
public class UpstreamUserClient {

  private static final Logger logger = LoggerFactory.getLogger(UpstreamUserClient.class);
  private static final String USERS_PATH = "/api/v1/users";

  private final RestClient upstreamRestClient;
  private final UpstreamClientProperties properties;
  private final RegistrationLocks registrationLocks;

  public Optional<UpstreamUser> findUserByExternalId(String externalId) {
    if (isBlank(externalId)) {
      throw new IllegalArgumentException("externalId is required");
    }
    UpstreamCalls.requireConfigured(properties);
    final JsonNode page =
        UpstreamCalls.execute(
            "findUserByExternalId",
            () ->
                upstreamRestClient
                    .get()
                    .uri(
                        uriBuilder ->
                            uriBuilder
                                .path(USERS_PATH)
                                .queryParam("external_user_id", externalId)
                                .queryParam("limit", 1)
                                .build())
                    .header(properties.apiKeyHeaderName(), properties.apiKey())
                    .retrieve()
                    .body(JsonNode.class));
    final JsonNode items = page.path("items");
    if (!items.isArray() || items.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(toUpstreamUser(items.get(0)));
  }

  /**
   * external id で既存ユーザーを探し、無ければ作成する。
   *
   * <p>find と create は email 単位のロック内で実行する。別プロセスとの競合は upstream 側の external_user_id
   * の一意性と呼び出し元の条件付き UPDATE に委ねる。
   *
   * @return upstream 側のユーザー。id は必ず非空
   */
  public UpstreamUser createOrFindUser(String externalId, String email) {
    if (isBlank(externalId)) {
      throw new IllegalArgumentException("externalId is required");
    }
    if (isBlank(email)) {
      throw new IllegalArgumentException("email is required");
    }
    UpstreamCalls.requireConfigured(properties);
    return registrationLocks.withLock(
        email,
        () -> {
          final Optional<UpstreamUser> existing = findUserByExternalId(externalId);
          if (existing.isPresent()) {
            logger.info(
                "upstream user already exists externalId={} upstreamUserId={}",
                externalId,
                existing.get().id());
            return existing.get();
          }
          final UpstreamUser created = createUser(externalId, email);
          logger.info(
              "upstream user created externalId={} upstreamUserId={}", externalId, created.id());
          return created;
        });
  }

  private UpstreamUser createUser(String externalId, String email) {
    final Map<String, String> request = new LinkedHashMap<>();
    request.put("external_user_id", externalId);
    request.put("email", email);
    final JsonNode response =
        UpstreamCalls.execute(
            "createUser",
            () ->
                upstreamRestClient
                    .post()
                    .uri(USERS_PATH)
                    .header(properties.apiKeyHeaderName(), properties.apiKey())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(request)
                    .retrieve()
                    .body(JsonNode.class));
    return toUpstreamUser(response);
  }

  private UpstreamUser toUpstreamUser(JsonNode node) {
    String id = node.path("id").asText("");
    if (id.isBlank()) {
      id = node.path("user_id").asText("");
    }
    if (id.isBlank()) {
      logger.warn("upstream user response has no id");
      throw new UpstreamIntegrationException(
          UpstreamIntegrationException.Reason.INVALID_RESPONSE, "upstream user id is missing");
    }
    return new UpstreamUser(
        id, textOrNull(node, "external_user_id"), textOrNull(node, "email"));
  }

  private static String textOrNull(JsonNode node, String field) {
    final JsonNode value = node.get(field);
    return value == null || value.isNull() ? null : value.asText();
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
