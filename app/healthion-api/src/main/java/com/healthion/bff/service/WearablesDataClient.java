/*
 * どこで: Healthion サービス層
 * 何を: wearables platform のデータ系 API (provider/接続/時系列/同期/イベント/サマリー/import) を呼び出す
 * なぜ: upstream 固有のパラメータ組み立てとエラー吸収をコントローラから切り離すため
 */
package com.healthion.bff.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.healthion.bff.config.UpstreamClientProperties;
import com.healthion.bff.model.DateRangeQuery;
import com.healthion.bff.model.SummaryKind;
import com.healthion.bff.model.TimeseriesQuery;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.util.UriBuilder;

@Service
public class WearablesDataClient {

  private static final Logger logger = LoggerFactory.getLogger(WearablesDataClient.class);

  static final int MAX_PAGE_LIMIT = 100;
  private static final DateTimeFormatter GARMIN_TIME_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss").withZone(ZoneOffset.UTC);
  private static final Duration GARMIN_SYNC_WINDOW = Duration.ofHours(24);
  private static final Duration SUUNTO_SYNC_WINDOW = Duration.ofDays(7);
  static final int RECENT_WORKOUT_DAYS = 30;

  private final RestClient upstreamRestClient;
  private final RestClient upstreamImportRestClient;
  private final UpstreamClientProperties properties;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public WearablesDataClient(
      RestClient upstreamRestClient,
      RestClient upstreamImportRestClient,
      UpstreamClientProperties properties,
      ObjectMapper objectMapper,
      Clock clock) {
    this.upstreamRestClient = upstreamRestClient;
    this.upstreamImportRestClient = upstreamImportRestClient;
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  public JsonNode getProviders(boolean enabledOnly, boolean cloudOnly) {
    UpstreamCalls.requireConfigured(properties);
    return UpstreamCalls.execute(
        "getProviders",
        () ->
            upstreamRestClient
                .get()
                .uri(
                    uriBuilder ->
                        uriBuilder
                            .path("/api/v1/oauth/providers")
                            .queryParam("enabled_only", enabledOnly)
                            .queryParam("cloud_only", cloudOnly)
                            .build())
                .header(properties.apiKeyHeaderName(), properties.apiKey())
                .retrieve()
                .body(JsonNode.class));
  }

  public JsonNode getAuthorizationUrl(String provider, String upstreamUserId, String redirectUri) {
    UpstreamCalls.requireConfigured(properties);
    final String normalizedProvider = normalizeProvider(provider);
    return UpstreamCalls.execute(
        "getAuthorizationUrl",
        () ->
            upstreamRestClient
                .get()
                .uri(
                    uriBuilder -> {
                      final UriBuilder builder =
                          uriBuilder
                              .path("/api/v1/oauth/{provider}/authorize")
                              .queryParam("user_id", upstreamUserId);
                      if (redirectUri != null && !redirectUri.isBlank()) {
                        builder.queryParam("redirect_uri", redirectUri);
                      }
                      return builder.build(normalizedProvider);
                    })
                .header(properties.apiKeyHeaderName(), properties.apiKey())
                .retrieve()
                .body(JsonNode.class));
  }

  public JsonNode getConnections(String upstreamUserId) {
    UpstreamCalls.requireConfigured(properties);
    return UpstreamCalls.execute(
        "getConnections",
        () ->
            upstreamRestClient
                .get()
                .uri("/api/v1/users/{id}/connections", upstreamUserId)
                .header(properties.apiKeyHeaderName(), properties.apiKey())
                .retrieve()
                .body(JsonNode.class));
  }

  public JsonNode getTimeseries(String upstreamUserId, TimeseriesQuery query) {
    UpstreamCalls.requireConfigured(properties);
    return UpstreamCalls.execute(
        "getTimeseries",
        () ->
            upstreamRestClient
                .get()
                .uri(
                    uriBuilder -> {
                      final UriBuilder builder =
                          uriBuilder
                              .path("/api/v1/users/{id}/timeseries")
                              .queryParam("start_time", query.startTime())
                              .queryParam("end_time", query.endTime())
                              .queryParam("limit", capLimit(query.limit()))
                              .queryParam("resolution", query.resolution())
                              .queryParam("types", query.types().toArray());
                      if (query.cursor() != null && !query.cursor().isBlank()) {
                        builder.queryParam("cursor", query.cursor());
                      }
                      return builder.build(upstreamUserId);
                    })
                .header(properties.apiKeyHeaderName(), properties.apiKey())
                .retrieve()
                .body(JsonNode.class));
  }

  /**
   * provider からのデータ同期を upstream へ依頼する。
   *
   * <p>garmin は直近 24 時間、suunto は直近 7 日を対象にする。重複データによる 400 は取り込み件数 0 の成功として扱い、
   * 再接続が必要なエラーと期間超過エラーは失敗結果として返す。
   */
  public JsonNode syncUserData(String upstreamUserId, String provider, String dataType) {
    UpstreamCalls.requireConfigured(properties);
    final String normalizedProvider = normalizeProvider(provider);
    final Instant now = clock.instant();
    return UpstreamCalls.execute(
        "syncUserData",
        () -> {
          try {
            return upstreamRestClient
                .post()
                .uri(
                    uriBuilder -> {
                      final UriBuilder builder =
                          uriBuilder
                              .path("/api/v1/providers/{provider}/users/{id}/sync")
                              .queryParam("data_type", dataType);
                      if ("garmin".equals(normalizedProvider)) {
                        builder
                            .queryParam(
                                "summary_start_time",
                                GARMIN_TIME_FORMAT.format(now.minus(GARMIN_SYNC_WINDOW)))
                            .queryParam("summary_end_time", GARMIN_TIME_FORMAT.format(now));
                      } else if ("suunto".equals(normalizedProvider)) {
                        builder.queryParam(
                            "since", now.minus(SUUNTO_SYNC_WINDOW).getEpochSecond());
                      }
                      return builder.build(normalizedProvider, upstreamUserId);
                    })
                .header(properties.apiKeyHeaderName(), properties.apiKey())
                .retrieve()
                .body(JsonNode.class);
          } catch (RestClientResponseException ex) {
            if (ex.getStatusCode().value() == 400) {
              final JsonNode recognized = recognizeSyncFailure(normalizedProvider, ex);
              if (recognized != null) {
                return recognized;
              }
            }
            throw ex;
          }
        });
  }

  /**
   * 直近 {@value #RECENT_WORKOUT_DAYS} 日のワークアウトを events API から取得し、data 配列だけを返す。
   */
  public JsonNode getWorkouts(String upstreamUserId, int limit) {
    UpstreamCalls.requireConfigured(properties);
    final LocalDate today = LocalDate.now(clock);
    final DateRangeQuery recent =
        new DateRangeQuery(
            today.minusDays(RECENT_WORKOUT_DAYS).toString(), today.toString(), limit, null);
    final JsonNode page = getEventWorkouts(upstreamUserId, recent, null);
    if (page == null || !page.hasNonNull("data")) {
      return objectMapper.createArrayNode();
    }
    return page.get("data");
  }

  public JsonNode getEventWorkouts(
      String upstreamUserId, DateRangeQuery query, String workoutType) {
    UpstreamCalls.requireConfigured(properties);
    return UpstreamCalls.execute(
        "getEventWorkouts",
        () ->
            upstreamRestClient
                .get()
                .uri(
                    uriBuilder -> {
                      final UriBuilder builder =
                          dateRange(uriBuilder.path("/api/v1/users/{id}/events/workouts"), query);
                      if (workoutType != null && !workoutType.isBlank()) {
                        builder.queryParam("type", workoutType);
                      }
                      return builder.build(upstreamUserId);
                    })
                .header(properties.apiKeyHeaderName(), properties.apiKey())
                .retrieve()
                .body(JsonNode.class));
  }

  public JsonNode getSleepSessions(String upstreamUserId, DateRangeQuery query) {
    UpstreamCalls.requireConfigured(properties);
    return UpstreamCalls.execute(
        "getSleepSessions",
        () ->
            upstreamRestClient
                .get()
                .uri(
                    uriBuilder ->
                        dateRange(uriBuilder.path("/api/v1/users/{id}/events/sleep"), query)
                            .build(upstreamUserId))
                .header(properties.apiKeyHeaderName(), properties.apiKey())
                .retrieve()
                .body(JsonNode.class));
  }

  public JsonNode getSummary(String upstreamUserId, SummaryKind kind, DateRangeQuery query) {
    UpstreamCalls.requireConfigured(properties);
    return UpstreamCalls.execute(
        "getSummary",
        () -> {
          try {
            return upstreamRestClient
                .get()
                .uri(
                    uriBuilder ->
                        dateRange(uriBuilder.path("/api/v1/users/{id}/summaries/{kind}"), query)
                            .build(upstreamUserId, kind.pathSegment()))
                .header(properties.apiKeyHeaderName(), properties.apiKey())
                .retrieve()
                .body(JsonNode.class);
          } catch (RestClientResponseException ex) {
            if (ex.getStatusCode().value() == 501) {
              logger.info("upstream summary not implemented kind={}", kind.pathSegment());
              return emptyPage();
            }
            throw ex;
          }
        });
  }

  public JsonNode getWorkoutDetail(String upstreamUserId, String provider, String workoutId) {
    UpstreamCalls.requireConfigured(properties);
    final String normalizedProvider = normalizeProvider(provider);
    return UpstreamCalls.execute(
        "getWorkoutDetail",
        () ->
            upstreamRestClient
                .get()
                .uri(
                    "/api/v1/providers/{provider}/users/{id}/workouts/{workoutId}",
                    normalizedProvider,
                    upstreamUserId,
                    workoutId)
                .header(properties.apiKeyHeaderName(), properties.apiKey())
                .retrieve()
                .body(JsonNode.class));
  }

  public JsonNode importAppleHealthXml(String upstreamUserId, String fileKey) {
    UpstreamCalls.requireConfigured(properties);
    return UpstreamCalls.execute(
        "importAppleHealthXml",
        () ->
            upstreamImportRestClient
                .post()
                .uri("/api/v1/users/{id}/import/apple/xml", upstreamUserId)
                .header(properties.apiKeyHeaderName(), properties.apiKey())
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("file_key", fileKey))
                .retrieve()
                .body(JsonNode.class));
  }

  private UriBuilder dateRange(UriBuilder builder, DateRangeQuery query) {
    builder
        .queryParam("start_date", query.startDate())
        .queryParam("end_date", query.endDate())
        .queryParam("limit", capLimit(query.limit()));
    if (query.cursor() != null && !query.cursor().isBlank()) {
      builder.queryParam("cursor", query.cursor());
    }
    return builder;
  }

  private JsonNode recognizeSyncFailure(String provider, RestClientResponseException ex) {
    final String detail = readDetail(ex.getResponseBodyAsString());
    if (detail.contains("already exists") || detail.contains("UniqueViolation")) {
      logger.info("upstream sync found no new data provider={}", provider);
      return syncResult(true, "success", "Data already synced - no new data to import");
    }
    if (detail.contains("InvalidPullTokenException")) {
      logger.warn("upstream sync rejected expired garmin token");
      return syncResult(false, "error", "Garmin connection expired - please reconnect");
    }
    if (detail.contains("28 days")) {
      logger.warn("upstream sync rejected date range provider={}", provider);
      return syncResult(false, "error", "Suunto sync date range too large - please try again");
    }
    return null;
  }

  private String readDetail(String body) {
    if (body == null || body.isBlank()) {
      return "";
    }
    try {
      return objectMapper.readTree(body).path("detail").asText("");
    } catch (JsonProcessingException ex) {
      logger.debug("upstream error body is not json", ex);
      return "";
    }
  }

  private ObjectNode syncResult(boolean success, String status, String message) {
    final ObjectNode node = objectMapper.createObjectNode();
    node.put("success", success);
    node.put("status", status);
    node.put("message", message);
    node.put("synced_count", 0);
    return node;
  }

  private ObjectNode emptyPage() {
    final ObjectNode node = objectMapper.createObjectNode();
    node.putArray("data");
    node.putObject("pagination").put("has_more", false);
    return node;
  }

  private static int capLimit(int limit) {
    return Math.min(Math.max(limit, 1), MAX_PAGE_LIMIT);
  }

  private static String normalizeProvider(String provider) {
    if (provider == null || provider.isBlank()) {
      throw new IllegalArgumentException("provider is required");
    }
    return provider.trim().toLowerCase(Locale.ROOT);
  }
}
