/*
 * どこで: Healthion サービス層
 * 何を: wearables API の業務ロジック (未連携時の扱いと upstream 応答の整形)
 * なぜ: upstream の応答形式の揺れをここで吸収し、フロントエンドへ安定した形で返すため
 */
package com.healthion.bff.service;

import static com.healthion.bff.service.WearablesResponseMapper.text;

import com.fasterxml.jackson.databind.JsonNode;
import com.healthion.bff.api.request.SyncRequest;
import com.healthion.bff.api.response.AppleHealthImportResponse;
import com.healthion.bff.api.response.AuthorizationResponse;
import com.healthion.bff.api.response.ConnectionsResponse;
import com.healthion.bff.api.response.EventWorkout;
import com.healthion.bff.api.response.PageResponse;
import com.healthion.bff.api.response.ProvidersResponse;
import com.healthion.bff.api.response.RegisterUpstreamResponse;
import com.healthion.bff.api.response.SleepSession;
import com.healthion.bff.api.response.SyncResponse;
import com.healthion.bff.api.response.TimeseriesDataPoint;
import com.healthion.bff.api.response.TimeseriesResponse;
import com.healthion.bff.api.response.WearableConnection;
import com.healthion.bff.api.response.WearableProvider;
import com.healthion.bff.api.response.Workout;
import com.healthion.bff.api.response.WorkoutDetail;
import com.healthion.bff.api.response.WorkoutsResponse;
import com.healthion.bff.model.CurrentUser;
import com.healthion.bff.model.DateRangeQuery;
import com.healthion.bff.model.RegistrationResult;
import com.healthion.bff.model.SummaryKind;
import com.healthion.bff.model.TimeseriesQuery;
import com.healthion.bff.model.UserRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class WearablesService {

  private static final Logger logger = LoggerFactory.getLogger(WearablesService.class);

  private final WearablesDataClient dataClient;
  private final UpstreamRegistrationService upstreamRegistrationService;

  public RegisterUpstreamResponse register(CurrentUser currentUser) {
    final RegistrationResult result =
        upstreamRegistrationService.ensureRegistered(currentUser.user());
    return new RegisterUpstreamResponse(result.upstreamUserId(), result.alreadyRegistered());
  }

  public ProvidersResponse getProviders(boolean enabledOnly, boolean cloudOnly) {
    final List<WearableProvider> providers = new ArrayList<>();
    for (JsonNode provider : elements(dataClient.getProviders(enabledOnly, cloudOnly))) {
      final String name = provider.path("name").asText("");
      providers.add(
          new WearableProvider(
              name,
              text(provider, "display_name", titleCase(name)),
              text(provider, "icon_url", null),
              provider.path("has_cloud_api").asBoolean(true),
              provider.path("is_enabled").asBoolean(true)));
    }
    return new ProvidersResponse(providers);
  }

  /** 認可 URL を返す。未連携ユーザーはこの時点で登録し、失敗はそのまま呼び出し元へ返す。 */
  public AuthorizationResponse getAuthorizationUrl(
      CurrentUser currentUser, String provider, String redirectUri) {
    final String upstreamUserId = ensureLinked(currentUser.user());
    final JsonNode result =
        dataClient.getAuthorizationUrl(provider, upstreamUserId, redirectUri);
    return new AuthorizationResponse(result.path("authorization_url").asText(""), provider);
  }

  public ConnectionsResponse getConnections(CurrentUser currentUser) {
    final UserRecord user = currentUser.user();
    if (!user.isLinkedUpstream()) {
      return new ConnectionsResponse(List.of(), null);
    }
    final List<WearableConnection> connections = new ArrayList<>();
    for (JsonNode connection : elements(dataClient.getConnections(user.upstreamUserId()))) {
      connections.add(
          new WearableConnection(
              text(connection, "id", null),
              connection.path("provider").asText(""),
              text(connection, "created_at", null),
              "active".equals(connection.path("status").asText()),
              text(connection, "last_synced_at", null)));
    }
    return new ConnectionsResponse(connections, user.upstreamUserId());
  }

  public TimeseriesResponse getTimeseries(CurrentUser currentUser, TimeseriesQuery query) {
    final UserRecord user = currentUser.user();
    if (!user.isLinkedUpstream()) {
      return new TimeseriesResponse(List.of(), query.seriesType(), user.id(), 0);
    }
    final JsonNode result = dataClient.getTimeseries(user.upstreamUserId(), query);
    final List<TimeseriesDataPoint> points = new ArrayList<>();
    for (JsonNode item : result.path("data")) {
      final JsonNode value = item.has("value") ? item.get("value") : item.path("bpm");
      points.add(
          new TimeseriesDataPoint(
              text(item, "timestamp", text(item, "recorded_at", null)),
              text(item, "type", null),
              value.asDouble(0),
              text(item, "unit", "bpm")));
    }
    return new TimeseriesResponse(points, query.seriesType(), user.id(), points.size());
  }

  public SyncResponse sync(CurrentUser currentUser, SyncRequest request) {
    final String upstreamUserId = requireLinked(currentUser.user());
    final JsonNode result =
        dataClient.syncUserData(upstreamUserId, request.provider(), request.dataType());
    final SyncResponse response =
        new SyncResponse(
            text(result, "status", "success"),
            text(result, "message", null),
            result.path("synced_count").asInt(0));
    logger.info(
        "sync requested provider={} dataType={} status={}",
        request.provider(),
        request.dataType(),
        response.status());
    return response;
  }

  /** 直近のワークアウト一覧。未連携ユーザーには空の一覧を返す。 */
  public WorkoutsResponse getWorkouts(CurrentUser currentUser, int limit) {
    final UserRecord user = currentUser.user();
    if (!user.isLinkedUpstream()) {
      return new WorkoutsResponse(List.of(), 0);
    }
    final List<Workout> workouts = new ArrayList<>();
    for (JsonNode workout : elements(dataClient.getWorkouts(user.upstreamUserId(), limit))) {
      workouts.add(WearablesResponseMapper.workout(workout));
    }
    return new WorkoutsResponse(workouts, workouts.size());
  }

  public PageResponse<EventWorkout> getWorkoutEvents(
      CurrentUser currentUser, DateRangeQuery query, String workoutType) {
    final UserRecord user = currentUser.user();
    if (!user.isLinkedUpstream()) {
      return PageResponse.empty();
    }
    return toPage(
        dataClient.getEventWorkouts(user.upstreamUserId(), query, workoutType),
        WearablesResponseMapper::eventWorkout);
  }

  public PageResponse<SleepSession> getSleepSessions(
      CurrentUser currentUser, DateRangeQuery query) {
    final UserRecord user = currentUser.user();
    if (!user.isLinkedUpstream()) {
      return PageResponse.empty();
    }
    return toPage(
        dataClient.getSleepSessions(user.upstreamUserId(), query),
        WearablesResponseMapper::sleepSession);
  }

  /** 日次サマリー。要素の型は {@code kind} によって決まる。 */
  public PageResponse<?> getSummary(
      CurrentUser currentUser, SummaryKind kind, DateRangeQuery query) {
    final UserRecord user = currentUser.user();
    if (!user.isLinkedUpstream()) {
      return PageResponse.empty();
    }
    final JsonNode result = dataClient.getSummary(user.upstreamUserId(), kind, query);
    switch (kind) {
      case ACTIVITY:
        return toPage(result, WearablesResponseMapper::activitySummary);
      case SLEEP:
        return toPage(result, WearablesResponseMapper::sleepSummary);
      case RECOVERY:
        return toPage(result, WearablesResponseMapper::recoverySummary);
      case BODY:
        return toPage(result, WearablesResponseMapper::bodySummary);
      default:
        throw new IllegalArgumentException("unsupported summary kind: " + kind);
    }
  }

  public WorkoutDetail getWorkoutDetail(
      CurrentUser currentUser, String provider, String workoutId) {
    final String upstreamUserId = requireLinked(currentUser.user());
    final JsonNode result = dataClient.getWorkoutDetail(upstreamUserId, provider, workoutId);
    if (result == null || !result.isObject()) {
      throw new UpstreamIntegrationException(
          UpstreamIntegrationException.Reason.INVALID_RESPONSE,
          "upstream workout detail is not an object");
    }
    return WearablesResponseMapper.workoutDetail(result);
  }

  public AppleHealthImportResponse importAppleHealth(CurrentUser currentUser, String fileKey) {
    if (fileKey == null || fileKey.isBlank()) {
      throw new IllegalArgumentException("fileKey is required");
    }
    final String upstreamUserId = requireLinked(currentUser.user());
    final JsonNode result = dataClient.importAppleHealthXml(upstreamUserId, fileKey);
    final List<String> errors = new ArrayList<>();
    for (JsonNode error : result.path("errors")) {
      errors.add(error.asText());
    }
    return new AppleHealthImportResponse(
        text(result, "status", "success"),
        text(result, "message", null),
        result.path("records_imported").asInt(0),
        result.path("workouts_imported").asInt(0),
        errors);
  }

  private String ensureLinked(UserRecord user) {
    if (user.isLinkedUpstream()) {
      return user.upstreamUserId();
    }
    return upstreamRegistrationService.ensureRegistered(user).upstreamUserId();
  }

  private String requireLinked(UserRecord user) {
    if (!user.isLinkedUpstream()) {
      throw new UpstreamNotLinkedException(user.id());
    }
    return user.upstreamUserId();
  }

  private <T> PageResponse<T> toPage(JsonNode result, Function<JsonNode, T> mapper) {
    final List<T> data = new ArrayList<>();
    for (JsonNode item : result.path("data")) {
      data.add(mapper.apply(item));
    }
    final JsonNode pagination = result.path("pagination");
    return new PageResponse<>(
        data, pagination.path("has_more").asBoolean(false), text(pagination, "next_cursor", null));
  }

  private List<JsonNode> elements(JsonNode node) {
    if (!node.isArray()) {
      throw new UpstreamIntegrationException(
          UpstreamIntegrationException.Reason.INVALID_RESPONSE, "upstream response is not a list");
    }
    final List<JsonNode> elements = new ArrayList<>();
    node.forEach(elements::add);
    return elements;
  }

  private static String titleCase(String name) {
    if (name.isEmpty()) {
      return name;
    }
    return name.substring(0, 1).toUpperCase(Locale.ROOT)
        + name.substring(1).toLowerCase(Locale.ROOT);
  }
}
