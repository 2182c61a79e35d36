package com.healthion.bff.api;

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
import com.healthion.bff.api.response.TimeseriesResponse;
import com.healthion.bff.api.response.WorkoutDetail;
import com.healthion.bff.api.response.WorkoutsResponse;
import com.healthion.bff.model.DateRangeQuery;
import com.healthion.bff.model.SummaryKind;
import com.healthion.bff.model.TimeseriesQuery;
import com.healthion.bff.service.CurrentUserService;
import com.healthion.bff.service.WearablesService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Validated
@RequestMapping("/v1/wearables")
@RequiredArgsConstructor
public class WearablesController {

  private final CurrentUserService currentUserService;
  private final WearablesService wearablesService;

  @PostMapping("/register")
  public ResponseEntity<RegisterUpstreamResponse> register(JwtAuthenticationToken authentication) {
    return ResponseEntity.ok(wearablesService.register(currentUserService.resolve(authentication)));
  }

  @GetMapping("/providers")
  public ResponseEntity<ProvidersResponse> providers(
      @RequestParam(name = "enabledOnly", defaultValue = "true") boolean enabledOnly,
      @RequestParam(name = "cloudOnly", defaultValue = "true") boolean cloudOnly) {
    return ResponseEntity.ok(wearablesService.getProviders(enabledOnly, cloudOnly));
  }

  @GetMapping("/authorize/{provider}")
  public ResponseEntity<AuthorizationResponse> authorize(
      JwtAuthenticationToken authentication,
      @PathVariable("provider") String provider,
      @RequestParam(name = "redirectUri", required = false) String redirectUri) {
    return ResponseEntity.ok(
        wearablesService.getAuthorizationUrl(
            currentUserService.resolve(authentication), provider, redirectUri));
  }

  @GetMapping("/connections")
  public ResponseEntity<ConnectionsResponse> connections(JwtAuthenticationToken authentication) {
    return ResponseEntity.ok(
        wearablesService.getConnections(currentUserService.resolve(authentication)));
  }

  @GetMapping("/timeseries")
  public ResponseEntity<TimeseriesResponse> timeseries(
      JwtAuthenticationToken authentication,
      @RequestParam("startTime") String startTime,
      @RequestParam("endTime") String endTime,
      @RequestParam(name = "types", required = false) List<String> types,
      @RequestParam(name = "limit", defaultValue = "50") @Min(1) @Max(100) int limit,
      @RequestParam(name = "resolution", defaultValue = "raw") String resolution,
      @RequestParam(name = "cursor", required = false) String cursor) {
    final TimeseriesQuery query =
        new TimeseriesQuery(startTime, endTime, types, limit, resolution, cursor);
    return ResponseEntity.ok(
        wearablesService.getTimeseries(currentUserService.resolve(authentication), query));
  }

  @PostMapping("/sync")
  public ResponseEntity<SyncResponse> sync(
      JwtAuthenticationToken authentication, @Valid @RequestBody SyncRequest request) {
    return ResponseEntity.ok(
        wearablesService.sync(currentUserService.resolve(authentication), request));
  }

  @GetMapping("/workouts")
  public ResponseEntity<WorkoutsResponse> workouts(
      JwtAuthenticationToken authentication,
      @RequestParam(name = "limit", defaultValue = "50") @Min(1) @Max(100) int limit) {
    return ResponseEntity.ok(
        wearablesService.getWorkouts(currentUserService.resolve(authentication), limit));
  }

  @GetMapping("/events/workouts")
  public ResponseEntity<PageResponse<EventWorkout>> workoutEvents(
      JwtAuthenticationToken authentication,
      @RequestParam("startDate") String startDate,
      @RequestParam("endDate") String endDate,
      @RequestParam(name = "workoutType", required = false) String workoutType,
      @RequestParam(name = "limit", defaultValue = "50") @Min(1) @Max(100) int limit,
      @RequestParam(name = "cursor", required = false) String cursor) {
    return ResponseEntity.ok(
        wearablesService.getWorkoutEvents(
            currentUserService.resolve(authentication),
            new DateRangeQuery(startDate, endDate, limit, cursor),
            workoutType));
  }

  @GetMapping("/events/sleep")
  public ResponseEntity<PageResponse<SleepSession>> sleepSessions(
      JwtAuthenticationToken authentication,
      @RequestParam("startDate") String startDate,
      @RequestParam("endDate") String endDate,
      @RequestParam(name = "limit", defaultValue = "50") @Min(1) @Max(100) int limit,
      @RequestParam(name = "cursor", required = false) String cursor) {
    return ResponseEntity.ok(
        wearablesService.getSleepSessions(
            currentUserService.resolve(authentication),
            new DateRangeQuery(startDate, endDate, limit, cursor)));
  }

  @GetMapping("/summaries/{kind}")
  public ResponseEntity<PageResponse<?>> summary(
      JwtAuthenticationToken authentication,
      @PathVariable("kind") String kind,
      @RequestParam("startDate") String startDate,
      @RequestParam("endDate") String endDate,
      @RequestParam(name = "limit", defaultValue = "50") @Min(1) @Max(100) int limit,
      @RequestParam(name = "cursor", required = false) String cursor) {
    final SummaryKind summaryKind = SummaryKind.fromPathSegment(kind);
    return ResponseEntity.ok(
        wearablesService.getSummary(
            currentUserService.resolve(authentication),
            summaryKind,
            new DateRangeQuery(startDate, endDate, limit, cursor)));
  }

  @GetMapping("/workouts/{provider}/{workoutId}")
  public ResponseEntity<WorkoutDetail> workoutDetail(
      JwtAuthenticationToken authentication,
      @PathVariable("provider") String provider,
      @PathVariable("workoutId") String workoutId) {
    return ResponseEntity.ok(
        wearablesService.getWorkoutDetail(
            currentUserService.resolve(authentication), provider, workoutId));
  }

  @PostMapping("/import/apple-health")
  public ResponseEntity<AppleHealthImportResponse> importAppleHealth(
      JwtAuthenticationToken authentication, @RequestParam("fileKey") String fileKey) {
    return ResponseEntity.ok(
        wearablesService.importAppleHealth(currentUserService.resolve(authentication), fileKey));
  }
}
