/*
 * どこで: Healthion サービス層
 * 何を: upstream のイベント/サマリー応答 (snake_case の JSON) を API 応答レコードへ詰め替える
 * なぜ: upstream のフィールド追加や欠落をフロントエンドへ漏らさず、既定値をここで一箇所に揃えるため
 */
package com.healthion.bff.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.healthion.bff.api.response.ActivitySummary;
import com.healthion.bff.api.response.BloodPressure;
import com.healthion.bff.api.response.BodySummary;
import com.healthion.bff.api.response.DataSource;
import com.healthion.bff.api.response.EventWorkout;
import com.healthion.bff.api.response.RecoverySummary;
import com.healthion.bff.api.response.SleepSession;
import com.healthion.bff.api.response.SleepStages;
import com.healthion.bff.api.response.SleepSummary;
import com.healthion.bff.api.response.Workout;
import com.healthion.bff.api.response.WorkoutDetail;

final class WearablesResponseMapper {

  static final String UNKNOWN = "unknown";

  private WearablesResponseMapper() {}

  static Workout workout(JsonNode node) {
    final String provider = sourceProvider(node);
    return new Workout(
        text(node, "id", null),
        text(node, "type", null),
        provider,
        text(node, "start_time", text(node, "start_datetime", null)),
        text(node, "end_time", text(node, "end_datetime", null)),
        integer(node, "duration_seconds"),
        provider);
  }

  static EventWorkout eventWorkout(JsonNode node) {
    return new EventWorkout(
        text(node, "id", null),
        text(node, "type", UNKNOWN),
        text(node, "name", null),
        text(node, "start_time", null),
        text(node, "end_time", null),
        integer(node, "duration_seconds"),
        dataSource(node),
        decimal(node, "calories_kcal"),
        decimal(node, "distance_meters"),
        integer(node, "avg_heart_rate_bpm"),
        integer(node, "max_heart_rate_bpm"),
        integer(node, "avg_pace_sec_per_km"),
        decimal(node, "elevation_gain_meters"));
  }

  static WorkoutDetail workoutDetail(JsonNode node) {
    return new WorkoutDetail(
        text(node, "id", null),
        text(node, "type", UNKNOWN),
        text(node, "name", null),
        text(node, "start_time", null),
        text(node, "end_time", null),
        integer(node, "duration_seconds"),
        dataSource(node),
        decimal(node, "calories_kcal"),
        decimal(node, "distance_meters"),
        integer(node, "avg_heart_rate_bpm"),
        integer(node, "max_heart_rate_bpm"),
        integer(node, "avg_pace_sec_per_km"),
        decimal(node, "elevation_gain_meters"),
        decimal(node, "avg_speed_mps"),
        decimal(node, "max_speed_mps"),
        integer(node, "avg_cadence"),
        integer(node, "avg_power_watts"),
        decimal(node, "training_effect_aerobic"),
        decimal(node, "training_effect_anaerobic"));
  }

  static SleepSession sleepSession(JsonNode node) {
    return new SleepSession(
        text(node, "id", null),
        text(node, "start_time", null),
        text(node, "end_time", null),
        dataSource(node),
        node.path("duration_seconds").asInt(0),
        decimal(node, "efficiency_percent"),
        sleepStages(node.get("stages")),
        node.path("is_nap").asBoolean(false));
  }

  static ActivitySummary activitySummary(JsonNode node) {
    return new ActivitySummary(
        text(node, "date", null),
        dataSource(node),
        integer(node, "steps"),
        decimal(node, "distance_meters"),
        integer(node, "floors_climbed"),
        decimal(node, "active_calories_kcal"),
        decimal(node, "total_calories_kcal"),
        integer(node, "active_duration_seconds"),
        integer(node, "sedentary_duration_seconds"));
  }

  static SleepSummary sleepSummary(JsonNode node) {
    return new SleepSummary(
        text(node, "date", null),
        dataSource(node),
        text(node, "start_time", null),
        text(node, "end_time", null),
        integer(node, "duration_seconds"),
        integer(node, "time_in_bed_seconds"),
        decimal(node, "efficiency_percent"),
        sleepStages(node.get("stages")),
        integer(node, "interruptions_count"),
        integer(node, "avg_heart_rate_bpm"),
        decimal(node, "avg_hrv_rmssd_ms"),
        decimal(node, "avg_respiratory_rate"),
        decimal(node, "avg_spo2_percent"));
  }

  static RecoverySummary recoverySummary(JsonNode node) {
    return new RecoverySummary(
        text(node, "date", null),
        dataSource(node),
        integer(node, "sleep_duration_seconds"),
        decimal(node, "sleep_efficiency_percent"),
        integer(node, "resting_heart_rate_bpm"),
        decimal(node, "avg_hrv_rmssd_ms"),
        decimal(node, "avg_spo2_percent"),
        integer(node, "recovery_score"));
  }

  static BodySummary bodySummary(JsonNode node) {
    return new BodySummary(
        text(node, "date", null),
        dataSource(node),
        decimal(node, "weight_kg"),
        decimal(node, "body_fat_percent"),
        decimal(node, "muscle_mass_kg"),
        decimal(node, "bmi"),
        integer(node, "resting_heart_rate_bpm"),
        decimal(node, "avg_hrv_rmssd_ms"),
        bloodPressure(node.get("blood_pressure")),
        decimal(node, "basal_body_temperature_celsius"));
  }

  /** source オブジェクトの provider、なければ source_name、provider_id の順で provider 名を決める。 */
  static String sourceProvider(JsonNode node) {
    final JsonNode source = node.get("source");
    if (source != null && source.isObject()) {
      final String provider = text(source, "provider", null);
      if (provider != null) {
        return provider;
      }
    }
    return text(node, "source_name", text(node, "provider_id", null));
  }

  static DataSource dataSource(JsonNode node) {
    final JsonNode source = node.get("source");
    if (source == null || !source.isObject()) {
      return new DataSource(UNKNOWN, null);
    }
    return new DataSource(text(source, "provider", UNKNOWN), text(source, "device", null));
  }

  static SleepStages sleepStages(JsonNode stages) {
    if (isEmpty(stages)) {
      return null;
    }
    return new SleepStages(
        integer(stages, "awake_seconds"),
        integer(stages, "light_seconds"),
        integer(stages, "deep_seconds"),
        integer(stages, "rem_seconds"));
  }

  static BloodPressure bloodPressure(JsonNode bloodPressure) {
    if (isEmpty(bloodPressure)) {
      return null;
    }
    return new BloodPressure(
        integer(bloodPressure, "systolic_mmhg"), integer(bloodPressure, "diastolic_mmhg"));
  }

  static String text(JsonNode node, String field, String defaultValue) {
    final JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      return defaultValue;
    }
    final String text = value.asText();
    return text.isEmpty() ? defaultValue : text;
  }

  // 数値以外 (欠落/null/文字列) は未計測として null にする
  private static Integer integer(JsonNode node, String field) {
    final JsonNode value = node.get(field);
    return value != null && value.isNumber() ? value.asInt() : null;
  }

  private static Double decimal(JsonNode node, String field) {
    final JsonNode value = node.get(field);
    return value != null && value.isNumber() ? value.asDouble() : null;
  }

  private static boolean isEmpty(JsonNode node) {
    return node == null || !node.isObject() || node.isEmpty();
  }
}
