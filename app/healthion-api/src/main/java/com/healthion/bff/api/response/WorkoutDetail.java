/*
 * どこで: app/healthion-api/src/main/java/com/healthion/bff/api/response/WorkoutDetail.java
 * 何を: 単一ワークアウトの詳細。イベント一覧の項目に速度/ケイデンス/パワー/トレーニング効果を加えたもの
 */
package com.healthion.bff.api.response;

public record WorkoutDetail(
    String id,
    String type,
    String name,
    String startTime,
    String endTime,
    Integer durationSeconds,
    DataSource source,
    Double caloriesKcal,
    Double distanceMeters,
    Integer avgHeartRateBpm,
    Integer maxHeartRateBpm,
    Integer avgPaceSecPerKm,
    Double elevationGainMeters,
    Double avgSpeedMps,
    Double maxSpeedMps,
    Integer avgCadence,
    Integer avgPowerWatts,
    Double trainingEffectAerobic,
    Double trainingEffectAnaerobic) {}
