package com.healthion.bff.api.response;

public record EventWorkout(
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
    Double elevationGainMeters) {}
