package com.healthion.bff.api.response;

public record ActivitySummary(
    String date,
    DataSource source,
    Integer steps,
    Double distanceMeters,
    Integer floorsClimbed,
    Double activeCaloriesKcal,
    Double totalCaloriesKcal,
    Integer activeDurationSeconds,
    Integer sedentaryDurationSeconds) {}
