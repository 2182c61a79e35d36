package com.healthion.bff.api.response;

public record RecoverySummary(
    String date,
    DataSource source,
    Integer sleepDurationSeconds,
    Double sleepEfficiencyPercent,
    Integer restingHeartRateBpm,
    Double avgHrvRmssdMs,
    Double avgSpo2Percent,
    Integer recoveryScore) {}
