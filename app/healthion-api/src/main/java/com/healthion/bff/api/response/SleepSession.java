package com.healthion.bff.api.response;

public record SleepSession(
    String id,
    String startTime,
    String endTime,
    DataSource source,
    int durationSeconds,
    Double efficiencyPercent,
    SleepStages stages,
    boolean isNap) {}
