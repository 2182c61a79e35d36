package com.healthion.bff.api.response;

public record SleepSummary(
    String date,
    DataSource source,
    String startTime,
    String endTime,
    Integer durationSeconds,
    Integer timeInBedSeconds,
    Double efficiencyPercent,
    SleepStages stages,
    Integer interruptionsCount,
    Integer avgHeartRateBpm,
    Double avgHrvRmssdMs,
    Double avgRespiratoryRate,
    Double avgSpo2Percent) {}
