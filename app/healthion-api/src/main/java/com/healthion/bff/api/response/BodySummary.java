package com.healthion.bff.api.response;

public record BodySummary(
    String date,
    DataSource source,
    Double weightKg,
    Double bodyFatPercent,
    Double muscleMassKg,
    Double bmi,
    Integer restingHeartRateBpm,
    Double avgHrvRmssdMs,
    BloodPressure bloodPressure,
    Double basalBodyTemperatureCelsius) {}
