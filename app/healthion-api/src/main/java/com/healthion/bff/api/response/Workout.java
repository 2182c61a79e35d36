package com.healthion.bff.api.response;

public record Workout(
    String id,
    String type,
    String sourceName,
    String startDatetime,
    String endDatetime,
    Integer durationSeconds,
    String provider) {}
