package com.healthion.bff.model;

import java.util.List;

public record TimeseriesQuery(
    String startTime,
    String endTime,
    List<String> types,
    int limit,
    String resolution,
    String cursor) {

  public TimeseriesQuery {
    types = types == null || types.isEmpty() ? List.of("heart_rate") : List.copyOf(types);
    resolution = resolution == null || resolution.isBlank() ? "raw" : resolution;
  }

  public String seriesType() {
    return String.join(",", types);
  }
}
