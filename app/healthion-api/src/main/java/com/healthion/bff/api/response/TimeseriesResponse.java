package com.healthion.bff.api.response;

import java.util.List;

public record TimeseriesResponse(
    List<TimeseriesDataPoint> data, String seriesType, String userId, int count) {

  public TimeseriesResponse {
    data = data == null ? List.of() : List.copyOf(data);
  }
}
