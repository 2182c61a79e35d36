package com.healthion.bff.api.response;

import java.util.List;

public record WorkoutsResponse(List<Workout> workouts, int total) {

  public WorkoutsResponse {
    workouts = workouts == null ? List.of() : List.copyOf(workouts);
  }
}
