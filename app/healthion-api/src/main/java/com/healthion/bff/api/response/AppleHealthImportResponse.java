package com.healthion.bff.api.response;

import java.util.List;

public record AppleHealthImportResponse(
    String status,
    String message,
    int recordsImported,
    int workoutsImported,
    List<String> errors) {

  public AppleHealthImportResponse {
    errors = errors == null ? List.of() : List.copyOf(errors);
  }
}
