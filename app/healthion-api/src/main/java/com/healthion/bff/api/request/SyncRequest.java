package com.healthion.bff.api.request;

import jakarta.validation.constraints.NotBlank;

public record SyncRequest(@NotBlank String provider, String dataType) {

  public SyncRequest {
    dataType = dataType == null || dataType.isBlank() ? "all" : dataType;
  }
}
