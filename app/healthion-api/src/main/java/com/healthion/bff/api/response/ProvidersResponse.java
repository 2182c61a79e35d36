package com.healthion.bff.api.response;

import java.util.List;

public record ProvidersResponse(List<WearableProvider> providers) {

  public ProvidersResponse {
    providers = providers == null ? List.of() : List.copyOf(providers);
  }
}
