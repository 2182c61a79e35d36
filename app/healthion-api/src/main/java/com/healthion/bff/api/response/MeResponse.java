package com.healthion.bff.api.response;

import java.util.List;

public record MeResponse(
    String userId,
    String externalIdentityId,
    String email,
    List<String> permissions,
    String upstreamUserId) {

  public MeResponse {
    permissions = permissions == null ? List.of() : List.copyOf(permissions);
  }
}
