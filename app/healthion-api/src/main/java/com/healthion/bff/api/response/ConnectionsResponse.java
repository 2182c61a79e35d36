package com.healthion.bff.api.response;

import java.util.List;

public record ConnectionsResponse(List<WearableConnection> connections, String upstreamUserId) {

  public ConnectionsResponse {
    connections = connections == null ? List.of() : List.copyOf(connections);
  }
}
