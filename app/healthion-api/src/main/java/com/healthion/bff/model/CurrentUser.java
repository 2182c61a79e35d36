package com.healthion.bff.model;

import java.util.List;

public record CurrentUser(UserRecord user, List<String> permissions) {

  public CurrentUser {
    permissions = permissions == null ? List.of() : List.copyOf(permissions);
  }
}
