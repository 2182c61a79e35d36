package com.healthion.bff.model;

import java.util.Locale;

public enum SummaryKind {
  ACTIVITY,
  SLEEP,
  RECOVERY,
  BODY;

  public String pathSegment() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static SummaryKind fromPathSegment(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("summary kind is required");
    }
    for (SummaryKind kind : values()) {
      if (kind.pathSegment().equals(value.trim().toLowerCase(Locale.ROOT))) {
        return kind;
      }
    }
    throw new IllegalArgumentException("unsupported summary kind: " + value);
  }
}
