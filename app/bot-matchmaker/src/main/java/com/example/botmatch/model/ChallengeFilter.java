package com.example.botmatch.model;

public enum ChallengeFilter {
  NONE("none"),
  COARSE("coarse"),
  FINE("fine");

  private final String value;

  ChallengeFilter(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static ChallengeFilter fromValue(String value) {
    for (ChallengeFilter filter : values()) {
      if (filter.value.equalsIgnoreCase(value)) {
        return filter;
      }
    }
    throw new IllegalArgumentException("unsupported challenge filter: " + value);
  }
}
