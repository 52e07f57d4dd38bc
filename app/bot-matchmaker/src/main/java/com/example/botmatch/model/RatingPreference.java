package com.example.botmatch.model;

public enum RatingPreference {
  HIGH,
  LOW,
  NONE;

  /** Unknown values mean no preference. */
  public static RatingPreference fromValue(String value) {
    if ("high".equalsIgnoreCase(value)) {
      return HIGH;
    }
    if ("low".equalsIgnoreCase(value)) {
      return LOW;
    }
    return NONE;
  }
}
