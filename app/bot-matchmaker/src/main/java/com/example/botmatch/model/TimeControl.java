package com.example.botmatch.model;

/** Offered clock: base/increment in seconds for real-time games, days per move otherwise. */
public record TimeControl(int baseTime, int increment, int days) {

  public static TimeControl realTime(int baseTime, int increment) {
    return new TimeControl(baseTime, increment, 0);
  }

  public static TimeControl correspondence(int days) {
    return new TimeControl(0, 0, days);
  }

  public boolean isCorrespondence() {
    return days > 0;
  }

  public String category(String variant) {
    return GameCategory.of(variant, baseTime, increment, days);
  }

  /** Speed of the standard-chess game this clock would produce. */
  public String speed() {
    return category(GameCategory.STANDARD);
  }
}
