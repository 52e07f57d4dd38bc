package com.example.botmatch.model;

/** Parameters of an outgoing challenge; clock fields are null for correspondence. */
public record ChallengeRequest(
    boolean rated,
    String variant,
    Integer clockLimitSeconds,
    Integer clockIncrementSeconds,
    Integer days) {

  public static ChallengeRequest realTime(
      boolean rated, String variant, int clockLimitSeconds, int clockIncrementSeconds) {
    return new ChallengeRequest(rated, variant, clockLimitSeconds, clockIncrementSeconds, null);
  }

  public static ChallengeRequest correspondence(boolean rated, String variant, int days) {
    return new ChallengeRequest(rated, variant, null, null, days);
  }
}
