/*
 * Where: Bot matchmaker domain model
 * What: Outcome of a challenge creation call
 * Why: A refused challenge still tells us who is rate limited and for how long
 */
package com.example.botmatch.model;

import java.time.Duration;

public record ChallengeCreationResponse(
    String id,
    boolean botIsRateLimited,
    boolean opponentIsRateLimited,
    Duration rateLimitTimeout,
    String error) {

  public static ChallengeCreationResponse created(String id) {
    return new ChallengeCreationResponse(id, false, false, null, null);
  }

  public boolean hasId() {
    return id != null && !id.isBlank();
  }
}
