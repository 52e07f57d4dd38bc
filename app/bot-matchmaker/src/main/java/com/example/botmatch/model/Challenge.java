/*
 * Where: Bot matchmaker domain model
 * What: Descriptor of an incoming or outgoing challenge seen on the event stream
 * Why: Slot checks and decline handling only need these fields
 */
package com.example.botmatch.model;

public record Challenge(
    String id,
    String challenger,
    boolean challengerIsBot,
    String target,
    String speed,
    String variant,
    boolean rated,
    boolean fromSelf) {

  public boolean isCorrespondence() {
    return GameSpeeds.isCorrespondence(speed);
  }

  public String mode() {
    return rated ? ChallengeMode.RATED : ChallengeMode.CASUAL;
  }
}
