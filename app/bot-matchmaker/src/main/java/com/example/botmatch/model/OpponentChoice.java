package com.example.botmatch.model;

/** Opponent plus the terms a new challenge will offer. */
public record OpponentChoice(String opponent, TimeControl timeControl, String variant, String mode) {

  public boolean rated() {
    return ChallengeMode.RATED.equals(mode);
  }
}
