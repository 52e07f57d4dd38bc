/*
 * Where: Bot matchmaker domain model
 * What: Decline reason keys the server reports and the game aspect each one objects to
 * Why: Fine-grained filtering suppresses only the declined aspect for that opponent
 */
package com.example.botmatch.model;

import java.util.Locale;
import java.util.Optional;

public enum DeclineReason {
  GENERIC("generic", Aspect.NONE),
  LATER("later", Aspect.NONE),
  NO_BOT("nobot", Aspect.NONE),
  TOO_FAST("toofast", Aspect.SPEED),
  TOO_SLOW("tooslow", Aspect.SPEED),
  TIME_CONTROL("timecontrol", Aspect.SPEED),
  RATED("rated", Aspect.MODE),
  CASUAL("casual", Aspect.MODE),
  STANDARD("standard", Aspect.VARIANT),
  VARIANT("variant", Aspect.VARIANT);

  public enum Aspect {
    NONE,
    SPEED,
    MODE,
    VARIANT
  }

  private final String key;
  private final Aspect aspect;

  DeclineReason(String key, Aspect aspect) {
    this.key = key;
    this.aspect = aspect;
  }

  public String key() {
    return key;
  }

  public Aspect aspect() {
    return aspect;
  }

  /** Empty string stands for "the opponent objects to us in general". */
  public String aspectOf(Challenge challenge) {
    return switch (aspect) {
      case SPEED -> challenge.speed();
      case MODE -> challenge.mode();
      case VARIANT -> challenge.variant();
      case NONE -> "";
    };
  }

  public static Optional<DeclineReason> fromKey(String key) {
    if (key == null) {
      return Optional.empty();
    }
    final String normalized = key.toLowerCase(Locale.ROOT);
    for (DeclineReason reason : values()) {
      if (reason.key.equals(normalized)) {
        return Optional.of(reason);
      }
    }
    return Optional.empty();
  }
}
