package com.example.botmatch.model;

import java.util.Set;

/** Real-time bot lanes that outgoing matchmaking fills. */
public enum BotLane {
  SHORT("short"),
  LONG("long");

  private static final Set<String> SHORT_SPEEDS = Set.of("ultraBullet", "bullet", "blitz");

  private final String value;

  BotLane(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public Lane toLane() {
    return this == SHORT ? Lane.BOT_SHORT : Lane.BOT_LONG;
  }

  /** Anything that is not a fast speed lands in the long lane. */
  public static BotLane forSpeed(String speed) {
    return SHORT_SPEEDS.contains(speed) ? SHORT : LONG;
  }
}
