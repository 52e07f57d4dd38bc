/*
 * Where: Bot matchmaker domain model
 * What: Defines the lanes a game or challenge can occupy
 * Why: Slot accounting partitions the concurrency budget by lane
 */
package com.example.botmatch.model;

public enum Lane {
  HUMAN("human"),
  BOT_SHORT("bot_short"),
  BOT_LONG("bot_long"),
  CORRESPONDENCE("correspondence"),
  ANY("any");

  private final String value;

  Lane(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }
}
