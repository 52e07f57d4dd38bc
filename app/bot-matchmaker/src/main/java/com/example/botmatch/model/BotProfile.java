/*
 * Where: Bot matchmaker domain model
 * What: Public profile of an account on the game server
 * Why: Opponent filtering needs per-category ratings and game counts
 */
package com.example.botmatch.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record BotProfile(String username, Map<String, Perf> perfs, boolean blocking) {

  public BotProfile {
    perfs = perfs == null ? Map.of() : Map.copyOf(perfs);
  }

  public BotProfile(String username, Map<String, Perf> perfs) {
    this(username, perfs, false);
  }

  public Perf perf(String category) {
    return perfs.getOrDefault(category, Perf.UNRATED);
  }

  public int rating(String category) {
    return perf(category).rating();
  }
}
