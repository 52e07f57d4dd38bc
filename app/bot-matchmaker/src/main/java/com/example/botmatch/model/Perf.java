package com.example.botmatch.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Perf(int rating, int games) {

  public static final Perf UNRATED = new Perf(0, 0);
}
