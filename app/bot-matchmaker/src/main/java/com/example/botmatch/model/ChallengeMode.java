package com.example.botmatch.model;

import java.util.List;

public final class ChallengeMode {

  public static final String CASUAL = "casual";
  public static final String RATED = "rated";
  public static final List<String> ALL = List.of(CASUAL, RATED);

  /** Config value meaning "pick one of the choices per challenge". */
  public static final String RANDOM = "random";

  private ChallengeMode() {}
}
