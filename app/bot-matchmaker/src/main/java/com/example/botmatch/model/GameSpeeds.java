package com.example.botmatch.model;

public final class GameSpeeds {

  public static final String CORRESPONDENCE = "correspondence";

  private GameSpeeds() {}

  public static boolean isCorrespondence(String speed) {
    return CORRESPONDENCE.equals(speed);
  }
}
