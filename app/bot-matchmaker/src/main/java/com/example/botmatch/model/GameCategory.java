/*
 * Where: Bot matchmaker domain model
 * What: Maps variant and time control to the rating pool they are rated in
 * Why: Opponent rating windows and slot lanes are both decided per category
 */
package com.example.botmatch.model;

public final class GameCategory {

  public static final String STANDARD = "standard";

  private static final int ESTIMATED_MOVES = 40;
  private static final int BULLET_LIMIT = 179;
  private static final int BLITZ_LIMIT = 479;
  private static final int RAPID_LIMIT = 1499;

  private GameCategory() {}

  /**
   * 役割: 対局条件からレーティングカテゴリ名を求める。
   * 動作: variant が standard 以外なら variant 名、days があれば correspondence、それ以外は
   * base + 40 * increment の想定時間で bullet/blitz/rapid/classical を決める。
   * 前提: 時間はすべて秒。
   */
  public static String of(String variant, int baseTime, int increment, int days) {
    if (!STANDARD.equals(variant)) {
      return variant;
    }
    if (days > 0) {
      return GameSpeeds.CORRESPONDENCE;
    }
    final int duration = baseTime + increment * ESTIMATED_MOVES;
    if (duration < BULLET_LIMIT) {
      return "bullet";
    }
    if (duration < BLITZ_LIMIT) {
      return "blitz";
    }
    if (duration < RAPID_LIMIT) {
      return "rapid";
    }
    return "classical";
  }
}
