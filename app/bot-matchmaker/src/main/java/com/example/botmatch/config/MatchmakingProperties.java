/*
 * Where: Bot matchmaker configuration
 * What: Holds the matchmaking section of the bot configuration
 * Why: Time controls, rating windows and filters differ per deployment and per override
 */
package com.example.botmatch.config;

import com.example.botmatch.model.ChallengeFilter;
import com.example.botmatch.model.ChallengeMode;
import com.example.botmatch.model.RatingPreference;
import jakarta.validation.constraints.AssertTrue;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "matchmaking")
@Validated
public record MatchmakingProperties(
    boolean allowMatchmaking,
    boolean allowDuringGames,
    @DurationUnit(ChronoUnit.MINUTES) Duration challengeTimeout,
    List<Integer> challengeInitialTime,
    List<Integer> challengeIncrement,
    List<Integer> challengeDays,
    String challengeVariant,
    String challengeMode,
    Integer opponentMinRating,
    Integer opponentMaxRating,
    Integer opponentRatingDifference,
    String ratingPreference,
    ChallengeFilter challengeFilter,
    List<String> blockList,
    List<String> onlineBlockList,
    Duration onlineBlockListRefreshInterval,
    Map<String, MatchmakingOverride> overrides,
    String maxBackgroundCorrespondenceGames) {

  public static final int UNBOUNDED = Integer.MAX_VALUE;
  private static final int DEFAULT_BACKGROUND_CORRESPONDENCE_GAMES = 1;

  public MatchmakingProperties {
    challengeTimeout = challengeTimeout == null ? Duration.ofMinutes(30) : challengeTimeout;
    challengeInitialTime = challengeInitialTime == null ? List.of(60) : List.copyOf(challengeInitialTime);
    challengeIncrement = challengeIncrement == null ? List.of(2) : List.copyOf(challengeIncrement);
    challengeDays = challengeDays == null ? List.of() : List.copyOf(challengeDays);
    challengeVariant =
        challengeVariant == null || challengeVariant.isBlank()
            ? ChallengeMode.RANDOM
            : challengeVariant;
    challengeMode =
        challengeMode == null || challengeMode.isBlank() ? ChallengeMode.RANDOM : challengeMode;
    opponentMinRating = opponentMinRating == null ? 600 : opponentMinRating;
    opponentMaxRating = opponentMaxRating == null ? 4000 : opponentMaxRating;
    ratingPreference = ratingPreference == null ? "none" : ratingPreference;
    challengeFilter = challengeFilter == null ? ChallengeFilter.NONE : challengeFilter;
    blockList = blockList == null ? List.of() : List.copyOf(blockList);
    onlineBlockList = onlineBlockList == null ? List.of() : List.copyOf(onlineBlockList);
    onlineBlockListRefreshInterval =
        onlineBlockListRefreshInterval == null
            ? Duration.ofMinutes(30)
            : onlineBlockListRefreshInterval;
    overrides = overrides == null ? Map.of() : Map.copyOf(overrides);
  }

  @AssertTrue(message = "matchmaking.opponent-min-rating must not exceed opponent-max-rating")
  public boolean isRatingWindowValid() {
    return opponentMinRating <= opponentMaxRating;
  }

  @AssertTrue(message = "matchmaking.challenge-timeout must not be negative")
  public boolean isChallengeTimeoutValid() {
    return !challengeTimeout.isNegative();
  }

  public RatingPreference preference() {
    return RatingPreference.fromValue(ratingPreference);
  }

  /**
   * 役割: 常時維持したい通信対局 (correspondence) の数を返す。
   * 動作: 未設定なら 1、inf/unbounded なら無制限、負数は 0、解釈できない値は 1 とする。
   * 前提: なし。
   */
  public int backgroundCorrespondenceTarget() {
    if (maxBackgroundCorrespondenceGames == null || maxBackgroundCorrespondenceGames.isBlank()) {
      return DEFAULT_BACKGROUND_CORRESPONDENCE_GAMES;
    }
    final String value = maxBackgroundCorrespondenceGames.trim().toLowerCase(Locale.ROOT);
    if (value.equals("inf") || value.equals(".inf") || value.equals("infinity")
        || value.equals("unbounded")) {
      return UNBOUNDED;
    }
    try {
      return Math.max(0, Integer.parseInt(value));
    } catch (NumberFormatException ex) {
      return DEFAULT_BACKGROUND_CORRESPONDENCE_GAMES;
    }
  }

  /** Effective configuration with every field the override sets replacing ours. */
  public MatchmakingProperties withOverride(MatchmakingOverride override) {
    if (override == null) {
      return this;
    }
    return new MatchmakingProperties(
        allowMatchmaking,
        allowDuringGames,
        challengeTimeout,
        pick(override.challengeInitialTime(), challengeInitialTime),
        pick(override.challengeIncrement(), challengeIncrement),
        pick(override.challengeDays(), challengeDays),
        pick(override.challengeVariant(), challengeVariant),
        pick(override.challengeMode(), challengeMode),
        pick(override.opponentMinRating(), opponentMinRating),
        pick(override.opponentMaxRating(), opponentMaxRating),
        pick(override.opponentRatingDifference(), opponentRatingDifference),
        pick(override.ratingPreference(), ratingPreference),
        challengeFilter,
        blockList,
        onlineBlockList,
        onlineBlockListRefreshInterval,
        overrides,
        maxBackgroundCorrespondenceGames);
  }

  private static <T> T pick(T overridden, T base) {
    return overridden != null ? overridden : base;
  }
}
