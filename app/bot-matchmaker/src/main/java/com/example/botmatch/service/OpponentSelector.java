/*
 * Where: Bot matchmaker service layer
 * What: Picks the opponent and terms for the next outgoing challenge
 * Why: Candidates must fit the free lanes, the rating window and what they recently declined
 */
package com.example.botmatch.service;

import com.example.botmatch.config.BotProperties;
import com.example.botmatch.config.MatchmakingOverride;
import com.example.botmatch.config.MatchmakingProperties;
import com.example.botmatch.model.BotLane;
import com.example.botmatch.model.BotProfile;
import com.example.botmatch.model.ChallengeFilter;
import com.example.botmatch.model.ChallengeMode;
import com.example.botmatch.model.OpponentChoice;
import com.example.botmatch.model.Perf;
import com.example.botmatch.model.RatingPreference;
import com.example.botmatch.model.TimeControl;
import com.google.common.annotations.VisibleForTesting;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class OpponentSelector {

  private static final Logger logger = LoggerFactory.getLogger(OpponentSelector.class);

  private final MatchmakingProperties properties;
  private final List<String> variants;
  private final GameService gameService;
  private final AcceptanceMemory acceptanceMemory;
  private final OnlineBlocklist onlineBlocklist;
  private final OwnProfileCache ownProfile;
  private final Random random;

  public OpponentSelector(
      MatchmakingProperties properties,
      BotProperties botProperties,
      GameService gameService,
      AcceptanceMemory acceptanceMemory,
      OnlineBlocklist onlineBlocklist,
      OwnProfileCache ownProfile,
      Random random) {
    this.properties = properties;
    this.variants = botProperties.matchmakingVariants();
    this.gameService = gameService;
    this.acceptanceMemory = acceptanceMemory;
    this.onlineBlocklist = onlineBlocklist;
    this.ownProfile = ownProfile;
    this.random = random;
  }

  /**
   * 役割: 次に挑戦する相手と対局条件を選ぶ。
   * 動作: override をランダムに適用し、許可レーンに合う時間設定を一つ選び、レーティング範囲と
   * ブロック状態で候補を絞った上で重み付き抽選する。相手が我々をブロックしていれば失敗とする。
   * 前提: allowedLanes が null のときはレーン制限なし。選定中の例外はすべてここで吸収する。
   */
  public Optional<OpponentChoice> chooseOpponent(
      Set<BotLane> allowedLanes, boolean correspondenceOnly) {
    String category = null;
    List<BotProfile> candidates = List.of();
    try {
      final MatchmakingProperties config = pickConfiguration();
      final String variant = randomConfigValue(config.challengeVariant(), variants);
      final String mode = randomConfigValue(config.challengeMode(), ChallengeMode.ALL);

      final List<TimeControl> timeControls = new ArrayList<>();
      for (TimeControl control : configuredTimeControls(config, allowedLanes, correspondenceOnly)) {
        if (control.isCorrespondence() == correspondenceOnly) {
          timeControls.add(control);
        }
      }
      if (timeControls.isEmpty()) {
        logger.error(
            "no valid time controls are available for matchmaking with the current settings");
        return Optional.empty();
      }
      final TimeControl timeControl = timeControls.get(random.nextInt(timeControls.size()));
      category = timeControl.category(variant);
      final RatingWindow window = ratingWindow(config, category);
      logger.info(
          "seeking game category={} opponentRating=[{}, {}]", category, window.min(), window.max());

      onlineBlocklist.refresh();
      candidates = suitableOpponents(gameService.listOnlineBots(), category, window);
      if (config.challengeFilter() == ChallengeFilter.FINE) {
        final List<String> aspects = List.of(variant, category, mode);
        final List<BotProfile> ready =
            candidates.stream().filter(bot -> isReady(bot.username(), aspects)).toList();
        candidates = ready.isEmpty() ? candidates : ready;
      }
      final List<Long> weights =
          weights(candidates, config.preference(), window.min(), window.max(), category);
      final BotProfile bot = WeightedChoice.pick(candidates, weights, random);
      final BotProfile publicProfile = gameService.getPublicProfile(bot.username());
      if (publicProfile != null && publicProfile.blocking()) {
        logger.info("opponent blocks us; adding to block list opponent={}", bot.username());
        acceptanceMemory.block(bot.username());
        return Optional.empty();
      }
      return Optional.of(new OpponentChoice(bot.username(), timeControl, variant, mode));
    } catch (RuntimeException ex) {
      if (category == null) {
        logger.error("opponent selection failed before a time control was chosen", ex);
      } else if (candidates.isEmpty()) {
        logger.error("no suitable bots found to challenge category={}", category);
      } else {
        logger.error("opponent selection failed category={}", category, ex);
      }
      return Optional.empty();
    }
  }

  /** Base-time x increment combinations plus correspondence day counts, filtered by lane. */
  public static List<TimeControl> configuredTimeControls(
      MatchmakingProperties config, Set<BotLane> allowedLanes, boolean includeCorrespondence) {
    final List<TimeControl> controls = new ArrayList<>();
    for (int baseTime : orZero(config.challengeInitialTime())) {
      for (int increment : orZero(config.challengeIncrement())) {
        if (baseTime == 0 && increment == 0) {
          continue;
        }
        final TimeControl control = TimeControl.realTime(baseTime, increment);
        if (allowedLanes == null || allowedLanes.contains(BotLane.forSpeed(control.speed()))) {
          controls.add(control);
        }
      }
    }
    if (includeCorrespondence) {
      for (Integer days : config.challengeDays()) {
        if (days == null || days <= 0) {
          continue;
        }
        if (allowedLanes == null || allowedLanes.contains(BotLane.LONG)) {
          controls.add(TimeControl.correspondence(days));
        }
      }
    }
    return controls;
  }

  /**
   * "high" makes the top of the window about twice as likely as the bottom, "low" mirrors it.
   * Negative weights are clamped to zero.
   */
  public static List<Long> weights(
      List<BotProfile> candidates,
      RatingPreference preference,
      int minRating,
      int maxRating,
      String category) {
    final List<Long> weights = new ArrayList<>(candidates.size());
    final long min = minRating;
    final long max = maxRating;
    for (BotProfile bot : candidates) {
      final long rating = bot.rating(category);
      final long weight =
          switch (preference) {
            case HIGH -> rating - Math.min(min - (max - min), min - 1);
            case LOW -> Math.max(max + (max - min), max + 1) - rating;
            case NONE -> 1;
          };
      weights.add(Math.max(0, weight));
    }
    return weights;
  }

  @VisibleForTesting
  String randomConfigValue(String value, List<String> choices) {
    if (!ChallengeMode.RANDOM.equals(value)) {
      return value;
    }
    return choices.get(random.nextInt(choices.size()));
  }

  @VisibleForTesting
  boolean isBlocked(String username) {
    return acceptanceMemory.isBlocked(username) || onlineBlocklist.contains(username);
  }

  private MatchmakingProperties pickConfiguration() {
    final List<String> names = new ArrayList<>(properties.overrides().keySet());
    names.sort(null);
    names.add(null);
    final String name = names.get(random.nextInt(names.size()));
    logger.info("using matchmaking configuration={}", name == null ? "default" : name);
    final MatchmakingOverride override = name == null ? null : properties.overrides().get(name);
    return properties.withOverride(override);
  }

  private RatingWindow ratingWindow(MatchmakingProperties config, String category) {
    final Integer difference = config.opponentRatingDifference();
    final int ownRating = ownProfile.rating(category);
    if (difference != null && ownRating > 0) {
      return new RatingWindow(ownRating - difference, ownRating + difference);
    }
    return new RatingWindow(config.opponentMinRating(), config.opponentMaxRating());
  }

  private List<BotProfile> suitableOpponents(
      List<BotProfile> onlineBots, String category, RatingWindow window) {
    final String self = ownProfile.username();
    final List<BotProfile> suitable = new ArrayList<>();
    for (BotProfile bot : onlineBots) {
      final Perf perf = bot.perf(category);
      if (!bot.username().equals(self)
          && !isBlocked(bot.username())
          && perf.games() > 0
          && window.contains(perf.rating())) {
        suitable.add(bot);
      }
    }
    return suitable;
  }

  private boolean isReady(String username, List<String> aspects) {
    for (String aspect : aspects) {
      if (!acceptanceMemory.isAcceptable(username, aspect)) {
        return false;
      }
    }
    return true;
  }

  private static List<Integer> orZero(List<Integer> values) {
    if (values == null || values.isEmpty()) {
      return List.of(0);
    }
    final List<Integer> normalized = new ArrayList<>(values.size());
    for (Integer value : values) {
      normalized.add(value == null ? 0 : value);
    }
    return normalized;
  }

  private record RatingWindow(int min, int max) {

    boolean contains(int rating) {
      return min <= rating && rating <= max;
    }
  }
}
