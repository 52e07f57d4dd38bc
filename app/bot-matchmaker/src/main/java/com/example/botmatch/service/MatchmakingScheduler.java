/*
 * Where: Bot matchmaker service layer
 * What: Decides on every tick whether to send a challenge, and to whom
 * Why: Challenges must respect free lanes, cooldowns and server rate limits
 */
package com.example.botmatch.service;

import com.example.botmatch.config.MatchmakingProperties;
import com.example.botmatch.model.BotLane;
import com.example.botmatch.model.Challenge;
import com.example.botmatch.model.ChallengeCreationResponse;
import com.example.botmatch.model.ChallengeFilter;
import com.example.botmatch.model.ChallengeRequest;
import com.example.botmatch.model.DeclineReason;
import com.example.botmatch.model.OpponentChoice;
import com.example.botmatch.model.TimeControl;
import com.example.botmatch.slot.SlotTracker;
import com.example.botmatch.timer.CooldownTimer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Outgoing matchmaking state machine.
 *
 * <p>At most one outgoing challenge is tracked at a time. The server expires challenges after
 * about twenty seconds; an outstanding challenge older than {@link #CHALLENGE_EXPIRY} is
 * cancelled on the next eligibility check. All public entry points synchronize on the scheduler
 * so host event callbacks and the worker tick never interleave.
 */
@Service
public class MatchmakingScheduler {

  private static final Logger logger = LoggerFactory.getLogger(MatchmakingScheduler.class);

  static final Duration CHALLENGE_EXPIRY = Duration.ofSeconds(25);
  static final Duration MIN_WAIT = Duration.ofSeconds(60);
  static final Duration MAX_WAIT_DURING_GAMES = Duration.ofMinutes(10);
  static final Duration MAX_WAIT_NOT_DURING_GAMES = Duration.ofDays(3650);

  private final GameService gameService;
  private final SlotTracker slotTracker;
  private final OpponentSelector opponentSelector;
  private final AcceptanceMemory acceptanceMemory;
  private final OwnProfileCache ownProfile;
  private final MatchmakingProperties properties;
  private final MatchmakingMetrics metrics;
  private final Clock clock;

  private final CooldownTimer challengeCreatedTimer;
  private final CooldownTimer postGameTimer;
  private final Duration maxWaitTime;
  private final int backgroundCorrespondenceTarget;
  private CooldownTimer rateLimitTimer;
  private String outstandingChallengeId;
  private boolean forceImmediateChallenge;

  public MatchmakingScheduler(
      GameService gameService,
      SlotTracker slotTracker,
      OpponentSelector opponentSelector,
      AcceptanceMemory acceptanceMemory,
      OwnProfileCache ownProfile,
      MatchmakingProperties properties,
      MatchmakingMetrics metrics,
      Clock clock) {
    this.gameService = gameService;
    this.slotTracker = slotTracker;
    this.opponentSelector = opponentSelector;
    this.acceptanceMemory = acceptanceMemory;
    this.ownProfile = ownProfile;
    this.properties = properties;
    this.metrics = metrics;
    this.clock = clock;
    this.challengeCreatedTimer = new CooldownTimer(clock, CHALLENGE_EXPIRY);
    this.postGameTimer = new CooldownTimer(clock, properties.challengeTimeout());
    this.rateLimitTimer = CooldownTimer.expired(clock);
    this.maxWaitTime =
        properties.allowDuringGames() ? MAX_WAIT_DURING_GAMES : MAX_WAIT_NOT_DURING_GAMES;
    this.backgroundCorrespondenceTarget = properties.backgroundCorrespondenceTarget();
    for (String name : properties.blockList()) {
      acceptanceMemory.block(name);
    }
  }

  /**
   * 役割: 今チャレンジを作成してよいかを判定する。
   * 動作: 期限切れの未応答チャレンジがあればキャンセルしてスロットを解放する。その上で
   * matchmaking 有効・対局後クールダウン・レート制限・最小間隔の条件を評価する。
   * 前提: 副作用あり (キャンセル呼び出し)。
   */
  public synchronized boolean shouldCreateChallenge(
      boolean ignorePostgameTimeout, boolean ignoreMinWait) {
    final boolean matchmakingEnabled = properties.allowMatchmaking();
    final boolean postgameOk = ignorePostgameTimeout || postGameTimer.isExpired();
    final boolean timeHasPassed = postgameOk && rateLimitTimer.isExpired();
    final boolean challengeExpired =
        challengeCreatedTimer.isExpired() && outstandingChallengeId != null;
    final boolean minWaitPassed =
        ignoreMinWait || challengeCreatedTimer.timeSinceReset().compareTo(MIN_WAIT) > 0;
    if (challengeExpired) {
      cancelExpiredChallenge(outstandingChallengeId);
    }
    return matchmakingEnabled && timeHasPassed && (minWaitPassed || challengeExpired);
  }

  public synchronized boolean shouldCreateChallenge() {
    return shouldCreateChallenge(false, false);
  }

  /**
   * One matchmaking tick.
   *
   * @param activeGameIds games currently using a slot
   * @param incomingQueue incoming challenges waiting for acceptance; these take priority
   * @param maxGames configured concurrency
   */
  public synchronized void challenge(
      Set<String> activeGameIds, Collection<Challenge> incomingQueue, int maxGames) {
    if (!incomingQueue.isEmpty()) {
      return;
    }
    if (challengeForBackgroundCorrespondence(activeGameIds)) {
      return;
    }

    final int maxGamesForMatchmaking =
        properties.allowDuringGames() ? maxGames : Math.min(1, maxGames);
    final int gameCount = activeGameIds.size();
    if (gameCount >= maxGamesForMatchmaking) {
      return;
    }

    final Set<BotLane> allowedLanes = slotTracker.availableBotLanes(activeGameIds);
    if (allowedLanes.isEmpty()) {
      return;
    }

    // with slot accounting the missing lane is filled quickly
    final Duration cooldownWhileGamesActive =
        slotTracker.accountingEnabled() ? MIN_WAIT : maxWaitTime;
    if (gameCount > 0
        && challengeCreatedTimer.timeSinceReset().compareTo(cooldownWhileGamesActive) < 0) {
      return;
    }

    if (!shouldCreateChallenge()) {
      return;
    }

    createMatchmakingChallenge(activeGameIds, allowedLanes, false);
  }

  /** Sends one challenge; returns whether the server handed back a challenge id. */
  public synchronized boolean createMatchmakingChallenge(
      Set<String> activeGameIds, Set<BotLane> allowedLanes, boolean correspondenceOnly) {
    logger.info(
        "challenging a random bot allowedLanes={} correspondenceOnly={}",
        allowedLanes,
        correspondenceOnly);
    ownProfile.refreshIfStale();
    final Optional<OpponentChoice> choice =
        opponentSelector.chooseOpponent(allowedLanes, correspondenceOnly);
    if (choice.isEmpty()) {
      metrics.recordChallengeResult("no_opponent");
      return false;
    }

    final OpponentChoice opponent = choice.get();
    final String speed = opponent.timeControl().speed();
    // an incoming challenge may have taken the lane since the lanes were computed
    if (!slotTracker.canAcceptBotSpeed(speed, activeGameIds)) {
      logger.info("lane no longer available speed={}", speed);
      metrics.recordChallengeResult("lane_taken");
      return false;
    }

    logger.info(
        "will challenge opponent={} variant={} speed={}",
        opponent.opponent(),
        opponent.variant(),
        speed);
    final String challengeId =
        createChallenge(
            opponent.opponent(), opponent.timeControl(), opponent.variant(), opponent.mode());
    logger.info("challenge request finished challengeId={}", challengeId);
    outstandingChallengeId = challengeId;
    if (challengeId == null) {
      metrics.recordChallengeResult("failed");
      return false;
    }
    slotTracker.reserveOutgoingChallenge(challengeId, speed);
    metrics.recordChallengeResult("created");
    return true;
  }

  /** Returns the new challenge id, or null when no challenge was created. */
  public synchronized String createChallenge(
      String opponent, TimeControl timeControl, String variant, String mode) {
    final boolean rated = "rated".equals(mode);
    final ChallengeRequest request;
    if (timeControl.days() > 0) {
      request = ChallengeRequest.correspondence(rated, variant, timeControl.days());
    } else if (timeControl.baseTime() > 0 || timeControl.increment() > 0) {
      request =
          ChallengeRequest.realTime(rated, variant, timeControl.baseTime(), timeControl.increment());
    } else {
      logger.error(
          "at least one of matchmaking.challenge-days, challenge-initial-time or "
              + "challenge-increment must be greater than zero");
      return null;
    }

    try {
      challengeCreatedTimer.reset();
      final ChallengeCreationResponse response = gameService.createChallenge(opponent, request);
      if (response != null && response.hasId()) {
        return response.id();
      }
      handleChallengeErrorResponse(response, opponent);
      return null;
    } catch (RateLimitedException ex) {
      logger.warn("challenge creation rate limited retryAfter={}", ex.retryAfter());
      rateLimitTimer = new CooldownTimer(clock, ex.retryAfter());
      metrics.recordDependencyError("rate_limited");
    } catch (RuntimeException ex) {
      logger.debug("challenge creation failed opponent={}", opponent, ex);
      metrics.recordDependencyError("create_challenge");
    }
    logger.warn("could not create challenge opponent={}", opponent);
    showEarliestChallengeTime();
    return null;
  }

  /** The outgoing challenge became game {@code gameId}. */
  public synchronized void acceptedChallenge(String gameId) {
    discardChallenge(gameId);
    slotTracker.confirmGameStart(gameId);
  }

  public synchronized void declinedChallenge(Challenge challenge, String reasonKey) {
    final String opponent = challenge.target();
    logger.info(
        "challenge declined opponent={} challengeId={} reason={}",
        opponent,
        challenge.id(),
        reasonKey);
    final Optional<DeclineReason> reason = DeclineReason.fromKey(reasonKey);
    metrics.recordDecline(reason.map(DeclineReason::key).orElse("unknown"));
    discardChallenge(challenge.id());
    if (challenge.fromSelf()) {
      slotTracker.release(challenge.id());
    }
    final ChallengeFilter filter = properties.challengeFilter();
    if (!challenge.fromSelf() || filter == ChallengeFilter.NONE) {
      return;
    }

    if (reason.isEmpty()) {
      logger.warn("unknown decline reason received reasonKey={}", reasonKey);
    }
    final String aspect =
        filter == ChallengeFilter.FINE
            ? reason.map(declineReason -> declineReason.aspectOf(challenge)).orElse("")
            : AcceptanceMemory.ANY_ASPECT;
    acceptanceMemory.suppress(opponent, aspect);
    logger.info(
        "will not challenge opponent={} to another {} game today",
        opponent,
        aspect.isEmpty() ? "any" : aspect);
    showEarliestChallengeTime();
  }

  /** The server cancelled the challenge, so there is nothing left to cancel on expiry. */
  public synchronized void canceledChallenge(String challengeId) {
    discardChallenge(challengeId);
  }

  public synchronized void gameDone() {
    postGameTimer.reset();
    showEarliestChallengeTime();
  }

  /** The next tick replaces the finished correspondence game without waiting. */
  public synchronized void correspondenceGameDone() {
    forceImmediateChallenge = true;
  }

  public synchronized Instant nextChallengeTime() {
    final Duration postgame = postGameTimer.remaining();
    Duration sinceChallenge = MIN_WAIT.minus(challengeCreatedTimer.timeSinceReset());
    if (sinceChallenge.isNegative()) {
      sinceChallenge = Duration.ZERO;
    }
    final Duration rateLimit = rateLimitTimer.remaining();
    Duration timeLeft = postgame;
    if (sinceChallenge.compareTo(timeLeft) > 0) {
      timeLeft = sinceChallenge;
    }
    if (rateLimit.compareTo(timeLeft) > 0) {
      timeLeft = rateLimit;
    }
    return Instant.now(clock).plus(timeLeft);
  }

  public synchronized String outstandingChallengeId() {
    return outstandingChallengeId;
  }

  public synchronized boolean forceImmediateChallengePending() {
    return forceImmediateChallenge;
  }

  private boolean challengeForBackgroundCorrespondence(Set<String> activeGameIds) {
    if (!slotTracker.accountingEnabled()) {
      return false;
    }
    if (slotTracker.correspondenceReservationCount() >= backgroundCorrespondenceTarget) {
      return false;
    }
    final boolean ignoreMinWait = forceImmediateChallenge;
    forceImmediateChallenge = false;
    if (!shouldCreateChallenge(true, ignoreMinWait)) {
      return false;
    }
    return createMatchmakingChallenge(activeGameIds, null, true);
  }

  private void handleChallengeErrorResponse(ChallengeCreationResponse response, String opponent) {
    logger.error(
        "challenge refused opponent={} error={}",
        opponent,
        response == null ? "empty response" : response.error());
    if (response != null && response.botIsRateLimited()) {
      final Duration timeout =
          response.rateLimitTimeout() == null ? MIN_WAIT : response.rateLimitTimeout();
      rateLimitTimer = new CooldownTimer(clock, timeout);
    } else if (response != null && response.opponentIsRateLimited()) {
      acceptanceMemory.suppress(opponent, AcceptanceMemory.ANY_ASPECT, response.rateLimitTimeout());
    } else {
      acceptanceMemory.suppress(opponent, AcceptanceMemory.ANY_ASPECT);
    }
    showEarliestChallengeTime();
  }

  private void cancelExpiredChallenge(String challengeId) {
    try {
      gameService.cancelChallenge(challengeId);
      logger.info("challenge cancelled challengeId={}", challengeId);
    } catch (RuntimeException ex) {
      logger.warn("challenge cancel failed challengeId={}", challengeId, ex);
      metrics.recordDependencyError("cancel_challenge");
    }
    discardChallenge(challengeId);
    slotTracker.release(challengeId);
    showEarliestChallengeTime();
  }

  private void discardChallenge(String challengeId) {
    if (challengeId != null && challengeId.equals(outstandingChallengeId)) {
      outstandingChallengeId = null;
    }
  }

  private void showEarliestChallengeTime() {
    if (properties.allowMatchmaking()) {
      logger.info("next challenge will be created after {}", nextChallengeTime());
    }
  }
}
