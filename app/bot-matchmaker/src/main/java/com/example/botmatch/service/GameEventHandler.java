/*
 * Where: Bot matchmaker service layer
 * What: Applies host game and challenge events to the session, slots and scheduler
 * Why: Slot reservations must follow the lifecycle of every game and challenge
 */
package com.example.botmatch.service;

import com.example.botmatch.model.Challenge;
import com.example.botmatch.slot.SlotTracker;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class GameEventHandler {

  private static final Logger logger = LoggerFactory.getLogger(GameEventHandler.class);

  private final BotSession session;
  private final SlotTracker slotTracker;
  private final MatchmakingScheduler scheduler;

  public void onChallengeReceived(Challenge challenge) {
    if (challenge.fromSelf()) {
      return;
    }
    logger.info(
        "challenge received challengeId={} challenger={} speed={}",
        challenge.id(),
        challenge.challenger(),
        challenge.speed());
    session.enqueueChallenge(challenge);
  }

  /** Game ids equal the id of the challenge that created them. */
  public void onGameStart(String gameId, boolean isBotOpponent, String speed) {
    logger.info("game started gameId={} botOpponent={} speed={}", gameId, isBotOpponent, speed);
    session.addActiveGame(gameId);
    scheduler.acceptedChallenge(gameId);
    if (!slotTracker.hasReservation(gameId)) {
      slotTracker.reserveGame(gameId, isBotOpponent, speed);
    }
  }

  public void onGameFinish(String gameId) {
    final boolean correspondence = slotTracker.isCorrespondence(gameId);
    logger.info("game finished gameId={} correspondence={}", gameId, correspondence);
    session.removeActiveGame(gameId);
    slotTracker.release(gameId);
    scheduler.gameDone();
    if (correspondence) {
      scheduler.correspondenceGameDone();
    }
  }

  public void onChallengeDeclined(Challenge challenge, String reasonKey) {
    scheduler.declinedChallenge(challenge, reasonKey);
  }

  public void onChallengeCanceled(String challengeId) {
    logger.info("challenge canceled challengeId={}", challengeId);
    session.removeChallenge(challengeId);
    slotTracker.release(challengeId);
    scheduler.canceledChallenge(challengeId);
  }

  /** The game continues on the server; only its compute turn ends. */
  public void onCorrespondenceMoveCompleted(String gameId) {
    session.removeActiveGame(gameId);
  }
}
