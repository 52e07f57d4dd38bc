/*
 * Where: Bot matchmaker service layer
 * What: Accepts queued incoming challenges while their lanes are free
 * Why: Incoming challenges take priority over outgoing matchmaking
 */
package com.example.botmatch.service;

import com.example.botmatch.model.Challenge;
import com.example.botmatch.slot.SlotTracker;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ChallengeAcceptor {

  private static final Logger logger = LoggerFactory.getLogger(ChallengeAcceptor.class);

  private final BotSession session;
  private final SlotTracker slotTracker;
  private final GameService gameService;
  private final MatchmakingMetrics metrics;

  /**
   * 役割: キュー上の受信チャレンジを受理する。
   * 動作: 人間からのチャレンジを先に評価し、スロットが許すものだけ受理・予約する。
   * 受理したチャレンジはこのパスの残りで対局中として数える。
   * 前提: スロットが足りず受理しなかったチャレンジはキューに残る。
   *
   * @return number of challenges accepted
   */
  public int acceptChallenges() {
    final List<Challenge> ordered = new ArrayList<>(session.queuedChallenges());
    if (ordered.isEmpty()) {
      return 0;
    }
    // stable: humans first, arrival order otherwise
    ordered.sort(Comparator.comparing(Challenge::challengerIsBot));

    final Set<String> activeGameIds = new HashSet<>(session.activeGameIds());
    int accepted = 0;
    for (Challenge challenge : ordered) {
      if (!slotTracker.canAcceptChallenge(challenge, activeGameIds)) {
        logger.debug(
            "challenge kept in queue challengeId={} speed={}", challenge.id(), challenge.speed());
        continue;
      }
      try {
        gameService.acceptChallenge(challenge.id());
      } catch (RuntimeException ex) {
        logger.warn("challenge accept failed challengeId={}", challenge.id(), ex);
        metrics.recordDependencyError("accept_challenge");
        session.removeChallenge(challenge.id());
        continue;
      }
      logger.info(
          "challenge accepted challengeId={} challenger={} speed={}",
          challenge.id(),
          challenge.challenger(),
          challenge.speed());
      slotTracker.reserveGame(challenge.id(), challenge.challengerIsBot(), challenge.speed());
      if (!challenge.isCorrespondence()) {
        activeGameIds.add(challenge.id());
      }
      session.removeChallenge(challenge.id());
      accepted++;
    }
    return accepted;
  }
}
