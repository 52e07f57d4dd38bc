package com.example.botmatch.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.example.botmatch.model.Challenge;
import com.example.botmatch.slot.SlotTracker;
import org.junit.jupiter.api.Test;

class GameEventHandlerTest {

  private final BotSession session = new BotSession();
  private final SlotTracker slots = new SlotTracker(3);
  private final MatchmakingScheduler scheduler = mock(MatchmakingScheduler.class);
  private final GameEventHandler handler = new GameEventHandler(session, slots, scheduler);

  @Test
  void ownChallengesAreNotQueued() {
    handler.onChallengeReceived(
        new Challenge("mine", "mybot", true, "other", "blitz", "standard", false, true));
    handler.onChallengeReceived(
        new Challenge("theirs", "alice", false, "mybot", "blitz", "standard", false, false));

    assertThat(session.queuedChallenges()).extracting(Challenge::id).containsExactly("theirs");
  }

  @Test
  void gameStartReservesLaneOnce() {
    slots.reserveOutgoingChallenge("game-1", "blitz");

    handler.onGameStart("game-1", true, "blitz");
    handler.onGameStart("game-2", false, "rapid");

    verify(scheduler).acceptedChallenge("game-1");
    assertThat(session.activeGameIds()).containsExactlyInAnyOrder("game-1", "game-2");
    assertThat(slots.hasReservation("game-2")).isTrue();
    assertThat(slots.usedSlots(session.activeGameIds())).isEqualTo(2);
  }

  @Test
  void gameFinishReleasesAndStartsPostGameTimer() {
    handler.onGameStart("game-1", true, "bullet");

    handler.onGameFinish("game-1");

    assertThat(session.activeGameIds()).isEmpty();
    assertThat(slots.hasReservation("game-1")).isFalse();
    verify(scheduler).gameDone();
    verify(scheduler, never()).correspondenceGameDone();
  }

  @Test
  void finishedCorrespondenceGameRequestsImmediateReplacement() {
    handler.onGameStart("corr-1", true, "correspondence");

    handler.onGameFinish("corr-1");

    verify(scheduler).gameDone();
    verify(scheduler).correspondenceGameDone();
    assertThat(slots.correspondenceReservationCount()).isZero();
  }

  @Test
  void correspondenceMoveKeepsReservation() {
    handler.onGameStart("corr-1", true, "correspondence");

    handler.onCorrespondenceMoveCompleted("corr-1");

    assertThat(session.isActive("corr-1")).isFalse();
    assertThat(slots.isCorrespondence("corr-1")).isTrue();
  }

  @Test
  void canceledChallengeLeavesQueueAndSlots() {
    final Challenge challenge =
        new Challenge("c-1", "alice", false, "mybot", "blitz", "standard", false, false);
    handler.onChallengeReceived(challenge);
    slots.reserveGame("c-1", false, "blitz");

    handler.onChallengeCanceled("c-1");

    assertThat(session.queuedChallenges()).isEmpty();
    assertThat(slots.hasReservation("c-1")).isFalse();
    verify(scheduler).canceledChallenge("c-1");
  }

  @Test
  void declineIsForwardedToScheduler() {
    final Challenge challenge =
        new Challenge("c-1", "mybot", true, "other", "blitz", "standard", false, true);

    handler.onChallengeDeclined(challenge, "later");

    verify(scheduler).declinedChallenge(challenge, "later");
  }
}
