package com.example.botmatch.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.example.botmatch.api.response.MatchmakingStatusResponse;
import com.example.botmatch.model.Challenge;
import com.example.botmatch.slot.SlotTracker;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class MatchmakingStatusServiceTest {

  @Test
  void reportsLanesPendingChallengesAndTiming() {
    final SlotTracker slots = new SlotTracker(3);
    final BotSession session = new BotSession();
    final MatchmakingScheduler scheduler = mock(MatchmakingScheduler.class);
    slots.reserveOutgoingChallenge("out-b", "bullet");
    slots.reserveOutgoingChallenge("out-a", "correspondence");
    slots.reserveGame("human-1", false, "rapid");
    session.addActiveGame("human-1");
    session.enqueueChallenge(
        new Challenge("in-1", "alice", false, "mybot", "blitz", "standard", false, false));
    when(scheduler.outstandingChallengeId()).thenReturn("out-b");
    when(scheduler.nextChallengeTime()).thenReturn(Instant.parse("2026-02-24T12:01:00Z"));

    final MatchmakingStatusResponse status =
        new MatchmakingStatusService(slots, session, scheduler).currentStatus();

    assertThat(status.capacity()).isEqualTo(3);
    assertThat(status.accountingEnabled()).isTrue();
    assertThat(status.reservations())
        .containsEntry("bot_short", 1)
        .containsEntry("correspondence", 1)
        .containsEntry("human", 1)
        .containsEntry("bot_long", 0);
    assertThat(status.activeGames()).isEqualTo(1);
    assertThat(status.queuedChallenges()).isEqualTo(1);
    assertThat(status.pendingOutgoingChallenges()).containsExactly("out-a", "out-b");
    assertThat(status.outstandingChallengeId()).isEqualTo("out-b");
    assertThat(status.nextChallengeAt()).isEqualTo("2026-02-24T12:01:00Z");
  }
}
