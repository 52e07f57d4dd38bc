package com.example.botmatch.service;

import com.example.botmatch.api.response.MatchmakingStatusResponse;
import com.example.botmatch.model.Lane;
import com.example.botmatch.slot.SlotSnapshot;
import com.example.botmatch.slot.SlotTracker;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class MatchmakingStatusService {

  private final SlotTracker slotTracker;
  private final BotSession session;
  private final MatchmakingScheduler scheduler;

  public MatchmakingStatusResponse currentStatus() {
    final SlotSnapshot snapshot = slotTracker.snapshot();
    final Map<String, Integer> reservations = new LinkedHashMap<>();
    for (Lane lane : Lane.values()) {
      reservations.put(lane.value(), snapshot.reservations(lane));
    }
    final List<String> pending = new ArrayList<>(snapshot.pendingOutgoingChallenges());
    pending.addAll(snapshot.pendingOutgoingCorrespondence());
    pending.sort(null);
    return new MatchmakingStatusResponse(
        snapshot.capacity(),
        snapshot.accountingEnabled(),
        reservations,
        session.activeGameIds().size(),
        session.queuedChallenges().size(),
        pending,
        scheduler.outstandingChallengeId(),
        scheduler.nextChallengeTime().toString());
  }
}
