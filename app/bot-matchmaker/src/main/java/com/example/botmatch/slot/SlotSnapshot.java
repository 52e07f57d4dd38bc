package com.example.botmatch.slot;

import com.example.botmatch.model.Lane;
import java.util.Map;
import java.util.Set;

/** Point-in-time copy of the tracker state for status reporting and gauges. */
public record SlotSnapshot(
    int capacity,
    boolean accountingEnabled,
    Map<Lane, Integer> reservationsByLane,
    Set<String> pendingOutgoingChallenges,
    Set<String> pendingOutgoingCorrespondence) {

  public SlotSnapshot {
    reservationsByLane = Map.copyOf(reservationsByLane);
    pendingOutgoingChallenges = Set.copyOf(pendingOutgoingChallenges);
    pendingOutgoingCorrespondence = Set.copyOf(pendingOutgoingCorrespondence);
  }

  public int reservations(Lane lane) {
    return reservationsByLane.getOrDefault(lane, 0);
  }
}
