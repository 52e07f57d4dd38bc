/*
 * Where: Bot matchmaker slot accounting
 * What: Maps every in-flight game or outgoing challenge to a lane and answers capacity checks
 * Why: With three slots one goes to humans, one to a short bot game, one to a long bot game
 */
package com.example.botmatch.slot;

import com.example.botmatch.model.BotLane;
import com.example.botmatch.model.Challenge;
import com.example.botmatch.model.GameSpeeds;
import com.example.botmatch.model.Lane;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Lane reservations for games and pending outgoing challenges.
 *
 * <p>Strict per-lane accounting applies only when the capacity is exactly three. With any other
 * capacity every mutator is a no-op and only the active-game count is checked against capacity.
 * Correspondence games ride alongside the real-time lanes and do not count toward capacity.
 *
 * <p>All methods synchronize on the tracker, which is the single owner of slot state shared
 * between the matchmaking worker and the event handler.
 */
public class SlotTracker {

  public static final int ACCOUNTING_CAPACITY = 3;
  private static final int MAX_BOT_RESERVATIONS = 2;

  private final int capacity;
  private final boolean accountingEnabled;
  private final Map<String, Lane> reservations = new HashMap<>();
  private final Set<String> pendingOutgoingChallenges = new LinkedHashSet<>();
  private final Set<String> pendingOutgoingCorrespondence = new LinkedHashSet<>();

  public SlotTracker(int capacity) {
    if (capacity < 1) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    this.capacity = capacity;
    this.accountingEnabled = capacity == ACCOUNTING_CAPACITY;
  }

  public int capacity() {
    return capacity;
  }

  public boolean accountingEnabled() {
    return accountingEnabled;
  }

  /** Reserves a lane for a running game or an accepted incoming challenge. */
  public synchronized void reserveGame(String id, boolean isBotGame, String speed) {
    if (!accountingEnabled) {
      return;
    }
    reservations.put(id, laneFor(isBotGame, speed));
    clearPending(id);
  }

  /** Holds a lane for an outgoing challenge until it is accepted, declined or cancelled. */
  public synchronized void reserveOutgoingChallenge(String id, String speed) {
    if (!accountingEnabled) {
      return;
    }
    reservations.put(id, laneFor(true, speed));
    if (GameSpeeds.isCorrespondence(speed)) {
      pendingOutgoingCorrespondence.add(id);
    } else {
      pendingOutgoingChallenges.add(id);
    }
  }

  /** The challenge became a game; the lane stays reserved under the same id. */
  public synchronized void confirmGameStart(String id) {
    if (!accountingEnabled) {
      return;
    }
    clearPending(id);
  }

  public synchronized void release(String id) {
    if (!accountingEnabled) {
      return;
    }
    clearPending(id);
    reservations.remove(id);
  }

  public synchronized boolean hasReservation(String id) {
    return accountingEnabled && reservations.containsKey(id);
  }

  public synchronized boolean isCorrespondence(String id) {
    return accountingEnabled && reservations.get(id) == Lane.CORRESPONDENCE;
  }

  /** Active games plus outgoing real-time challenges that have not turned into games yet. */
  public synchronized int usedSlots(Set<String> activeGameIds) {
    if (!accountingEnabled) {
      return activeGameIds.size();
    }
    int pending = 0;
    for (String challengeId : pendingOutgoingChallenges) {
      if (!activeGameIds.contains(challengeId)) {
        pending++;
      }
    }
    return activeGameIds.size() + pending;
  }

  public synchronized boolean canAcceptHuman(Set<String> activeGameIds) {
    return usedSlots(activeGameIds) < capacity;
  }

  public synchronized boolean canAcceptCorrespondence(Set<String> activeGameIds) {
    if (!accountingEnabled) {
      return usedSlots(activeGameIds) < capacity;
    }
    return true;
  }

  public synchronized boolean canAcceptBotSpeed(String speed, Set<String> activeGameIds) {
    if (GameSpeeds.isCorrespondence(speed)) {
      return canAcceptCorrespondence(activeGameIds);
    }
    if (usedSlots(activeGameIds) >= capacity) {
      return false;
    }
    if (!accountingEnabled) {
      return true;
    }
    final Map<BotLane, Integer> counts = botLaneCounts();
    if (totalBotReservations(counts) >= MAX_BOT_RESERVATIONS) {
      return false;
    }
    return counts.get(BotLane.forSpeed(speed)) == 0;
  }

  public synchronized boolean canAcceptChallenge(Challenge challenge, Set<String> activeGameIds) {
    if (challenge.isCorrespondence()) {
      return canAcceptCorrespondence(activeGameIds);
    }
    if (challenge.challengerIsBot()) {
      return canAcceptBotSpeed(challenge.speed(), activeGameIds);
    }
    return canAcceptHuman(activeGameIds);
  }

  /** Bot lanes an outgoing real-time challenge may target right now. */
  public synchronized Set<BotLane> availableBotLanes(Set<String> activeGameIds) {
    if (usedSlots(activeGameIds) >= capacity) {
      return EnumSet.noneOf(BotLane.class);
    }
    if (!accountingEnabled) {
      return EnumSet.allOf(BotLane.class);
    }
    final Map<BotLane, Integer> counts = botLaneCounts();
    final Set<BotLane> available = EnumSet.noneOf(BotLane.class);
    if (totalBotReservations(counts) >= MAX_BOT_RESERVATIONS) {
      return available;
    }
    for (BotLane lane : BotLane.values()) {
      if (counts.get(lane) == 0) {
        available.add(lane);
      }
    }
    return available;
  }

  /** A correspondence move borrows the compute turn of a free bot lane. */
  public synchronized boolean canStartCorrespondenceMove(Set<String> activeGameIds) {
    if (usedSlots(activeGameIds) >= capacity) {
      return false;
    }
    if (!accountingEnabled) {
      return true;
    }
    return !availableBotLanes(activeGameIds).isEmpty();
  }

  public synchronized boolean hasCorrespondenceReservation() {
    return correspondenceReservationCount() > 0;
  }

  public synchronized boolean needsCorrespondenceGame() {
    return accountingEnabled && !hasCorrespondenceReservation();
  }

  public synchronized int correspondenceReservationCount() {
    if (!accountingEnabled) {
      return 0;
    }
    int count = 0;
    for (Lane lane : reservations.values()) {
      if (lane == Lane.CORRESPONDENCE) {
        count++;
      }
    }
    return count;
  }

  public synchronized SlotSnapshot snapshot() {
    final Map<Lane, Integer> laneCounts = new EnumMap<>(Lane.class);
    for (Lane lane : reservations.values()) {
      laneCounts.merge(lane, 1, Integer::sum);
    }
    return new SlotSnapshot(
        capacity,
        accountingEnabled,
        laneCounts,
        pendingOutgoingChallenges,
        pendingOutgoingCorrespondence);
  }

  private Lane laneFor(boolean isBotGame, String speed) {
    if (GameSpeeds.isCorrespondence(speed)) {
      return Lane.CORRESPONDENCE;
    }
    if (!accountingEnabled) {
      return Lane.ANY;
    }
    if (!isBotGame) {
      return Lane.HUMAN;
    }
    return BotLane.forSpeed(speed).toLane();
  }

  private Map<BotLane, Integer> botLaneCounts() {
    final Map<BotLane, Integer> counts = new EnumMap<>(BotLane.class);
    for (BotLane lane : BotLane.values()) {
      counts.put(lane, 0);
    }
    for (Lane lane : reservations.values()) {
      if (lane == Lane.BOT_SHORT) {
        counts.merge(BotLane.SHORT, 1, Integer::sum);
      } else if (lane == Lane.BOT_LONG) {
        counts.merge(BotLane.LONG, 1, Integer::sum);
      }
    }
    return counts;
  }

  private int totalBotReservations(Map<BotLane, Integer> counts) {
    return counts.get(BotLane.SHORT) + counts.get(BotLane.LONG);
  }

  private void clearPending(String id) {
    pendingOutgoingChallenges.remove(id);
    pendingOutgoingCorrespondence.remove(id);
  }
}
