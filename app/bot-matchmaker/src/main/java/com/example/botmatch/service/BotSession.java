/*
 * Where: Bot matchmaker service layer
 * What: Host-observed games and incoming challenges
 * Why: The worker tick and the event handler need one shared view of what the bot is doing
 */
package com.example.botmatch.service;

import com.example.botmatch.model.Challenge;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

@Component
public class BotSession {

  private final Set<String> activeGameIds = ConcurrentHashMap.newKeySet();
  private final List<Challenge> incomingQueue = new ArrayList<>();

  public void addActiveGame(String gameId) {
    activeGameIds.add(gameId);
  }

  public boolean removeActiveGame(String gameId) {
    return activeGameIds.remove(gameId);
  }

  public boolean isActive(String gameId) {
    return activeGameIds.contains(gameId);
  }

  /** Snapshot; later changes to the session are not reflected. */
  public Set<String> activeGameIds() {
    return Set.copyOf(activeGameIds);
  }

  public synchronized void enqueueChallenge(Challenge challenge) {
    incomingQueue.removeIf(queued -> queued.id().equals(challenge.id()));
    incomingQueue.add(challenge);
  }

  public synchronized boolean removeChallenge(String challengeId) {
    return incomingQueue.removeIf(queued -> queued.id().equals(challengeId));
  }

  /** Snapshot in arrival order. */
  public synchronized List<Challenge> queuedChallenges() {
    return List.copyOf(incomingQueue);
  }
}
