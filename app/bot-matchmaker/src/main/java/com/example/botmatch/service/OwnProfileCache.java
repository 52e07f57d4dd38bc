package com.example.botmatch.service;

import com.example.botmatch.model.BotProfile;
import com.example.botmatch.timer.CooldownTimer;
import java.time.Clock;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Our own profile, refetched at most every few minutes to pick up rating changes. */
@Component
public class OwnProfileCache {

  private static final Logger logger = LoggerFactory.getLogger(OwnProfileCache.class);
  static final Duration REFRESH_INTERVAL = Duration.ofMinutes(5);

  private final GameService gameService;
  private final CooldownTimer refreshTimer;
  private volatile BotProfile profile;

  public OwnProfileCache(GameService gameService, Clock clock) {
    this.gameService = gameService;
    this.refreshTimer = new CooldownTimer(clock, REFRESH_INTERVAL);
  }

  public synchronized void refreshIfStale() {
    if (profile != null && !refreshTimer.isExpired()) {
      return;
    }
    refreshTimer.reset();
    try {
      profile = gameService.getOwnProfile();
    } catch (RuntimeException ex) {
      logger.warn("own profile refresh failed; keeping previous profile", ex);
    }
  }

  public String username() {
    final BotProfile current = profile;
    return current == null ? "" : current.username();
  }

  /** 0 when the category has no rating yet. */
  public int rating(String category) {
    final BotProfile current = profile;
    return current == null ? 0 : current.rating(category);
  }
}
