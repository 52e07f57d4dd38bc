/*
 * Where: Bot matchmaker service layer
 * What: Remembers which opponents recently declined which aspect of a challenge
 * Why: Re-challenging on a declined time control, variant or mode wastes rate-limit budget
 */
package com.example.botmatch.service;

import com.example.botmatch.timer.CooldownTimer;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * Suppression timers keyed by opponent and aspect.
 *
 * <p>The aspect is a speed, variant or mode name; the empty aspect suppresses the opponent
 * entirely and doubles as the permanent block list. A missing entry counts as expired and reads
 * never insert entries.
 */
@Component
public class AcceptanceMemory {

  public static final String ANY_ASPECT = "";
  public static final Duration DEFAULT_SUPPRESSION = Duration.ofDays(1);
  public static final Duration BLOCK_DURATION = Duration.ofDays(3650);

  private final Clock clock;
  private final Map<Key, CooldownTimer> suppressions = new ConcurrentHashMap<>();

  public AcceptanceMemory(Clock clock) {
    this.clock = clock;
  }

  public void suppress(String opponent, String aspect, Duration duration) {
    suppressions.values().removeIf(CooldownTimer::isExpired);
    suppressions.put(
        new Key(opponent, aspect),
        new CooldownTimer(clock, duration == null ? DEFAULT_SUPPRESSION : duration));
  }

  public void suppress(String opponent, String aspect) {
    suppress(opponent, aspect, null);
  }

  public boolean isAcceptable(String opponent, String aspect) {
    final CooldownTimer timer = suppressions.get(new Key(opponent, aspect));
    return timer == null || timer.isExpired();
  }

  public void block(String opponent) {
    suppress(opponent, ANY_ASPECT, BLOCK_DURATION);
  }

  public boolean isBlocked(String opponent) {
    return !isAcceptable(opponent, ANY_ASPECT);
  }

  @VisibleForTesting
  int size() {
    return suppressions.size();
  }

  private record Key(String opponent, String aspect) {}
}
