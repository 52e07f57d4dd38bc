/*
 * Where: Bot matchmaker timers
 * What: A start instant plus a duration, checked on demand
 * Why: Every matchmaking gate is a cooldown; none of them needs a background thread
 */
package com.example.botmatch.timer;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

public final class CooldownTimer {

  private final Clock clock;
  private final Duration duration;
  private Instant startedAt;

  public CooldownTimer(Clock clock, Duration duration) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.duration = Objects.requireNonNull(duration, "duration");
    this.startedAt = Instant.now(clock);
  }

  /** A zero-length timer, i.e. one that is already expired. */
  public static CooldownTimer expired(Clock clock) {
    return new CooldownTimer(clock, Duration.ZERO);
  }

  public void reset() {
    startedAt = Instant.now(clock);
  }

  public boolean isExpired() {
    return !timeSinceReset().minus(duration).isNegative();
  }

  public Duration remaining() {
    final Duration left = duration.minus(timeSinceReset());
    return left.isNegative() ? Duration.ZERO : left;
  }

  public Duration timeSinceReset() {
    return Duration.between(startedAt, Instant.now(clock));
  }

  public Duration duration() {
    return duration;
  }

  public Instant startedAt() {
    return startedAt;
  }
}
