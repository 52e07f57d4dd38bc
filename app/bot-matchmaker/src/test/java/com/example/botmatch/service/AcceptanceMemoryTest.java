package com.example.botmatch.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.botmatch.MutableClock;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class AcceptanceMemoryTest {

  private final MutableClock clock = MutableClock.startingAt("2026-02-24T12:00:00Z");
  private final AcceptanceMemory memory = new AcceptanceMemory(clock);

  @Test
  void unknownOpponentIsAcceptable() {
    assertThat(memory.isAcceptable("somebot", "blitz")).isTrue();
    assertThat(memory.isBlocked("somebot")).isFalse();
  }

  @Test
  void suppressionLastsOneDayByDefault() {
    memory.suppress("somebot", "blitz");

    assertThat(memory.isAcceptable("somebot", "blitz")).isFalse();
    assertThat(memory.isAcceptable("somebot", "rapid")).isTrue();
    assertThat(memory.isAcceptable("otherbot", "blitz")).isTrue();

    clock.advance(Duration.ofDays(1));
    assertThat(memory.isAcceptable("somebot", "blitz")).isTrue();
  }

  @Test
  void explicitDurationIsHonoured() {
    memory.suppress("somebot", AcceptanceMemory.ANY_ASPECT, Duration.ofSeconds(30));

    assertThat(memory.isBlocked("somebot")).isTrue();
    clock.advance(Duration.ofSeconds(30));
    assertThat(memory.isBlocked("somebot")).isFalse();
  }

  @Test
  void blockLastsYears() {
    memory.block("rude");

    clock.advance(Duration.ofDays(365));

    assertThat(memory.isBlocked("rude")).isTrue();
  }

  @Test
  void expiredSuppressionsAreDroppedOnNextSuppress() {
    memory.suppress("first", "blitz", Duration.ofMinutes(1));
    memory.suppress("second", "rapid", Duration.ofHours(1));
    clock.advance(Duration.ofMinutes(2));

    memory.suppress("third", "bullet");

    assertThat(memory.size()).isEqualTo(2);
    assertThat(memory.isAcceptable("first", "blitz")).isTrue();
    assertThat(memory.isAcceptable("second", "rapid")).isFalse();
  }

  @Test
  void readsNeverAddEntries() {
    memory.isAcceptable("somebot", "blitz");
    memory.isBlocked("otherbot");

    assertThat(memory.size()).isZero();
  }
}
