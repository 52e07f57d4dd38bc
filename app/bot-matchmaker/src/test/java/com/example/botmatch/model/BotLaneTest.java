package com.example.botmatch.model;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class BotLaneTest {

  @Test
  void fastSpeedsUseShortLane() {
    assertThat(BotLane.forSpeed("ultraBullet")).isEqualTo(BotLane.SHORT);
    assertThat(BotLane.forSpeed("bullet")).isEqualTo(BotLane.SHORT);
    assertThat(BotLane.forSpeed("blitz")).isEqualTo(BotLane.SHORT);
  }

  @Test
  void everythingElseUsesLongLane() {
    assertThat(BotLane.forSpeed("rapid")).isEqualTo(BotLane.LONG);
    assertThat(BotLane.forSpeed("classical")).isEqualTo(BotLane.LONG);
    assertThat(BotLane.forSpeed("atomic")).isEqualTo(BotLane.LONG);
  }

  @Test
  void mapsToReservationLane() {
    assertThat(BotLane.SHORT.toLane()).isEqualTo(Lane.BOT_SHORT);
    assertThat(BotLane.LONG.toLane().value()).isEqualTo("bot_long");
  }
}
