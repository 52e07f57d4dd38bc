package com.example.botmatch.model;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class DeclineReasonTest {

  private final Challenge challenge =
      new Challenge("c-1", "me", true, "opponent", "blitz", "atomic", true, true);

  @Test
  void speedReasonsPointAtChallengeSpeed() {
    assertThat(DeclineReason.TOO_FAST.aspectOf(challenge)).isEqualTo("blitz");
    assertThat(DeclineReason.TOO_SLOW.aspectOf(challenge)).isEqualTo("blitz");
    assertThat(DeclineReason.TIME_CONTROL.aspectOf(challenge)).isEqualTo("blitz");
  }

  @Test
  void modeAndVariantReasonsPointAtThoseAspects() {
    assertThat(DeclineReason.CASUAL.aspectOf(challenge)).isEqualTo("rated");
    assertThat(DeclineReason.RATED.aspectOf(challenge)).isEqualTo("rated");
    assertThat(DeclineReason.VARIANT.aspectOf(challenge)).isEqualTo("atomic");
    assertThat(DeclineReason.STANDARD.aspectOf(challenge)).isEqualTo("atomic");
  }

  @Test
  void generalReasonsHaveEmptyAspect() {
    assertThat(DeclineReason.GENERIC.aspectOf(challenge)).isEmpty();
    assertThat(DeclineReason.LATER.aspectOf(challenge)).isEmpty();
    assertThat(DeclineReason.NO_BOT.aspectOf(challenge)).isEmpty();
  }

  @Test
  void fromKeyIsCaseInsensitiveAndRejectsUnknown() {
    assertThat(DeclineReason.fromKey("TooFast")).contains(DeclineReason.TOO_FAST);
    assertThat(DeclineReason.fromKey("nobot")).contains(DeclineReason.NO_BOT);
    assertThat(DeclineReason.fromKey("whatever")).isEmpty();
    assertThat(DeclineReason.fromKey(null)).isEmpty();
  }
}
