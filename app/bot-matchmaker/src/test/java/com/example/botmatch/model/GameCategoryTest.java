package com.example.botmatch.model;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class GameCategoryTest {

  @Test
  void estimatedDurationBoundariesPickSpeed() {
    assertThat(GameCategory.of("standard", 178, 0, 0)).isEqualTo("bullet");
    assertThat(GameCategory.of("standard", 179, 0, 0)).isEqualTo("blitz");
    assertThat(GameCategory.of("standard", 478, 0, 0)).isEqualTo("blitz");
    assertThat(GameCategory.of("standard", 479, 0, 0)).isEqualTo("rapid");
    assertThat(GameCategory.of("standard", 1498, 0, 0)).isEqualTo("rapid");
    assertThat(GameCategory.of("standard", 1499, 0, 0)).isEqualTo("classical");
  }

  @Test
  void incrementCountsFortyMoves() {
    // 60 + 40 * 3 = 180
    assertThat(GameCategory.of("standard", 60, 3, 0)).isEqualTo("blitz");
    assertThat(GameCategory.of("standard", 60, 2, 0)).isEqualTo("bullet");
  }

  @Test
  void daysMeanCorrespondence() {
    assertThat(GameCategory.of("standard", 0, 0, 3)).isEqualTo("correspondence");
  }

  @Test
  void nonStandardVariantIsItsOwnCategory() {
    assertThat(GameCategory.of("atomic", 60, 0, 0)).isEqualTo("atomic");
    assertThat(GameCategory.of("chess960", 0, 0, 14)).isEqualTo("chess960");
    assertThat(TimeControl.realTime(60, 0).category("chess960")).isEqualTo("chess960");
    assertThat(TimeControl.realTime(60, 0).speed()).isEqualTo("bullet");
  }
}
