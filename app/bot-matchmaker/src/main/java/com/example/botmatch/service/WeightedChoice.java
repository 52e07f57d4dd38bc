package com.example.botmatch.service;

import java.util.List;
import java.util.Random;

/** Cumulative-weight sampling over a candidate list. */
final class WeightedChoice {

  private WeightedChoice() {}

  /**
   * Negative weights count as zero. When every weight is zero the pick is uniform.
   *
   * @throws IllegalArgumentException if there is nothing to pick from
   */
  static <T> T pick(List<T> items, List<Long> weights, Random random) {
    if (items.isEmpty()) {
      throw new IllegalArgumentException("no candidates to choose from");
    }
    if (items.size() != weights.size()) {
      throw new IllegalArgumentException("items and weights differ in size");
    }
    long total = 0;
    for (long weight : weights) {
      total += Math.max(0, weight);
    }
    if (total == 0) {
      return items.get(random.nextInt(items.size()));
    }
    long target = (long) (random.nextDouble() * total);
    for (int i = 0; i < items.size(); i++) {
      target -= Math.max(0, weights.get(i));
      if (target < 0) {
        return items.get(i);
      }
    }
    return items.get(items.size() - 1);
  }
}
