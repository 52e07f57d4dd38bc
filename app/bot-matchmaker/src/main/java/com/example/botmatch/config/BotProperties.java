/*
 * Where: Bot matchmaker configuration
 * What: Holds bot-wide settings shared by acceptance and matchmaking
 * Why: The concurrency budget decides whether per-lane slot accounting applies
 */
package com.example.botmatch.config;

import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "bot")
@Validated
public record BotProperties(@Positive int concurrency, List<String> variants, Duration pollInterval) {

  private static final String FROM_POSITION = "fromPosition";

  public BotProperties {
    concurrency = concurrency == 0 ? 1 : concurrency;
    variants = variants == null || variants.isEmpty() ? List.of("standard") : List.copyOf(variants);
    pollInterval = pollInterval == null ? Duration.ofSeconds(1) : pollInterval;
  }

  /** Variants usable for outgoing challenges; custom positions cannot be matchmade. */
  public List<String> matchmakingVariants() {
    return variants.stream().filter(variant -> !FROM_POSITION.equals(variant)).toList();
  }
}
