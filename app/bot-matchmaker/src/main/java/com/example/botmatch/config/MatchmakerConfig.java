/*
 * Where: Bot matchmaker configuration
 * What: Wires the shared slot tracker and the random source used for opponent selection
 * Why: Acceptance and matchmaking must consult the same tracker instance
 */
package com.example.botmatch.config;

import com.example.botmatch.slot.SlotTracker;
import java.util.Random;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MatchmakerConfig {

  @Bean
  SlotTracker slotTracker(BotProperties botProperties) {
    return new SlotTracker(botProperties.concurrency());
  }

  @Bean
  Random matchmakingRandom() {
    return new Random();
  }
}
