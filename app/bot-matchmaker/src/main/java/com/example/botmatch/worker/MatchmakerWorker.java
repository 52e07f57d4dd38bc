package com.example.botmatch.worker;

import com.example.botmatch.config.BotProperties;
import com.example.botmatch.service.BotSession;
import com.example.botmatch.service.ChallengeAcceptor;
import com.example.botmatch.service.MatchmakingMetrics;
import com.example.botmatch.service.MatchmakingScheduler;
import com.example.botmatch.slot.SlotTracker;
import com.example.common.TraceIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "bot.worker-enabled", havingValue = "true", matchIfMissing = true)
public class MatchmakerWorker {

  private static final Logger logger = LoggerFactory.getLogger(MatchmakerWorker.class);

  private final BotSession session;
  private final ChallengeAcceptor acceptor;
  private final MatchmakingScheduler scheduler;
  private final SlotTracker slotTracker;
  private final MatchmakingMetrics metrics;
  private final BotProperties properties;

  public MatchmakerWorker(
      BotSession session,
      ChallengeAcceptor acceptor,
      MatchmakingScheduler scheduler,
      SlotTracker slotTracker,
      MatchmakingMetrics metrics,
      BotProperties properties) {
    this.session = session;
    this.acceptor = acceptor;
    this.scheduler = scheduler;
    this.slotTracker = slotTracker;
    this.metrics = metrics;
    this.properties = properties;
  }

  @Scheduled(fixedDelayString = "${bot.poll-interval:PT1S}")
  public void run() {
    TraceIds.runTraced(this::tick);
  }

  private void tick() {
    try {
      acceptor.acceptChallenges();
      scheduler.challenge(
          session.activeGameIds(), session.queuedChallenges(), properties.concurrency());
    } catch (RuntimeException ex) {
      logger.warn("matchmaker worker loop failed", ex);
      metrics.recordDependencyError("worker_loop");
    } finally {
      metrics.updateSlots(slotTracker.snapshot());
    }
  }
}
