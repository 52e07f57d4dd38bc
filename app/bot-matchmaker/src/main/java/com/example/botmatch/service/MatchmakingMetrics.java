package com.example.botmatch.service;

import com.example.botmatch.model.Lane;
import com.example.botmatch.slot.SlotSnapshot;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

@Component
public class MatchmakingMetrics {

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<Lane, AtomicLong> reservedByLane = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> challengeResultCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> declineCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> dependencyErrorCounters = new ConcurrentHashMap<>();

  public MatchmakingMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void updateSlots(SlotSnapshot snapshot) {
    for (Lane lane : Lane.values()) {
      reservedByLane
          .computeIfAbsent(lane, this::registerReservedGauge)
          .set(snapshot.reservations(lane));
    }
  }

  public void recordChallengeResult(String result) {
    challengeResultCounters.computeIfAbsent(result, this::registerChallengeResultCounter).increment();
  }

  public void recordDecline(String reason) {
    declineCounters.computeIfAbsent(reason, this::registerDeclineCounter).increment();
  }

  public void recordDependencyError(String errorType) {
    dependencyErrorCounters
        .computeIfAbsent(errorType, this::registerDependencyErrorCounter)
        .increment();
  }

  private AtomicLong registerReservedGauge(Lane lane) {
    final AtomicLong value = new AtomicLong(0);
    Gauge.builder("bot.slot.reserved", value, AtomicLong::get)
        .tags(Tags.of("lane", lane.value()))
        .register(meterRegistry);
    return value;
  }

  private Counter registerChallengeResultCounter(String result) {
    return Counter.builder("bot.challenge.total")
        .tags(Tags.of("result", result))
        .register(meterRegistry);
  }

  private Counter registerDeclineCounter(String reason) {
    return Counter.builder("bot.challenge.declined.total")
        .tags(Tags.of("reason", reason))
        .register(meterRegistry);
  }

  private Counter registerDependencyErrorCounter(String errorType) {
    return Counter.builder("bot.dependency.error.total")
        .tags(Tags.of("type", errorType))
        .register(meterRegistry);
  }
}
