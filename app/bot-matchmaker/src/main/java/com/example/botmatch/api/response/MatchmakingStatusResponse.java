/*
 * Where: Bot matchmaker status API response DTO
 * What: Current slot usage and matchmaking timing
 * Why: Operators need to see why the bot is or is not challenging
 */
package com.example.botmatch.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MatchmakingStatusResponse(
    int capacity,
    boolean accountingEnabled,
    Map<String, Integer> reservations,
    int activeGames,
    int queuedChallenges,
    List<String> pendingOutgoingChallenges,
    String outstandingChallengeId,
    String nextChallengeAt) {}
