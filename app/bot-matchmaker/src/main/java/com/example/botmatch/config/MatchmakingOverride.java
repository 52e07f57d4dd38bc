/*
 * Where: Bot matchmaker configuration
 * What: A named partial matchmaking configuration
 * Why: Each challenge may pick one override at random to vary the offered terms
 */
package com.example.botmatch.config;

import java.util.List;

/** Null fields keep the base configuration's value. */
public record MatchmakingOverride(
    List<Integer> challengeInitialTime,
    List<Integer> challengeIncrement,
    List<Integer> challengeDays,
    String challengeVariant,
    String challengeMode,
    Integer opponentMinRating,
    Integer opponentMaxRating,
    Integer opponentRatingDifference,
    String ratingPreference) {}
