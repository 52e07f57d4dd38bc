package com.example.botmatch.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** Body of a challenge creation reply; {@code rateLimitTimeout} is in seconds. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChallengeCreatedPayload(
    String id,
    Boolean botIsRateLimited,
    Boolean opponentIsRateLimited,
    Long rateLimitTimeout,
    String error) {}
