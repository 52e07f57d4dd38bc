/*
 * Where: Bot matchmaker service layer
 * What: Game server operations matchmaking depends on
 * Why: Scheduler logic is tested against a mock instead of the HTTP client
 */
package com.example.botmatch.service;

import com.example.botmatch.model.BotProfile;
import com.example.botmatch.model.ChallengeCreationResponse;
import com.example.botmatch.model.ChallengeRequest;
import java.util.List;

/**
 * Implementations throw {@link RateLimitedException} when the server asks us to back off and
 * {@link GameServiceIntegrationException} for every other failure.
 */
public interface GameService {

  ChallengeCreationResponse createChallenge(String opponent, ChallengeRequest request);

  void cancelChallenge(String challengeId);

  void acceptChallenge(String challengeId);

  List<BotProfile> listOnlineBots();

  BotProfile getPublicProfile(String username);

  BotProfile getOwnProfile();
}
