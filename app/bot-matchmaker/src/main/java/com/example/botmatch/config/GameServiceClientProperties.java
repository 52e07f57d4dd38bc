/*
 * Where: Bot matchmaker configuration
 * What: Holds game server endpoint and credential settings
 * Why: Keep base URL, token and paths outside the client code
 */
package com.example.botmatch.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "game-service")
public record GameServiceClientProperties(
    String baseUrl,
    String token,
    String createChallengePath,
    String cancelChallengePath,
    String acceptChallengePath,
    String onlineBotsPath,
    String publicProfilePath,
    String ownProfilePath,
    Duration defaultRetryAfter) {

  public GameServiceClientProperties {
    baseUrl = baseUrl == null || baseUrl.isBlank() ? "https://lichess.org" : baseUrl;
    createChallengePath =
        createChallengePath == null || createChallengePath.isBlank()
            ? "/api/challenge/{username}"
            : createChallengePath;
    cancelChallengePath =
        cancelChallengePath == null || cancelChallengePath.isBlank()
            ? "/api/challenge/{challengeId}/cancel"
            : cancelChallengePath;
    acceptChallengePath =
        acceptChallengePath == null || acceptChallengePath.isBlank()
            ? "/api/challenge/{challengeId}/accept"
            : acceptChallengePath;
    onlineBotsPath =
        onlineBotsPath == null || onlineBotsPath.isBlank() ? "/api/bot/online" : onlineBotsPath;
    publicProfilePath =
        publicProfilePath == null || publicProfilePath.isBlank()
            ? "/api/user/{username}"
            : publicProfilePath;
    ownProfilePath =
        ownProfilePath == null || ownProfilePath.isBlank() ? "/api/account" : ownProfilePath;
    defaultRetryAfter = defaultRetryAfter == null ? Duration.ofSeconds(60) : defaultRetryAfter;
  }
}
