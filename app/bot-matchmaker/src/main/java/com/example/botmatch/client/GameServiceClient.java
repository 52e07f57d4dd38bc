package com.example.botmatch.client;

import com.example.botmatch.client.dto.ChallengeCreatedPayload;
import com.example.botmatch.client.dto.UserPayload;
import com.example.botmatch.config.GameServiceClientProperties;
import com.example.botmatch.model.BotProfile;
import com.example.botmatch.model.ChallengeCreationResponse;
import com.example.botmatch.model.ChallengeRequest;
import com.example.botmatch.service.GameService;
import com.example.botmatch.service.GameServiceIntegrationException;
import com.example.botmatch.service.RateLimitedException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

/** {@link GameService} over the game server's HTTP API. */
@Service
public class GameServiceClient implements GameService {

  private static final Logger logger = LoggerFactory.getLogger(GameServiceClient.class);

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient is a shared Spring-managed component and cannot be copied")
  private final RestClient gameServiceRestClient;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper is a shared Spring-managed component and cannot be copied")
  private final ObjectMapper objectMapper;

  private final GameServiceClientProperties properties;

  public GameServiceClient(
      @Qualifier("gameServiceRestClient") RestClient gameServiceRestClient,
      ObjectMapper objectMapper,
      GameServiceClientProperties properties) {
    this.gameServiceRestClient = gameServiceRestClient;
    this.objectMapper = objectMapper;
    this.properties = properties;
  }

  @Override
  public ChallengeCreationResponse createChallenge(String opponent, ChallengeRequest request) {
    requireText(opponent, "opponent is required");
    try {
      final ChallengeCreatedPayload payload =
          gameServiceRestClient
              .post()
              .uri(properties.createChallengePath(), opponent)
              .contentType(MediaType.APPLICATION_FORM_URLENCODED)
              .body(formOf(request))
              .retrieve()
              .body(ChallengeCreatedPayload.class);
      if (payload == null) {
        throw new GameServiceIntegrationException(
            GameServiceIntegrationException.Reason.INVALID_RESPONSE,
            "challenge response is empty");
      }
      return toResponse(payload);
    } catch (RestClientResponseException ex) {
      if (ex.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
        throw rateLimited(ex);
      }
      // a refused challenge still carries the rate-limit flags in its body
      if (ex.getStatusCode().is4xxClientError()) {
        final ChallengeCreatedPayload refused = parseRefusal(ex);
        if (refused != null) {
          logger.warn(
              "challenge refused by server opponent={} status={}",
              opponent,
              ex.getStatusCode().value());
          return toResponse(refused);
        }
      }
      throw mapResponseException(ex, "createChallenge");
    } catch (ResourceAccessException ex) {
      throw mapResourceException(ex, "createChallenge");
    } catch (GameServiceIntegrationException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      throw invalidResponse("createChallenge", ex);
    }
  }

  @Override
  public void cancelChallenge(String challengeId) {
    requireText(challengeId, "challengeId is required");
    postWithoutBody(properties.cancelChallengePath(), challengeId, "cancelChallenge");
  }

  @Override
  public void acceptChallenge(String challengeId) {
    requireText(challengeId, "challengeId is required");
    postWithoutBody(properties.acceptChallengePath(), challengeId, "acceptChallenge");
  }

  @Override
  public List<BotProfile> listOnlineBots() {
    final String body;
    try {
      body =
          gameServiceRestClient
              .get()
              .uri(properties.onlineBotsPath())
              .accept(MediaType.APPLICATION_NDJSON)
              .retrieve()
              .body(String.class);
    } catch (RestClientResponseException ex) {
      throw mapResponseException(ex, "listOnlineBots");
    } catch (ResourceAccessException ex) {
      throw mapResourceException(ex, "listOnlineBots");
    }
    if (body == null) {
      return List.of();
    }
    final List<BotProfile> bots = new ArrayList<>();
    for (String line : body.split("\n")) {
      if (line.isBlank()) {
        continue;
      }
      try {
        bots.add(toProfile(objectMapper.readValue(line, UserPayload.class)));
      } catch (JsonProcessingException | GameServiceIntegrationException ex) {
        throw invalidResponse("listOnlineBots", ex);
      }
    }
    return bots;
  }

  @Override
  public BotProfile getPublicProfile(String username) {
    requireText(username, "username is required");
    return getProfile(properties.publicProfilePath(), "getPublicProfile", username);
  }

  @Override
  public BotProfile getOwnProfile() {
    return getProfile(properties.ownProfilePath(), "getOwnProfile");
  }

  private BotProfile getProfile(String path, String operation, Object... uriVariables) {
    try {
      return toProfile(
          gameServiceRestClient.get().uri(path, uriVariables).retrieve().body(UserPayload.class));
    } catch (RestClientResponseException ex) {
      throw mapResponseException(ex, operation);
    } catch (ResourceAccessException ex) {
      throw mapResourceException(ex, operation);
    } catch (GameServiceIntegrationException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      throw invalidResponse(operation, ex);
    }
  }

  private void postWithoutBody(String path, String challengeId, String operation) {
    try {
      gameServiceRestClient.post().uri(path, challengeId).retrieve().toBodilessEntity();
    } catch (RestClientResponseException ex) {
      throw mapResponseException(ex, operation);
    } catch (ResourceAccessException ex) {
      throw mapResourceException(ex, operation);
    }
  }

  private MultiValueMap<String, String> formOf(ChallengeRequest request) {
    final MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
    form.add("rated", String.valueOf(request.rated()));
    form.add("variant", request.variant());
    if (request.days() != null) {
      form.add("days", String.valueOf(request.days()));
    } else {
      form.add("clock.limit", String.valueOf(request.clockLimitSeconds()));
      form.add("clock.increment", String.valueOf(request.clockIncrementSeconds()));
    }
    return form;
  }

  private ChallengeCreatedPayload parseRefusal(RestClientResponseException ex) {
    final String body = ex.getResponseBodyAsString();
    if (body == null || body.isBlank()) {
      return null;
    }
    try {
      return objectMapper.readValue(body, ChallengeCreatedPayload.class);
    } catch (JsonProcessingException parseFailure) {
      logger.debug("challenge refusal body is not json status={}", ex.getStatusCode().value());
      return null;
    }
  }

  private RateLimitedException rateLimited(RestClientResponseException ex) {
    Duration retryAfter = properties.defaultRetryAfter();
    final HttpHeaders headers = ex.getResponseHeaders();
    final String header = headers == null ? null : headers.getFirst(HttpHeaders.RETRY_AFTER);
    if (header != null) {
      try {
        retryAfter = Duration.ofSeconds(Long.parseLong(header.trim()));
      } catch (NumberFormatException badHeader) {
        logger.warn("ignoring unparseable Retry-After header value={}", header);
      }
    }
    logger.warn("game server rate limited us retryAfter={}", retryAfter);
    return new RateLimitedException("game server rate limit", retryAfter);
  }

  private ChallengeCreationResponse toResponse(ChallengeCreatedPayload payload) {
    return new ChallengeCreationResponse(
        payload.id(),
        Boolean.TRUE.equals(payload.botIsRateLimited()),
        Boolean.TRUE.equals(payload.opponentIsRateLimited()),
        payload.rateLimitTimeout() == null ? null : Duration.ofSeconds(payload.rateLimitTimeout()),
        payload.error());
  }

  private BotProfile toProfile(UserPayload payload) {
    if (payload == null || isBlank(payload.username())) {
      throw new GameServiceIntegrationException(
          GameServiceIntegrationException.Reason.INVALID_RESPONSE, "profile response is invalid");
    }
    return new BotProfile(
        payload.username(), payload.perfs(), Boolean.TRUE.equals(payload.blocking()));
  }

  private GameServiceIntegrationException mapResponseException(
      RestClientResponseException ex, String operation) {
    logger.warn(
        "game server {} failed with http status={} statusText={}",
        operation,
        ex.getStatusCode().value(),
        ex.getStatusText());
    if (ex.getStatusCode().value() == 403) {
      return new GameServiceIntegrationException(
          GameServiceIntegrationException.Reason.FORBIDDEN, "game server denied access", ex);
    }
    if (ex.getStatusCode().value() == 404) {
      return new GameServiceIntegrationException(
          GameServiceIntegrationException.Reason.NOT_FOUND, "game server resource not found", ex);
    }
    if (ex.getStatusCode().is5xxServerError()) {
      return new GameServiceIntegrationException(
          GameServiceIntegrationException.Reason.BAD_GATEWAY, "game server error", ex);
    }
    return new GameServiceIntegrationException(
        GameServiceIntegrationException.Reason.BAD_GATEWAY, "game server request failed", ex);
  }

  private GameServiceIntegrationException mapResourceException(
      ResourceAccessException ex, String operation) {
    if (isTimeout(ex)) {
      logger.warn("game server {} timed out", operation);
      return new GameServiceIntegrationException(
          GameServiceIntegrationException.Reason.TIMEOUT, "game server request timeout", ex);
    }
    logger.warn("game server {} connection failed", operation, ex);
    return new GameServiceIntegrationException(
        GameServiceIntegrationException.Reason.BAD_GATEWAY, "game server connection failed", ex);
  }

  private GameServiceIntegrationException invalidResponse(String operation, Exception ex) {
    logger.warn("game server {} response parse failed", operation, ex);
    return new GameServiceIntegrationException(
        GameServiceIntegrationException.Reason.INVALID_RESPONSE,
        "game server response parse failed",
        ex);
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  private void requireText(String value, String message) {
    if (isBlank(value)) {
      throw new IllegalArgumentException(message);
    }
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
