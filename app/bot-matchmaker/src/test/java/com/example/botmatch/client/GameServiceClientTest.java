package com.example.botmatch.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.http.HttpMethod.GET;
import static org.springframework.http.HttpMethod.POST;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.example.botmatch.config.GameServiceClientProperties;
import com.example.botmatch.model.BotProfile;
import com.example.botmatch.model.ChallengeCreationResponse;
import com.example.botmatch.model.ChallengeRequest;
import com.example.botmatch.service.GameServiceIntegrationException;
import com.example.botmatch.service.RateLimitedException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

class GameServiceClientTest {

  @Test
  void createChallengePostsClockTermsAsForm() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://game.test/api/challenge/alice"))
        .andExpect(method(POST))
        .andExpect(
            content()
                .formDataContains(
                    Map.of(
                        "rated", "true",
                        "variant", "standard",
                        "clock.limit", "180",
                        "clock.increment", "2")))
        .andRespond(withSuccess("{\"id\":\"c-1\"}", MediaType.APPLICATION_JSON));

    final ChallengeCreationResponse response =
        fixture.client.createChallenge("alice", ChallengeRequest.realTime(true, "standard", 180, 2));

    assertThat(response.id()).isEqualTo("c-1");
    assertThat(response.hasId()).isTrue();
    assertThat(response.botIsRateLimited()).isFalse();
    fixture.server.verify();
  }

  @Test
  void createCorrespondenceChallengeSendsDays() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://game.test/api/challenge/alice"))
        .andExpect(content().formDataContains(Map.of("days", "3", "rated", "false")))
        .andRespond(withSuccess("{\"id\":\"corr-1\"}", MediaType.APPLICATION_JSON));

    final ChallengeCreationResponse response =
        fixture.client.createChallenge(
            "alice", ChallengeRequest.correspondence(false, "standard", 3));

    assertThat(response.id()).isEqualTo("corr-1");
    fixture.server.verify();
  }

  @Test
  void createChallengeMaps429ToRateLimitedWithRetryAfter() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://game.test/api/challenge/alice"))
        .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS).header("Retry-After", "120"));

    assertThatThrownBy(
            () ->
                fixture.client.createChallenge(
                    "alice", ChallengeRequest.realTime(false, "standard", 60, 0)))
        .isInstanceOf(RateLimitedException.class)
        .extracting(ex -> ((RateLimitedException) ex).retryAfter())
        .isEqualTo(Duration.ofSeconds(120));
  }

  @Test
  void createChallengeUsesDefaultRetryAfterWithoutHeader() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://game.test/api/challenge/alice"))
        .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

    assertThatThrownBy(
            () ->
                fixture.client.createChallenge(
                    "alice", ChallengeRequest.realTime(false, "standard", 60, 0)))
        .isInstanceOf(RateLimitedException.class)
        .extracting(ex -> ((RateLimitedException) ex).retryAfter())
        .isEqualTo(Duration.ofSeconds(60));
  }

  @Test
  void refusedChallengeReturnsRateLimitFlags() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://game.test/api/challenge/alice"))
        .andRespond(
            withStatus(HttpStatus.BAD_REQUEST)
                .contentType(MediaType.APPLICATION_JSON)
                .body(
                    """
                    {"error":"opponent busy","opponent_is_rate_limited":true,"rate_limit_timeout":90}
                    """));

    final ChallengeCreationResponse response =
        fixture.client.createChallenge("alice", ChallengeRequest.realTime(false, "standard", 60, 0));

    assertThat(response.hasId()).isFalse();
    assertThat(response.opponentIsRateLimited()).isTrue();
    assertThat(response.botIsRateLimited()).isFalse();
    assertThat(response.rateLimitTimeout()).isEqualTo(Duration.ofSeconds(90));
    assertThat(response.error()).isEqualTo("opponent busy");
  }

  @Test
  void cancelChallengeMaps404ToNotFound() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://game.test/api/challenge/c-1/cancel"))
        .andExpect(method(POST))
        .andRespond(withStatus(HttpStatus.NOT_FOUND));

    assertThatThrownBy(() -> fixture.client.cancelChallenge("c-1"))
        .isInstanceOf(GameServiceIntegrationException.class)
        .extracting(ex -> ((GameServiceIntegrationException) ex).reason())
        .isEqualTo(GameServiceIntegrationException.Reason.NOT_FOUND);
  }

  @Test
  void acceptChallengeMaps403ToForbidden() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://game.test/api/challenge/c-1/accept"))
        .andRespond(withStatus(HttpStatus.FORBIDDEN));

    assertThatThrownBy(() -> fixture.client.acceptChallenge("c-1"))
        .isInstanceOf(GameServiceIntegrationException.class)
        .extracting(ex -> ((GameServiceIntegrationException) ex).reason())
        .isEqualTo(GameServiceIntegrationException.Reason.FORBIDDEN);
  }

  @Test
  void acceptChallengeSucceedsOnEmptyBody() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://game.test/api/challenge/c-1/accept"))
        .andExpect(method(POST))
        .andRespond(withSuccess());

    fixture.client.acceptChallenge("c-1");

    fixture.server.verify();
  }

  @Test
  void listOnlineBotsParsesEachLine() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://game.test/api/bot/online"))
        .andExpect(method(GET))
        .andRespond(
            withSuccess(
                """
                {"username":"botA","perfs":{"blitz":{"rating":1800,"games":42,"prog":5}}}

                {"username":"botB","perfs":{}}
                """,
                MediaType.APPLICATION_NDJSON));

    final List<BotProfile> bots = fixture.client.listOnlineBots();

    assertThat(bots).extracting(BotProfile::username).containsExactly("botA", "botB");
    assertThat(bots.get(0).rating("blitz")).isEqualTo(1800);
    assertThat(bots.get(0).perf("blitz").games()).isEqualTo(42);
    assertThat(bots.get(1).rating("blitz")).isZero();
  }

  @Test
  void listOnlineBotsMaps5xxToBadGateway() {
    final ClientFixture fixture = newFixture();
    fixture.server.expect(requestTo("http://game.test/api/bot/online")).andRespond(withServerError());

    assertThatThrownBy(fixture.client::listOnlineBots)
        .isInstanceOf(GameServiceIntegrationException.class)
        .extracting(ex -> ((GameServiceIntegrationException) ex).reason())
        .isEqualTo(GameServiceIntegrationException.Reason.BAD_GATEWAY);
  }

  @Test
  void listOnlineBotsMapsBrokenLineToInvalidResponse() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://game.test/api/bot/online"))
        .andRespond(withSuccess("{\"username\":\"botA\"}\nnot-json\n", MediaType.APPLICATION_NDJSON));

    assertThatThrownBy(fixture.client::listOnlineBots)
        .isInstanceOf(GameServiceIntegrationException.class)
        .extracting(ex -> ((GameServiceIntegrationException) ex).reason())
        .isEqualTo(GameServiceIntegrationException.Reason.INVALID_RESPONSE);
  }

  @Test
  void publicProfileCarriesBlockingFlag() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://game.test/api/user/grumpy"))
        .andRespond(
            withSuccess(
                "{\"username\":\"grumpy\",\"blocking\":true}", MediaType.APPLICATION_JSON));

    final BotProfile profile = fixture.client.getPublicProfile("grumpy");

    assertThat(profile.username()).isEqualTo("grumpy");
    assertThat(profile.blocking()).isTrue();
  }

  @Test
  void ownProfileMapsMalformedBodyToInvalidResponse() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://game.test/api/account"))
        .andRespond(withSuccess("{\"foo\":\"bar\"}", MediaType.APPLICATION_JSON));

    assertThatThrownBy(fixture.client::getOwnProfile)
        .isInstanceOf(GameServiceIntegrationException.class)
        .extracting(ex -> ((GameServiceIntegrationException) ex).reason())
        .isEqualTo(GameServiceIntegrationException.Reason.INVALID_RESPONSE);
  }

  @Test
  void ownProfileMapsTimeoutToTimeout() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://game.test/api/account"))
        .andRespond(
            request -> {
              throw new ResourceAccessException(
                  "read timeout", new SocketTimeoutException("Read timed out"));
            });

    assertThatThrownBy(fixture.client::getOwnProfile)
        .isInstanceOf(GameServiceIntegrationException.class)
        .extracting(ex -> ((GameServiceIntegrationException) ex).reason())
        .isEqualTo(GameServiceIntegrationException.Reason.TIMEOUT);
  }

  @Test
  void createChallengeRejectsBlankOpponent() {
    final ClientFixture fixture = newFixture();

    assertThatThrownBy(
            () ->
                fixture.client.createChallenge(
                    " ", ChallengeRequest.realTime(false, "standard", 60, 0)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("opponent is required");
  }

  private ClientFixture newFixture() {
    final RestClient.Builder builder = RestClient.builder();
    final MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
    final RestClient restClient = builder.baseUrl("http://game.test").build();
    final GameServiceClientProperties properties =
        new GameServiceClientProperties(
            "http://game.test", null, null, null, null, null, null, null, null);
    return new ClientFixture(
        new GameServiceClient(restClient, new ObjectMapper(), properties), server);
  }

  private record ClientFixture(GameServiceClient client, MockRestServiceServer server) {}
}
