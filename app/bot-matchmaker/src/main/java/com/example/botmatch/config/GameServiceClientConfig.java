/*
 * Where: Bot matchmaker configuration
 * What: Provides the RestClients used to reach the game server and blocklist hosts
 * Why: Authenticated server calls and anonymous blocklist downloads need separate clients
 */
package com.example.botmatch.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.RestClient;

@Configuration
public class GameServiceClientConfig {

  @Bean
  RestClient gameServiceRestClient(
      RestClient.Builder builder, GameServiceClientProperties properties) {
    final RestClient.Builder configured = builder.baseUrl(properties.baseUrl());
    if (properties.token() != null && !properties.token().isBlank()) {
      configured.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.token());
    }
    return configured.build();
  }

  @Bean
  RestClient blocklistRestClient(RestClient.Builder builder) {
    return builder.build();
  }
}
