/*
 * Where: Bot matchmaker service layer
 * What: Keeps a username block list downloaded from configured URLs
 * Why: Shared community block lists change without redeploying the bot
 */
package com.example.botmatch.service;

import com.example.botmatch.config.MatchmakingProperties;
import com.example.botmatch.timer.CooldownTimer;
import com.google.common.annotations.VisibleForTesting;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

@Component
public class OnlineBlocklist {

  private static final Logger logger = LoggerFactory.getLogger(OnlineBlocklist.class);

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient is a shared Spring-managed component and cannot be copied")
  private final RestClient blocklistRestClient;

  private final List<String> urls;
  private final CooldownTimer refreshTimer;
  private final Map<String, Set<String>> namesByUrl = new ConcurrentHashMap<>();
  private volatile Set<String> names = Set.of();
  private boolean loaded;

  public OnlineBlocklist(
      @Qualifier("blocklistRestClient") RestClient blocklistRestClient,
      MatchmakingProperties properties,
      Clock clock) {
    this.blocklistRestClient = blocklistRestClient;
    this.urls = properties.onlineBlockList();
    this.refreshTimer = new CooldownTimer(clock, properties.onlineBlockListRefreshInterval());
  }

  /** Downloads every list again once the refresh interval has passed. */
  public synchronized void refresh() {
    if (urls.isEmpty() || (loaded && !refreshTimer.isExpired())) {
      return;
    }
    refreshTimer.reset();
    loaded = true;
    for (String url : urls) {
      try {
        final String body = blocklistRestClient.get().uri(url).retrieve().body(String.class);
        namesByUrl.put(url, parse(body));
      } catch (RestClientException ex) {
        logger.warn("online block list refresh failed url={}; keeping previous entries", url, ex);
      }
    }
    final Set<String> merged = new HashSet<>();
    namesByUrl.values().forEach(merged::addAll);
    names = Set.copyOf(merged);
    logger.info("online block list refreshed entries={}", names.size());
  }

  public boolean contains(String username) {
    return username != null && names.contains(username.toLowerCase(Locale.ROOT));
  }

  @VisibleForTesting
  static Set<String> parse(String body) {
    final Set<String> parsed = new HashSet<>();
    if (body == null) {
      return parsed;
    }
    for (String line : body.split("\\R")) {
      final String name = line.strip();
      if (name.isEmpty() || name.startsWith("#")) {
        continue;
      }
      parsed.add(name.toLowerCase(Locale.ROOT));
    }
    return parsed;
  }
}
