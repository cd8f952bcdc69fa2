package io.b2mash.b2b.timeledger.integration.redmine;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import io.b2mash.b2b.timeledger.event.ExternalMappingChangedEvent;
import java.util.Comparator;
import java.util.List;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Selection lists of Redmine users and projects, sorted by label. Lists are cached for the
 * configured TTL and dropped whenever a record carrying a Redmine mapping is saved. Failed lookups
 * are not cached.
 */
@Component
public class RedmineChoices {

  private static final Logger log = LoggerFactory.getLogger(RedmineChoices.class);

  static final String USERS_KEY = "users";
  static final String PROJECTS_KEY = "projects";

  private final RedmineConnector connector;
  private final Cache<String, List<Choice>> cache;

  @Autowired
  public RedmineChoices(RedmineConnector connector, RedmineProperties properties) {
    this(connector, properties, Ticker.systemTicker());
  }

  RedmineChoices(RedmineConnector connector, RedmineProperties properties, Ticker ticker) {
    this.connector = connector;
    this.cache =
        Caffeine.newBuilder()
            .expireAfterWrite(properties.choiceCacheTtl())
            .maximumSize(10)
            .ticker(ticker)
            .build();
  }

  public List<Choice> userChoices() {
    return cached(
        USERS_KEY,
        () ->
            connector.listUsers().stream()
                .map(user -> new Choice(String.valueOf(user.id()), user.label()))
                .toList());
  }

  public List<Choice> projectChoices() {
    return cached(
        PROJECTS_KEY,
        () ->
            connector.listProjects().stream()
                .map(project -> new Choice(String.valueOf(project.id()), project.name()))
                .toList());
  }

  @EventListener
  public void onExternalMappingChanged(ExternalMappingChangedEvent event) {
    log.debug("Dropping Redmine choices after {} {} changed", event.entityType(), event.entityId());
    invalidate();
  }

  public void invalidate() {
    cache.invalidateAll();
  }

  /** Concurrent callers of a missing key share one load; a failed load leaves the key absent. */
  private List<Choice> cached(String key, Supplier<List<Choice>> loader) {
    try {
      return cache.get(
          key,
          missing ->
              loader.get().stream()
                  .sorted(
                      Comparator.comparing(
                          Choice::label, Comparator.nullsLast(String.CASE_INSENSITIVE_ORDER)))
                  .toList());
    } catch (RedmineException e) {
      log.warn("Could not load Redmine {} choices: {}", key, e.getMessage());
      return List.of();
    }
  }
}
