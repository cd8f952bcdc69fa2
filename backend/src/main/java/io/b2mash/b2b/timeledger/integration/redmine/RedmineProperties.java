package io.b2mash.b2b.timeledger.integration.redmine;

import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Connection and heuristics settings for the Redmine integration. The integration is disabled when
 * either {@code url} or {@code apiKey} is blank.
 *
 * @param contractField name of the issue custom field holding the internal contract id
 * @param importTimeout upper bound for fetching the time entries of one user
 * @param activeStatusIds issue statuses counted as actively worked on
 * @param freshness how recently an issue must have been updated to count as healthy
 * @param choiceCacheTtl lifetime of cached user and project choice lists
 */
@ConfigurationProperties(prefix = "timeledger.redmine")
public record RedmineProperties(
    String url,
    String apiKey,
    String contractField,
    Duration connectTimeout,
    Duration readTimeout,
    Duration importTimeout,
    List<Integer> activeStatusIds,
    Duration freshness,
    Duration choiceCacheTtl) {

  public RedmineProperties {
    if (contractField == null || contractField.isBlank()) {
      contractField = "timeledger_contract";
    }
    connectTimeout = connectTimeout != null ? connectTimeout : Duration.ofSeconds(5);
    readTimeout = readTimeout != null ? readTimeout : Duration.ofSeconds(30);
    importTimeout = importTimeout != null ? importTimeout : Duration.ofMinutes(2);
    activeStatusIds = activeStatusIds != null ? List.copyOf(activeStatusIds) : List.of(2, 9);
    freshness = freshness != null ? freshness : Duration.ofDays(1);
    choiceCacheTtl = choiceCacheTtl != null ? choiceCacheTtl : Duration.ofMinutes(10);
  }

  public boolean isConfigured() {
    return url != null && !url.isBlank() && apiKey != null && !apiKey.isBlank();
  }
}
