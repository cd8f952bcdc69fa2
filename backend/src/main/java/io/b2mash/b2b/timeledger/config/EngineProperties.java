package io.b2mash.b2b.timeledger.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration for the range aggregation engine.
 *
 * @param userParallelism size of the bounded pool used to resolve users concurrently
 */
@ConfigurationProperties(prefix = "timeledger.engine")
public record EngineProperties(int userParallelism) {

  public EngineProperties {
    if (userParallelism < 1) {
      userParallelism = 4;
    }
  }
}
