package io.b2mash.b2b.timeledger.integration.redmine;

import io.b2mash.b2b.timeledger.config.EngineProperties;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class RedmineConfig {

  private static final Logger log = LoggerFactory.getLogger(RedmineConfig.class);

  static final String API_KEY_HEADER = "X-Redmine-API-Key";

  @Bean
  RedmineConnector redmineConnector(RedmineProperties properties, RestClient.Builder builder) {
    if (!properties.isConfigured()) {
      log.info("Redmine url or api key not set, Redmine integration disabled");
      return new NoOpRedmineConnector();
    }
    var requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.connectTimeout());
    requestFactory.setReadTimeout(properties.readTimeout());
    var restClient =
        builder
            .baseUrl(properties.url())
            .defaultHeader(API_KEY_HEADER, properties.apiKey())
            .requestFactory(requestFactory)
            .build();
    log.info("Redmine integration enabled for {}", properties.url());
    return new RedmineRestConnector(restClient);
  }

  /** Kept apart from the engine pool so slow imports never hold up range calculations. */
  @Bean(destroyMethod = "shutdownNow")
  ExecutorService redmineImportExecutor(EngineProperties engineProperties) {
    var counter = new AtomicInteger();
    return Executors.newFixedThreadPool(
        engineProperties.userParallelism(),
        runnable -> {
          var thread = new Thread(runnable, "redmine-import-" + counter.incrementAndGet());
          thread.setDaemon(true);
          return thread;
        });
  }
}
