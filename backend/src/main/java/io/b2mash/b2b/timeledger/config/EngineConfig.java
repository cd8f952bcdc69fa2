package io.b2mash.b2b.timeledger.config;

import io.b2mash.b2b.timeledger.integration.redmine.RedmineProperties;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({EngineProperties.class, RedmineProperties.class})
public class EngineConfig {

  @Bean
  Clock clock() {
    return Clock.systemDefaultZone();
  }

  @Bean(destroyMethod = "shutdown")
  ExecutorService engineExecutor(EngineProperties properties) {
    var counter = new AtomicInteger();
    return Executors.newFixedThreadPool(
        properties.userParallelism(),
        runnable -> {
          var thread = new Thread(runnable, "timeledger-engine-" + counter.incrementAndGet());
          thread.setDaemon(true);
          return thread;
        });
  }
}
