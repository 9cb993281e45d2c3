package dev.ecodata.config;

import dev.ecodata.extraction.ExtractionProperties;
import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Provides the clock and the two executors used by job processing.
 *
 * <p>{@code rowExecutor} is sized by {@code ecodata.extraction.concurrency} and shared by all
 * jobs, so it caps concurrent model calls. {@code jobExecutor} runs one coordinator per job that
 * only waits on its rows.
 */
@Configuration
public class ExecutionConfig {

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public ThreadPoolTaskExecutor rowExecutor(ExtractionProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.getConcurrency());
    executor.setMaxPoolSize(properties.getConcurrency());
    executor.setThreadNamePrefix("extract-row-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    return executor;
  }

  @Bean
  public ThreadPoolTaskExecutor jobExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setMaxPoolSize(8);
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("extract-job-");
    return executor;
  }
}
