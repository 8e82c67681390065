package io.b2mash.content.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
@EnableConfigurationProperties(NotificationConfig.NotificationProperties.class)
public class NotificationConfig {

  @ConfigurationProperties("content.notification")
  public record NotificationProperties(
      @DefaultValue("http://localhost:3003") String baseUrl,
      @DefaultValue("") String serviceToken,
      @DefaultValue("true") boolean enabled,
      @DefaultValue Executor executor) {

    public record Executor(
        @DefaultValue("2") int coreSize,
        @DefaultValue("4") int maxSize,
        @DefaultValue("500") int queueCapacity) {}
  }

  /** Bounded pool for outbound notification sends. Queued sends are drained on shutdown. */
  @Bean(name = "notificationExecutor")
  ThreadPoolTaskExecutor notificationExecutor(NotificationProperties properties) {
    var executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.executor().coreSize());
    executor.setMaxPoolSize(properties.executor().maxSize());
    executor.setQueueCapacity(properties.executor().queueCapacity());
    executor.setThreadNamePrefix("notify-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(10);
    return executor;
  }
}
