package io.b2mash.tenantedge.health;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Worker pool for credential validations, bounded by {@code check-concurrency}. */
@Configuration
public class HealthCheckExecutorConfig {

  public static final String CREDENTIAL_CHECK_EXECUTOR = "credentialCheckExecutor";

  @Bean(name = CREDENTIAL_CHECK_EXECUTOR)
  ThreadPoolTaskExecutor credentialCheckExecutor(HealthProperties properties) {
    int threads = Math.max(1, properties.checkConcurrency());
    var executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setThreadNamePrefix("credential-check-");
    executor.setWaitForTasksToCompleteOnShutdown(false);
    return executor;
  }
}
