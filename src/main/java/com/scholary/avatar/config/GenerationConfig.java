package com.scholary.avatar.config;

import com.scholary.avatar.job.JobPoller;
import com.scholary.avatar.job.Sleeper;
import com.scholary.avatar.provider.ProviderClient;
import com.scholary.avatar.service.AvatarGenerationService;
import com.scholary.avatar.storage.StorageRelay;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the generation pipeline.
 *
 * <p>Wires the poller with the real clock and {@link Thread#sleep}, and hands it to the service.
 */
@Configuration
@EnableConfigurationProperties(GenerationProperties.class)
public class GenerationConfig {

  private static final Logger LOGGER = LoggerFactory.getLogger(GenerationConfig.class);

  @Bean
  public JobPoller jobPoller(ProviderClient providerClient, GenerationProperties properties) {
    LOGGER.info(
        "Job polling: timeout={}, interval={}",
        properties.timeout(),
        properties.pollInterval());
    return new JobPoller(
        providerClient, properties.pollingPolicy(), Clock.systemUTC(), Sleeper.threadSleep());
  }

  @Bean
  public AvatarGenerationService avatarGenerationService(
      JobPoller jobPoller, StorageRelay storageRelay) {
    return new AvatarGenerationService(jobPoller, storageRelay);
  }
}
