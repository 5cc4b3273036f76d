package com.scholary.avatar.config;

import com.scholary.avatar.job.PollingPolicy;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for avatar generation.
 *
 * <p>Controls the polling budget and cadence, where downloaded videos are staged before upload,
 * and how long one video download may take.
 */
@ConfigurationProperties(prefix = "generation")
@Validated
public record GenerationProperties(
    @NotNull Duration timeout,
    @NotNull Duration pollInterval,
    @NotBlank String tempDir,
    @NotNull Duration downloadTimeout) {

  public PollingPolicy pollingPolicy() {
    return new PollingPolicy(timeout, pollInterval);
  }
}
