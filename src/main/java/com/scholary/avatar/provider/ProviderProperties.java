package com.scholary.avatar.provider;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the avatar synthesis provider.
 *
 * <p>Timeouts are in seconds and apply to a single HTTP exchange, not to the whole job.
 */
@ConfigurationProperties(prefix = "provider")
@Validated
public record ProviderProperties(
    @NotBlank String endpoint,
    @NotBlank String subscriptionKey,
    @NotBlank String apiVersion,
    @Positive int connectTimeout,
    @Positive int readTimeout) {}
