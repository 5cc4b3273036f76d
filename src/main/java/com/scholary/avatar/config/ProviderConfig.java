package com.scholary.avatar.config;

import com.scholary.avatar.provider.ProviderProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the synthesis provider client.
 *
 * <p>Enables the ProviderProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(ProviderProperties.class)
public class ProviderConfig {}
