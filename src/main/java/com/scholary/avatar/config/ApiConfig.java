package com.scholary.avatar.config;

import com.scholary.avatar.api.ApiProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the HTTP API.
 *
 * <p>Enables the ApiProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(ApiProperties.class)
public class ApiConfig {}
