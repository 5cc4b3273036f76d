package com.scholary.avatar.api;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** The shared secret clients must send with every generation request. */
@ConfigurationProperties(prefix = "api")
@Validated
public record ApiProperties(@NotBlank String key) {}
