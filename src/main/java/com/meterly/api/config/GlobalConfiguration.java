package com.meterly.api.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.ZoneId;

/**
 * Global application configuration properties.
 */
@Validated
@ConfigurationProperties("app")
@Data
public class GlobalConfiguration {

    /**
     * Shared secret that internal services present in the {@code X-Service-API-Key} header.
     */
    @NotBlank
    private final String internalServiceApiKey;

    /**
     * Time zone used to align usage windows and to render timestamps.
     */
    @NotNull
    private final ZoneId zone;
}
