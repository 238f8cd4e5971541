package com.meterly.api.catalog;

import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties used by various components in the catalog package.
 */
@Validated
@ConfigurationProperties("app.catalog")
@Data
class CatalogConfiguration {

    /**
     * How long a loaded catalog snapshot is served before it is reloaded from the database.
     */
    @NotNull
    private final Duration cacheTtl;
}
