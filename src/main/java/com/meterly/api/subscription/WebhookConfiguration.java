package com.meterly.api.subscription;

import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties of the Stripe webhook event processor.
 */
@Validated
@ConfigurationProperties("app.webhooks")
@Data
class WebhookConfiguration {

    /**
     * A delivery that holds an event in processing state for longer than this is assumed to have
     * crashed, and its event may be claimed by a redelivery.
     */
    @NotNull
    private final Duration processingTimeout;

    @NotNull
    private final Duration retainProcessedEventsFor;
}
