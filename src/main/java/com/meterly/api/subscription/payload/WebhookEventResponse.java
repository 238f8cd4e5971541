package com.meterly.api.subscription.payload;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Data;
import lombok.NonNull;

import java.time.OffsetDateTime;

@Data
@Builder
@Schema(name = "WebhookEvent")
public class WebhookEventResponse {

    @Schema(requiredMode = Schema.RequiredMode.REQUIRED, description = "id assigned to the event by Stripe")
    @NonNull
    private String eventId;

    @Schema(requiredMode = Schema.RequiredMode.REQUIRED, description = "Stripe event type, e.g. 'invoice.payment_failed'")
    @NonNull
    private String eventType;

    @Schema(requiredMode = Schema.RequiredMode.REQUIRED, description = "whether a redelivery of the event is applied again")
    @NonNull
    private Boolean isRetryable;

    private String error;

    @NonNull
    private Integer attemptCount;

    @Schema(type = "integer", format = "int64")
    @NonNull
    private OffsetDateTime createdAt;

    @Schema(type = "integer", format = "int64")
    private OffsetDateTime processedAt;
}
