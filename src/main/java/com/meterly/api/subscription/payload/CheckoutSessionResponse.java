package com.meterly.api.subscription.payload;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Data;
import lombok.NonNull;

@Data
@Builder
public class CheckoutSessionResponse {

    @Schema(requiredMode = Schema.RequiredMode.REQUIRED, description = "id of the Stripe checkout session")
    @NonNull
    private String sessionId;

    @Schema(requiredMode = Schema.RequiredMode.REQUIRED, description = "url where the user completes the payment")
    @NonNull
    private String url;

    @Schema(requiredMode = Schema.RequiredMode.REQUIRED, description = "whether the subscription starts with a trial period")
    @NonNull
    private Boolean isTrialOffered;
}
