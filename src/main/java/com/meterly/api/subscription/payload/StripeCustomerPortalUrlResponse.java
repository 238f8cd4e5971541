package com.meterly.api.subscription.payload;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Data;
import lombok.NonNull;

@Data
@Builder
public class StripeCustomerPortalUrlResponse {

    @Schema(requiredMode = Schema.RequiredMode.REQUIRED, description = "short-lived URL of the session that provides access to the billing portal.")
    @NonNull
    private String url;
}
