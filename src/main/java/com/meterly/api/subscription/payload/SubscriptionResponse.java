package com.meterly.api.subscription.payload;

import com.meterly.api.contracts.SubscriptionItem;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;

import java.time.OffsetDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(name = "Subscription")
public class SubscriptionResponse {

    @Schema(requiredMode = Schema.RequiredMode.REQUIRED, description = "id of the organisation that owns the subscription")
    @NonNull
    private String orgId;

    @Schema(requiredMode = Schema.RequiredMode.REQUIRED, allowableValues = {"trialing", "active", "past_due", "canceled"})
    @NonNull
    private String status;

    @Schema(description = "key of the subscribed plan")
    private String planKey;

    @Schema(requiredMode = Schema.RequiredMode.REQUIRED, description = "the plan and add-on modules of the subscription")
    @NonNull
    private List<SubscriptionItem> items;

    @Schema(requiredMode = Schema.RequiredMode.REQUIRED, description = "whether the subscription ends at the end of " +
        "the current billing cycle")
    @NonNull
    private Boolean cancelAtPeriodEnd;

    @Schema(type = "integer", format = "int64", description = "epoch millis of the billing cycle anchor")
    private OffsetDateTime billingCycleAnchor;

    @Schema(type = "integer", format = "int64", description = "epoch millis when the current billing cycle ends")
    private OffsetDateTime currentPeriodEnd;

    @Schema(type = "integer", format = "int64", description = "epoch millis when the subscription was canceled")
    private OffsetDateTime canceledAt;

    @Schema(type = "integer", format = "int64", requiredMode = Schema.RequiredMode.REQUIRED)
    @NonNull
    private OffsetDateTime createdAt;
}
