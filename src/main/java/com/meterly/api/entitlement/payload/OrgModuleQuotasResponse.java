package com.meterly.api.entitlement.payload;

import com.meterly.api.entitlement.ModuleQuota;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(name = "OrgModuleQuotas")
public class OrgModuleQuotasResponse {

    @Schema(required = true, description = "id of the organisation")
    @NonNull
    private String orgId;

    @Schema(required = true, description = "status of the organisation's subscription, 'none' if it never subscribed",
        allowableValues = {"none", "trialing", "active", "past_due", "canceled"})
    @NonNull
    private String subscriptionStatus;

    @Schema(description = "key of the subscribed plan")
    private String planKey;

    @Schema(required = true, description = "module quotas granted by the subscription")
    @NonNull
    private List<ModuleQuota> quotas;
}
