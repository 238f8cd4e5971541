package com.meterly.api.entitlement;

import com.meterly.api.contracts.CatalogServiceContract;
import com.meterly.api.contracts.CatalogSnapshot;
import com.meterly.api.contracts.EntitlementServiceContract;
import com.meterly.api.contracts.SubscriptionServiceContract;
import com.meterly.api.entitlement.payload.OrgModuleQuotasResponse;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * {@link EntitlementService} answers what an organisation may use, based on its current
 * subscription and the cached catalog.
 */
@Service
@Slf4j
class EntitlementService implements EntitlementServiceContract {

    static final String TRIAL_TIER = "trial";
    static final String FALLBACK_TIER = "basic";
    static final String NO_SUBSCRIPTION_STATUS = "none";

    private final SubscriptionServiceContract subscriptionServiceContract;
    private final CatalogServiceContract catalogServiceContract;

    @Autowired
    EntitlementService(
        @NonNull SubscriptionServiceContract subscriptionServiceContract,
        @NonNull CatalogServiceContract catalogServiceContract
    ) {
        this.subscriptionServiceContract = subscriptionServiceContract;
        this.catalogServiceContract = catalogServiceContract;
    }

    /**
     * Resolves the module quotas of an organisation. Organisations without a subscription receive
     * an empty quota list with {@code subscriptionStatus = none}.
     *
     * @param orgId id of the organisation.
     * @return a non-null {@link OrgModuleQuotasResponse}.
     */
    @NonNull
    OrgModuleQuotasResponse getOrgModuleQuotas(@NonNull String orgId) {
        val subscription = subscriptionServiceContract.findOrgSubscription(orgId).orElse(null);
        val entitlement = EntitlementResolver.resolve(subscription, catalogServiceContract.getSnapshot());
        log.debug("resolved {} module quotas for org {}", entitlement.getQuotas().size(), orgId);
        return OrgModuleQuotasResponse.builder()
            .orgId(orgId)
            .subscriptionStatus(subscription == null ? NO_SUBSCRIPTION_STATUS : subscription.getStatus())
            .planKey(entitlement.getPlanKey())
            .quotas(entitlement.getQuotas())
            .build();
    }

    /**
     * Trialing subscriptions use the {@code trial} tier. Active and past-due subscriptions use
     * the tier configured on their plan, or {@code basic} if the plan has none. Canceled
     * subscriptions are not entitled to any tier.
     */
    @NonNull
    @Override
    public Optional<String> findUsageTier(@NonNull String orgId) {
        val subscription = subscriptionServiceContract.findOrgSubscription(orgId).orElse(null);
        if (subscription == null) {
            return Optional.empty();
        }

        switch (subscription.getStatus()) {
            case "trialing":
                return Optional.of(TRIAL_TIER);
            case "active":
            case "past_due":
                val catalog = catalogServiceContract.getSnapshot();
                val tier = catalog.findPlan(EntitlementResolver.resolve(subscription, catalog).getPlanKey())
                    .map(CatalogSnapshot.Plan::getUsageTier)
                    .filter(t -> !t.isBlank())
                    .orElse(FALLBACK_TIER);

                return Optional.of(tier);
            default:
                return Optional.empty();
        }
    }
}
