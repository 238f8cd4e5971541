package com.meterly.api.contracts;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Defines a service contract for subscription service to provide the subscription state of an
 * organisation to entitlement and usage services.
 */
public interface SubscriptionServiceContract {

    /**
     * @param orgId id of an organisation.
     * @return a non-null {@link Optional} with the organisation's subscription, if it ever had one.
     * Canceled subscriptions are returned as well.
     */
    @NonNull
    Optional<OrgSubscription> findOrgSubscription(@NonNull String orgId);

    /**
     * @param orgId id of an organisation.
     * @return {@code true} if the organisation's subscription is trialing, active or past due.
     */
    boolean isOrgSubscribed(@NonNull String orgId);

    @Value
    @Builder
    class OrgSubscription {

        @NonNull
        String orgId;

        /**
         * Lowercase subscription status, e.g. {@code trialing} or {@code past_due}.
         */
        @NonNull
        String status;

        @NonNull
        List<SubscriptionItem> items;
    }
}
