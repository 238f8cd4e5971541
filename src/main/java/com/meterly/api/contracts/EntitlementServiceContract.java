package com.meterly.api.contracts;

import lombok.NonNull;

import java.util.Optional;

/**
 * Defines a service contract for entitlement service to provide the usage tier of an organisation
 * to usage service.
 */
public interface EntitlementServiceContract {

    /**
     * @param orgId id of an organisation.
     * @return a non-null {@link Optional} with the usage tier (e.g. {@code trial}, {@code basic})
     * that applies to the organisation, or empty if it has no entitling subscription.
     */
    @NonNull
    Optional<String> findUsageTier(@NonNull String orgId);
}
