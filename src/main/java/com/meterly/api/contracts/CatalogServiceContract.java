package com.meterly.api.contracts;

import lombok.NonNull;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Defines a service contract for catalog service to provide read-only plan and module lookups to
 * subscription and entitlement services.
 */
public interface CatalogServiceContract {

    /**
     * @return the latest cached {@link CatalogSnapshot}. It may lag behind catalog changes by at
     * most the configured cache ttl.
     */
    @NonNull
    CatalogSnapshot getSnapshot();

    /**
     * @param planKey key of a plan.
     * @return a non-null {@link Optional} with the plan if it exists in the catalog.
     */
    @NonNull
    Optional<CatalogSnapshot.Plan> getPlanByKey(@NonNull String planKey);

    /**
     * @param moduleKeys keys of the requested modules.
     * @return modules that exist in the catalog. Unknown keys are silently skipped.
     */
    @NonNull
    List<CatalogSnapshot.Module> getModulesByKeys(@NonNull Collection<String> moduleKeys);

    /**
     * Discards the cached snapshot so that the next read reloads the catalog.
     */
    void refreshSnapshot();
}
