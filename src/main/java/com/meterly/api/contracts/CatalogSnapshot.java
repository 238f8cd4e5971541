package com.meterly.api.contracts;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * An immutable, point-in-time copy of the plan and module catalog. Lookups never touch the
 * database, so a snapshot can be shared freely between threads.
 */
@Value
public class CatalogSnapshot {

    @NonNull
    Map<String, Plan> plansByKey;

    @NonNull
    Map<String, Module> modulesByKey;

    @NonNull
    OffsetDateTime loadedAt;

    @NonNull
    public static CatalogSnapshot of(
        @NonNull Collection<Plan> plans,
        @NonNull Collection<Module> modules,
        @NonNull OffsetDateTime loadedAt
    ) {
        return new CatalogSnapshot(
            plans.stream().collect(Collectors.toUnmodifiableMap(Plan::getKey, Function.identity())),
            modules.stream().collect(Collectors.toUnmodifiableMap(Module::getKey, Function.identity())),
            loadedAt);
    }

    @NonNull
    public static CatalogSnapshot empty() {
        return new CatalogSnapshot(Map.of(), Map.of(), OffsetDateTime.now());
    }

    @NonNull
    public Optional<Plan> findPlan(String key) {
        return key == null ? Optional.empty() : Optional.ofNullable(plansByKey.get(key));
    }

    @NonNull
    public Optional<Module> findModule(String key) {
        return key == null ? Optional.empty() : Optional.ofNullable(modulesByKey.get(key));
    }

    @NonNull
    public Optional<Plan> findPlanByPriceId(String stripePriceId) {
        return plansByKey.values().stream()
            .filter(p -> stripePriceId != null && stripePriceId.equals(p.getStripePriceId()))
            .findFirst();
    }

    @NonNull
    public Optional<Module> findModuleByPriceId(String stripePriceId) {
        return modulesByKey.values().stream()
            .filter(m -> stripePriceId != null && stripePriceId.equals(m.getStripePriceId()))
            .findFirst();
    }

    public enum Status {
        ACTIVE,
        INACTIVE,
        DEPRECATED,
    }

    @Value
    @Builder
    public static class Plan {

        @NonNull
        String key;

        @NonNull
        String name;

        String stripePriceId;

        @NonNull
        Status status;

        int trialDurationDays;

        /**
         * Usage tier that caps metered service calls while a subscription to this plan is paid.
         */
        String usageTier;

        @NonNull
        @Builder.Default
        List<IncludedModule> includedModules = List.of();

        /**
         * @return whether a new checkout can be started for this plan.
         */
        public boolean isPurchasable() {
            return status == Status.ACTIVE && stripePriceId != null && !stripePriceId.isBlank();
        }
    }

    @Value
    @Builder
    public static class Module {

        @NonNull
        String key;

        @NonNull
        String name;

        String stripePriceId;

        @NonNull
        Status status;

        boolean allowMultiple;

        public boolean isPurchasable() {
            return status == Status.ACTIVE && stripePriceId != null && !stripePriceId.isBlank();
        }
    }

    @Value
    @Builder
    @Jacksonized
    public static class IncludedModule {

        @NonNull
        String moduleKey;

        int quantity;
    }
}
