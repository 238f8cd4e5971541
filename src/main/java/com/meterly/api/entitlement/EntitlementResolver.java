package com.meterly.api.entitlement;

import com.meterly.api.contracts.CatalogSnapshot;
import com.meterly.api.contracts.SubscriptionItem;
import com.meterly.api.contracts.SubscriptionServiceContract.OrgSubscription;
import lombok.NonNull;
import lombok.val;

import java.util.LinkedHashMap;
import java.util.List;

/**
 * <p>
 * Derives module quotas from a subscription and a catalog snapshot. It performs no I/O, so the
 * same inputs always produce the same {@link Entitlement}.</p>
 *
 * <p>
 * Modules bundled with the plan yield {@link ModuleQuota.Source#PLAN_INCLUDED plan_included}
 * quotas. Add-on modules yield {@link ModuleQuota.Source#ADDON addon} quotas. When an add-on is
 * also bundled with the plan, the add-on quantity is added on top of the bundled one and the
 * quota is reported as an add-on. Quantities of repeated add-on items are summed.</p>
 *
 * <p>
 * Plans or modules missing from the snapshot degrade gracefully: an unknown plan contributes no
 * bundled modules and an unknown module is reported with {@code allowMultiple = false}.</p>
 */
public final class EntitlementResolver {

    private EntitlementResolver() {
    }

    @NonNull
    public static Entitlement resolve(OrgSubscription subscription, @NonNull CatalogSnapshot catalog) {
        if (subscription == null) {
            return Entitlement.empty();
        }

        String planKey = null;
        val addonQuantities = new LinkedHashMap<String, Integer>();
        for (val item : subscription.getItems()) {
            if (item.getType() == SubscriptionItem.Type.PLAN) {
                if (planKey == null) {
                    planKey = item.getKey();
                }
            } else {
                addonQuantities.merge(item.getKey(), item.getQuantity(), Integer::sum);
            }
        }

        val quotas = new LinkedHashMap<String, ModuleQuota>();
        val included = catalog.findPlan(planKey)
            .map(CatalogSnapshot.Plan::getIncludedModules)
            .orElse(List.of());

        for (val module : included) {
            val existing = quotas.get(module.getModuleKey());
            quotas.put(module.getModuleKey(), ModuleQuota.builder()
                .moduleKey(module.getModuleKey())
                .purchasedCount(module.getQuantity() + (existing == null ? 0 : existing.getPurchasedCount()))
                .allowMultiple(isMultipleAllowed(catalog, module.getModuleKey()))
                .source(ModuleQuota.Source.PLAN_INCLUDED)
                .build());
        }

        for (val addon : addonQuantities.entrySet()) {
            val existing = quotas.get(addon.getKey());
            if (existing != null) {
                // product policy: add-on units stack on top of the units bundled with the plan.
                quotas.put(addon.getKey(), existing.toBuilder()
                    .purchasedCount(existing.getPurchasedCount() + addon.getValue())
                    .source(ModuleQuota.Source.ADDON)
                    .build());
            } else {
                quotas.put(addon.getKey(), ModuleQuota.builder()
                    .moduleKey(addon.getKey())
                    .purchasedCount(addon.getValue())
                    .allowMultiple(isMultipleAllowed(catalog, addon.getKey()))
                    .source(ModuleQuota.Source.ADDON)
                    .build());
            }
        }

        return new Entitlement(planKey, List.copyOf(quotas.values()));
    }

    private static boolean isMultipleAllowed(@NonNull CatalogSnapshot catalog, @NonNull String moduleKey) {
        return catalog.findModule(moduleKey)
            .map(CatalogSnapshot.Module::isAllowMultiple)
            .orElse(false);
    }
}
