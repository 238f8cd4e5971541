package com.meterly.api.catalog;

import com.meterly.api.catalog.entities.CatalogModule;
import com.meterly.api.catalog.entities.CatalogModuleRepository;
import com.meterly.api.catalog.entities.Plan;
import com.meterly.api.catalog.entities.PlanRepository;
import com.meterly.api.contracts.CatalogServiceContract;
import com.meterly.api.contracts.CatalogSnapshot;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.cache.Cache;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * {@link CatalogService} serves immutable catalog snapshots from a short-lived cache.
 */
@Service
@Slf4j
class CatalogService implements CatalogServiceContract {

    static final String SNAPSHOT_CACHE_KEY = "snapshot";

    private final PlanRepository planRepository;
    private final CatalogModuleRepository moduleRepository;
    private final Cache cache;

    @Autowired
    CatalogService(
        @NonNull PlanRepository planRepository,
        @NonNull CatalogModuleRepository moduleRepository,
        @NonNull @Qualifier(CatalogBeans.CACHE_NAME) Cache cache
    ) {
        this.planRepository = planRepository;
        this.moduleRepository = moduleRepository;
        this.cache = cache;
    }

    @NonNull
    @Override
    public CatalogSnapshot getSnapshot() {
        final CatalogSnapshot snapshot = cache.get(SNAPSHOT_CACHE_KEY, this::loadSnapshot);
        if (snapshot == null) {
            throw new IllegalStateException("catalog snapshot loader returned null");
        }

        return snapshot;
    }

    @NonNull
    @Override
    public Optional<CatalogSnapshot.Plan> getPlanByKey(@NonNull String planKey) {
        return getSnapshot().findPlan(planKey);
    }

    @NonNull
    @Override
    public List<CatalogSnapshot.Module> getModulesByKeys(@NonNull Collection<String> moduleKeys) {
        val snapshot = getSnapshot();
        return new LinkedHashSet<>(moduleKeys).stream()
            .map(snapshot::findModule)
            .flatMap(Optional::stream)
            .collect(Collectors.toUnmodifiableList());
    }

    @Override
    public void refreshSnapshot() {
        cache.evict(SNAPSHOT_CACHE_KEY);
    }

    @NonNull
    private CatalogSnapshot loadSnapshot() {
        val plans = planRepository.findAllOrdered().stream().map(Plan::toSnapshot).collect(Collectors.toList());
        val modules = moduleRepository.findAllOrdered().stream().map(CatalogModule::toSnapshot).collect(Collectors.toList());
        log.debug("loaded catalog snapshot with {} plans and {} modules", plans.size(), modules.size());
        return CatalogSnapshot.of(plans, modules, OffsetDateTime.now());
    }
}
