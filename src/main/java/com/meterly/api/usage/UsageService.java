package com.meterly.api.usage;

import com.meterly.api.contracts.EntitlementServiceContract;
import com.meterly.api.usage.payload.UsageDecision;
import com.meterly.api.usage.payload.UsageReportResponse;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * {@link UsageService} admits metered requests of internal services on behalf of organisations,
 * using the usage tier that their subscription entitles them to.
 */
@Service
@Slf4j
class UsageService {

    private final EntitlementServiceContract entitlementServiceContract;
    private final UsageGuard usageGuard;

    @Autowired
    UsageService(@NonNull EntitlementServiceContract entitlementServiceContract, @NonNull UsageGuard usageGuard) {
        this.entitlementServiceContract = entitlementServiceContract;
        this.usageGuard = usageGuard;
    }

    /**
     * Decides whether a request of an organisation to a service may proceed.
     *
     * @return a rejection with {@link UsageDecision.Reason#NO_ACTIVE_SUBSCRIPTION} if the
     * organisation has no trialing, active or past due subscription. Otherwise, the decision of
     * {@link UsageGuard#checkAndReserve(String, String, String)}.
     */
    @NonNull
    UsageDecision admit(@NonNull String orgId, @NonNull String serviceKey) {
        val tier = entitlementServiceContract.findUsageTier(orgId).orElse(null);
        if (tier == null) {
            log.trace("org {} has no active subscription", orgId);
            return UsageDecision.rejected(UsageDecision.Reason.NO_ACTIVE_SUBSCRIPTION, 0, 0, null);
        }

        return usageGuard.checkAndReserve(orgId, serviceKey, tier);
    }

    /**
     * @see UsageGuard#release(String, String, UUID)
     */
    void release(@NonNull String orgId, @NonNull String serviceKey, @NonNull UUID leaseId) {
        usageGuard.release(orgId, serviceKey, leaseId);
    }

    @NonNull
    UsageReportResponse getUsageReport(@NonNull String orgId) {
        return usageGuard.getUsageReport(orgId, entitlementServiceContract.findUsageTier(orgId).orElse(null));
    }

    void performGarbageCollection() {
        val leases = usageGuard.cleanupExpired();
        val counters = usageGuard.purgeExpiredCounters();
        log.info("removed {} expired leases and {} old hourly counters", leases, counters);
    }
}
