package com.meterly.api.usage;

import com.meterly.api.config.GlobalConfiguration;
import com.meterly.api.usage.entities.ConcurrentRequestLease;
import com.meterly.api.usage.entities.ConcurrentRequestLeaseRepository;
import com.meterly.api.usage.entities.UsageCounter;
import com.meterly.api.usage.entities.UsageCounterRepository;
import com.meterly.api.usage.entities.UsageWindow;
import com.meterly.api.usage.payload.UsageDecision;
import com.meterly.api.usage.payload.UsageReportResponse;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * <p>
 * {@link UsageGuard} meters requests to internal services and admits them against the hourly,
 * daily, monthly and concurrency limits of a usage tier.</p>
 *
 * <p>
 * Window counters are incremented with a single atomic upsert on every admission attempt, and the
 * increment is kept even if the request is rejected. Concurrency is enforced by inserting a lease
 * first and counting the unexpired leases afterwards. Concurrent callers can therefore only
 * under-admit, never over-admit.</p>
 *
 * <p>
 * It isn't transactional. Each lease insert and counter upsert commits on its own, so that
 * concurrent callers observe it immediately.</p>
 */
@Service
@Slf4j
class UsageGuard {

    private final UsageConfiguration usageConfig;
    private final GlobalConfiguration globalConfig;
    private final UsageCounterRepository counterRepository;
    private final ConcurrentRequestLeaseRepository leaseRepository;
    private final Clock clock;

    @Autowired
    UsageGuard(
        @NonNull UsageConfiguration usageConfig,
        @NonNull GlobalConfiguration globalConfig,
        @NonNull UsageCounterRepository counterRepository,
        @NonNull ConcurrentRequestLeaseRepository leaseRepository,
        @NonNull Clock clock
    ) {
        this.usageConfig = usageConfig;
        this.globalConfig = globalConfig;
        this.counterRepository = counterRepository;
        this.leaseRepository = leaseRepository;
        this.clock = clock;
    }

    /**
     * <p>
     * Decides whether a request of an organisation to a service may proceed, and reserves its
     * share of the limits.</p>
     *
     * <p>
     * If the service is unknown or disabled in the tier, the request is rejected with {@link
     * UsageDecision.Reason#NOT_ENTITLED} and nothing is counted. Otherwise, both the concurrency
     * and the window limits must pass. A concurrency rejection is reported first, then the first
     * exceeded window in hourly, daily, monthly order.</p>
     *
     * @param orgId      id of the organisation.
     * @param serviceKey key of the metered service.
     * @param tier       usage tier of the organisation.
     * @return the decision. If it allows the request and the service has a concurrency limit, it
     * carries the lease that the caller must {@link #release(String, String, UUID) release}.
     */
    @NonNull
    UsageDecision checkAndReserve(@NonNull String orgId, @NonNull String serviceKey, @NonNull String tier) {
        val limit = usageConfig.findLimit(serviceKey, tier).orElse(null);
        if (limit == null || !limit.isEnabled()) {
            log.trace("org {} with tier {} is not entitled to service {}", orgId, tier, serviceKey);
            return UsageDecision.rejected(UsageDecision.Reason.NOT_ENTITLED, 0, 0, null);
        }

        val now = ZonedDateTime.now(clock).withZoneSameInstant(globalConfig.getZone());
        val nowOffset = now.toOffsetDateTime();

        UUID leaseId = null;
        UsageDecision rejection = null;
        if (limit.getConcurrentRequests() > 0) {
            leaseId = UUID.randomUUID();
            leaseRepository.save(ConcurrentRequestLease.builder()
                .id(leaseId)
                .orgId(orgId)
                .serviceKey(serviceKey)
                .startedAt(nowOffset)
                .expiresAt(nowOffset.plus(usageConfig.getLeaseTtl()))
                .build());

            val activeLeases = leaseRepository.countActive(orgId, serviceKey, nowOffset);
            if (activeLeases > limit.getConcurrentRequests()) {
                leaseRepository.deleteOwned(leaseId, orgId, serviceKey);
                leaseId = null;
                val resetTime = leaseRepository.findEarliestExpiry(orgId, serviceKey, nowOffset)
                    .orElse(nowOffset.plus(usageConfig.getLeaseTtl()));

                rejection = UsageDecision.rejected(
                    UsageDecision.Reason.CONCURRENCY_LIMIT, activeLeases, limit.getConcurrentRequests(), resetTime);
            }
        }

        final Map<UsageWindow, Long> usage = new EnumMap<>(UsageWindow.class);
        for (val window : UsageWindow.values()) {
            usage.put(window, counterRepository.increment(orgId, serviceKey, window.name(), window.windowStart(now), nowOffset));
        }

        UsageWindow reportedWindow = null;
        for (val window : UsageWindow.values()) {
            val cap = capOf(limit, window);
            if (cap > 0 && usage.get(window) > cap) {
                if (rejection == null) {
                    rejection = UsageDecision.rejected(reasonOf(window), usage.get(window), cap, window.nextReset(now));
                }

                break;
            }

            if (cap > 0 && reportedWindow == null) {
                reportedWindow = window;
            }
        }

        if (rejection != null) {
            if (leaseId != null) {
                leaseRepository.deleteOwned(leaseId, orgId, serviceKey);
            }

            log.trace("rejected request of org {} to service {}: {}", orgId, serviceKey, rejection.getReason());
            return rejection;
        }

        return UsageDecision.builder()
            .allowed(true)
            .currentUsage(usage.get(reportedWindow == null ? UsageWindow.HOURLY : reportedWindow))
            .limit(reportedWindow == null ? 0 : capOf(limit, reportedWindow))
            .resetTime(reportedWindow == null ? null : reportedWindow.nextReset(now))
            .leaseId(leaseId)
            .build();
    }

    /**
     * Releases a concurrent request lease. Releasing a lease that was already released, or that
     * expired and was cleaned up, is a no-op.
     */
    void release(@NonNull String orgId, @NonNull String serviceKey, @NonNull UUID leaseId) {
        if (leaseRepository.deleteOwned(leaseId, orgId, serviceKey) == 0) {
            log.debug("lease {} of org {} was already released", leaseId, orgId);
        }
    }

    /**
     * Removes leases that expired before now. It is safe to run while requests are admitted.
     *
     * @return the number of removed leases.
     */
    int cleanupExpired() {
        return leaseRepository.deleteAllExpiredBefore(OffsetDateTime.now(clock));
    }

    /**
     * Deletes hourly counters of windows older than the configured retention. Daily and monthly
     * counters are kept for reporting.
     *
     * @return the number of deleted counters.
     */
    int purgeExpiredCounters() {
        val startedBefore = OffsetDateTime.now(clock).minus(usageConfig.getRetainHourlyCountersFor());
        return counterRepository.deleteAllByWindowKindStartedBefore(UsageWindow.HOURLY, startedBefore);
    }

    /**
     * Reports the usage of an organisation in the current windows, together with the limits of
     * its tier. Services appear if they are configured for the tier, or if they were used in the
     * current month.
     *
     * @param tier usage tier of the organisation, or {@literal null} if it has none.
     */
    @NonNull
    UsageReportResponse getUsageReport(@NonNull String orgId, String tier) {
        val now = ZonedDateTime.now(clock).withZoneSameInstant(globalConfig.getZone());
        final Map<String, UsageReportResponse.ServiceUsage> services = new TreeMap<>();
        if (tier != null) {
            usageConfig.getServices().forEach((serviceKey, tiers) -> {
                final UsageConfiguration.ServiceLimit limit = tiers.get(tier);
                if (limit != null && limit.isEnabled()) {
                    final UsageReportResponse.ServiceUsage usage = services.computeIfAbsent(serviceKey, UsageGuard::emptyServiceUsage);
                    usage.setHourlyLimit(limit.getHourlyRequests());
                    usage.setDailyLimit(limit.getDailyRequests());
                    usage.setMonthlyLimit(limit.getMonthlyRequests());
                    usage.setConcurrentLimit(limit.getConcurrentRequests());
                }
            });
        }

        for (val window : UsageWindow.values()) {
            for (final UsageCounter counter : counterRepository.findAllByWindow(orgId, window, window.windowStart(now))) {
                val usage = services.computeIfAbsent(counter.getServiceKey(), UsageGuard::emptyServiceUsage);
                switch (window) {
                    case HOURLY:
                        usage.setHourlyRequests(counter.getCount());
                        break;
                    case DAILY:
                        usage.setDailyRequests(counter.getCount());
                        break;
                    case MONTHLY:
                        usage.setMonthlyRequests(counter.getCount());
                        break;
                }
            }
        }

        final Map<String, Long> activeLeases = leaseRepository.findAllActiveByOrgId(orgId, now.toOffsetDateTime())
            .stream()
            .collect(Collectors.groupingBy(ConcurrentRequestLease::getServiceKey, Collectors.counting()));

        activeLeases.forEach((serviceKey, count) ->
            services.computeIfAbsent(serviceKey, UsageGuard::emptyServiceUsage).setConcurrentRequests(count));

        return UsageReportResponse.builder()
            .orgId(orgId)
            .tier(tier)
            .services(new ArrayList<>(services.values()))
            .build();
    }

    private static long capOf(@NonNull UsageConfiguration.ServiceLimit limit, @NonNull UsageWindow window) {
        switch (window) {
            case HOURLY:
                return limit.getHourlyRequests();
            case DAILY:
                return limit.getDailyRequests();
            default:
                return limit.getMonthlyRequests();
        }
    }

    @NonNull
    private static UsageDecision.Reason reasonOf(@NonNull UsageWindow window) {
        switch (window) {
            case HOURLY:
                return UsageDecision.Reason.HOURLY_LIMIT;
            case DAILY:
                return UsageDecision.Reason.DAILY_LIMIT;
            default:
                return UsageDecision.Reason.MONTHLY_LIMIT;
        }
    }

    @NonNull
    private static UsageReportResponse.ServiceUsage emptyServiceUsage(@NonNull String serviceKey) {
        return UsageReportResponse.ServiceUsage.builder()
            .serviceKey(serviceKey)
            .build();
    }
}
