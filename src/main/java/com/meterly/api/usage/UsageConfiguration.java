package com.meterly.api.usage;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.NonNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Configuration properties used by various components in the usage package.
 */
@Validated
@ConfigurationProperties("app.usage")
@Data
class UsageConfiguration {

    /**
     * How long a concurrent request lease is held if its caller never releases it.
     */
    @NotNull
    private final Duration leaseTtl;

    @NotNull
    private final Duration retainHourlyCountersFor;

    /**
     * Request limits, keyed by service key and then by usage tier.
     */
    @NotNull
    private final Map<String, Map<String, @Valid ServiceLimit>> services;

    /**
     * @return the limits of a service in a usage tier, if they are configured.
     */
    @NonNull
    Optional<ServiceLimit> findLimit(@NonNull String serviceKey, @NonNull String tier) {
        return Optional.ofNullable(services.get(serviceKey))
            .map(tiers -> tiers.get(tier));
    }

    /**
     * Request limits of a service in a usage tier. A limit of {@literal 0} means unlimited.
     */
    @Data
    static class ServiceLimit {

        private final boolean enabled;

        @Min(0)
        private final long hourlyRequests;

        @Min(0)
        private final long dailyRequests;

        @Min(0)
        private final long monthlyRequests;

        @Min(0)
        private final long concurrentRequests;
    }
}
