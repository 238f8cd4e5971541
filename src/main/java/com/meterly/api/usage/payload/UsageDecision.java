package com.meterly.api.usage.payload;

import com.fasterxml.jackson.annotation.JsonValue;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Admission decision for a single metered request.
 */
@Value
@Builder
@Schema(name = "UsageDecision")
public class UsageDecision {

    @Schema(requiredMode = Schema.RequiredMode.REQUIRED, description = "whether the request may proceed")
    boolean allowed;

    @Schema(description = "why the request was rejected. absent if it was allowed.")
    Reason reason;

    @Schema(description = "usage of the reported limit, including this request")
    long currentUsage;

    @Schema(description = "the reported limit. 0 if the request isn't limited.")
    long limit;

    @Schema(type = "integer", format = "int64", description = "when the reported limit frees up again")
    OffsetDateTime resetTime;

    @Schema(description = "id of the concurrent request lease. the caller must release it when the request " +
        "completes. absent if the service has no concurrency limit.")
    UUID leaseId;

    @NonNull
    public static UsageDecision rejected(@NonNull Reason reason, long currentUsage, long limit, OffsetDateTime resetTime) {
        return UsageDecision.builder()
            .allowed(false)
            .reason(reason)
            .currentUsage(currentUsage)
            .limit(limit)
            .resetTime(resetTime)
            .build();
    }

    public enum Reason {
        NO_ACTIVE_SUBSCRIPTION,
        NOT_ENTITLED,
        CONCURRENCY_LIMIT,
        HOURLY_LIMIT,
        DAILY_LIMIT,
        MONTHLY_LIMIT;

        @JsonValue
        public String getValue() {
            return name().toLowerCase();
        }

        /**
         * @return whether the request was rejected for exceeding a limit, rather than for lacking
         * access to the service.
         */
        public boolean isLimitExceeded() {
            return this != NO_ACTIVE_SUBSCRIPTION && this != NOT_ENTITLED;
        }
    }
}
