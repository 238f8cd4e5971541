package com.meterly.api.usage.payload;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Data;
import lombok.NonNull;

import java.util.List;

@Data
@Builder
@Schema(name = "UsageReport")
public class UsageReportResponse {

    @Schema(requiredMode = Schema.RequiredMode.REQUIRED)
    @NonNull
    private String orgId;

    @Schema(description = "usage tier of the organisation. absent if it has no entitling subscription.")
    private String tier;

    @Schema(requiredMode = Schema.RequiredMode.REQUIRED, description = "usage of each service in the current windows")
    @NonNull
    private List<ServiceUsage> services;

    @Data
    @Builder
    @Schema(name = "ServiceUsage")
    public static class ServiceUsage {

        @Schema(requiredMode = Schema.RequiredMode.REQUIRED)
        @NonNull
        private String serviceKey;

        private long hourlyRequests;

        @Schema(description = "0 if unlimited or if the service isn't available in the tier")
        private long hourlyLimit;

        private long dailyRequests;

        private long dailyLimit;

        private long monthlyRequests;

        private long monthlyLimit;

        @Schema(description = "number of requests currently holding a lease")
        private long concurrentRequests;

        private long concurrentLimit;
    }
}
