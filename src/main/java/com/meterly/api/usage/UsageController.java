package com.meterly.api.usage;

import com.meterly.api.usage.payload.UsageDecision;
import com.meterly.api.usage.payload.UsageReportResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.NonNull;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * REST controller for usage metering '{@code /v1/internal/usage}' routes, called by internal
 * services before and after serving a metered request.
 */
@Validated
@RestController
@RequestMapping("/v1/internal/usage")
@Tag(name = "usage")
class UsageController {

    private final UsageService usageService;

    @Autowired
    UsageController(@NonNull UsageService usageService) {
        this.usageService = usageService;
    }

    /**
     * Admits a request of an organisation to a service. If the response carries a {@code
     * leaseId}, the caller must release it once the request completes. Unreleased leases expire
     * on their own.
     */
    @Operation(summary = "Admit a metered request")
    @ApiResponses({
        @ApiResponse(responseCode = "201", description = "request admitted"),
        @ApiResponse(responseCode = "401", description = "service api key is invalid", content = @Content),
        @ApiResponse(responseCode = "403", description = "organisation isn't entitled to the service"),
        @ApiResponse(responseCode = "429", description = "a usage limit is exceeded"),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
    })
    @NonNull
    @PostMapping("/{orgId}/{serviceKey}/leases")
    ResponseEntity<UsageDecision> admit(
        @Valid @NotBlank @PathVariable String orgId,
        @Valid @NotBlank @PathVariable String serviceKey
    ) {
        val decision = usageService.admit(orgId, serviceKey);
        if (decision.isAllowed()) {
            return ResponseEntity.status(HttpStatus.CREATED).body(decision);
        }

        if (!decision.getReason().isLimitExceeded()) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).body(decision);
        }

        val response = ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS);
        if (decision.getResetTime() != null) {
            val retryAfter = Duration.between(OffsetDateTime.now(), decision.getResetTime()).toSeconds();
            response.header(HttpHeaders.RETRY_AFTER, String.valueOf(Math.max(1, retryAfter)));
        }

        return response.body(decision);
    }

    /**
     * Releases a concurrent request lease. Releasing an unknown or already released lease
     * succeeds as well.
     */
    @Operation(summary = "Release a concurrent request lease")
    @ApiResponses({
        @ApiResponse(responseCode = "204", description = "lease released"),
        @ApiResponse(responseCode = "400", description = "request is not valid"),
        @ApiResponse(responseCode = "401", description = "service api key is invalid"),
        @ApiResponse(responseCode = "500", description = "internal server error"),
    })
    @NonNull
    @DeleteMapping("/{orgId}/{serviceKey}/leases/{leaseId}")
    ResponseEntity<Void> release(
        @Valid @NotBlank @PathVariable String orgId,
        @Valid @NotBlank @PathVariable String serviceKey,
        @Valid @NotNull @PathVariable UUID leaseId
    ) {
        usageService.release(orgId, serviceKey, leaseId);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Get usage report of an organisation")
    @ApiResponses({
        @ApiResponse(responseCode = "200"),
        @ApiResponse(responseCode = "401", description = "service api key is invalid", content = @Content),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
    })
    @NonNull
    @GetMapping("/{orgId}")
    ResponseEntity<UsageReportResponse> getUsageReport(@Valid @NotBlank @PathVariable String orgId) {
        return ResponseEntity.ok(usageService.getUsageReport(orgId));
    }
}
