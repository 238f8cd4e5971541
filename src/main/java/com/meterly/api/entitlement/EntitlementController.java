package com.meterly.api.entitlement;

import com.meterly.api.entitlement.payload.OrgModuleQuotasResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.NonNull;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for internal '{@code /v1/internal/orgs}' routes consumed by other services.
 */
@Validated
@RestController
@RequestMapping("/v1/internal/orgs")
@Tag(name = "internal")
class EntitlementController {

    private final EntitlementService entitlementService;

    @Autowired
    EntitlementController(@NonNull EntitlementService entitlementService) {
        this.entitlementService = entitlementService;
    }

    /**
     * Returns the module quotas of an organisation. Organisations that never subscribed get an
     * empty list of quotas rather than a 404, so callers can treat every organisation alike.
     */
    @Operation(summary = "Get module quotas of an organisation")
    @ApiResponses({
        @ApiResponse(responseCode = "200"),
        @ApiResponse(responseCode = "400", description = "request is not valid", content = @Content),
        @ApiResponse(responseCode = "401", description = "service api key is invalid", content = @Content),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
    })
    @NonNull
    @GetMapping("/{orgId}/quotas")
    ResponseEntity<OrgModuleQuotasResponse> getOrgModuleQuotas(@Valid @NotBlank @PathVariable String orgId) {
        return ResponseEntity.ok(entitlementService.getOrgModuleQuotas(orgId));
    }
}
