package com.meterly.api.catalog;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for internal '{@code /v1/internal/catalog}' routes.
 */
@RestController
@RequestMapping("/v1/internal/catalog")
@Slf4j
@Tag(name = "internal")
class CatalogController {

    private final CatalogService catalogService;

    @Autowired
    CatalogController(@NonNull CatalogService catalogService) {
        this.catalogService = catalogService;
    }

    /**
     * Drops the cached catalog snapshot. The catalog admin service calls it after changing plans
     * or modules so that entitlements reflect the change without waiting for the cache ttl.
     */
    @Operation(summary = "Refresh the catalog snapshot")
    @ApiResponses({
        @ApiResponse(responseCode = "204", description = "snapshot dropped"),
        @ApiResponse(responseCode = "401", description = "service api key is invalid"),
        @ApiResponse(responseCode = "500", description = "internal server error"),
    })
    @NonNull
    @PostMapping("/refresh")
    ResponseEntity<Void> refresh() {
        log.info("refreshing catalog snapshot on request");
        catalogService.refreshSnapshot();
        return ResponseEntity.noContent().build();
    }
}
