package com.meterly.api.subscription;

import com.meterly.api.subscription.exceptions.DuplicateSubscriptionException;
import com.meterly.api.subscription.exceptions.StripeCustomerPortalUrlException;
import com.meterly.api.subscription.exceptions.SubscriptionModuleNotFoundException;
import com.meterly.api.subscription.exceptions.SubscriptionNotFoundException;
import com.meterly.api.subscription.exceptions.SubscriptionPlanNotFoundException;
import com.meterly.api.subscription.payload.BillingPortalParams;
import com.meterly.api.subscription.payload.CheckoutSessionParams;
import com.meterly.api.subscription.payload.CheckoutSessionResponse;
import com.meterly.api.subscription.payload.StripeCustomerPortalUrlResponse;
import com.meterly.api.subscription.payload.SubscriptionResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for subscription related '{@code /v1/subscriptions}' routes.
 */
@Validated
@RestController
@RequestMapping("/v1/subscriptions")
@Slf4j
@Tag(name = "subscription")
class SubscriptionController {

    private final SubscriptionService subscriptionService;

    @Autowired
    SubscriptionController(@NonNull SubscriptionService subscriptionService) {
        this.subscriptionService = subscriptionService;
    }

    /**
     * <p>
     * Starts a Stripe checkout for an organisation. The clients must redirect the user to the
     * returned url to make the payment. The organisation's subscription is created once Stripe
     * reports the completed checkout.</p>
     *
     * <p>
     * A module key that repeats in {@code moduleKeys} is purchased as many times, if the module
     * allows multiple purchases.</p>
     */
    @Operation(summary = "Start a checkout session")
    @ApiResponses({
        @ApiResponse(responseCode = "201", description = "checkout session successfully created"),
        @ApiResponse(responseCode = "400", description = "request is not valid", content = @Content),
        @ApiResponse(responseCode = "401", description = "user is not authenticated", content = @Content),
        @ApiResponse(responseCode = "409", description = "organisation already has a subscription", content = @Content),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
    })
    @NonNull
    @PostMapping("/checkout")
    ResponseEntity<CheckoutSessionResponse> createCheckoutSession(
        @NonNull @AuthenticationPrincipal String principalId,
        @Valid @NotNull @RequestBody CheckoutSessionParams params
    ) {
        try {
            val result = subscriptionService.createCheckoutSession(principalId, params);
            return ResponseEntity.status(HttpStatus.CREATED).body(result);
        } catch (SubscriptionPlanNotFoundException | SubscriptionModuleNotFoundException e) {
            log.trace("checkout requested unavailable items", e);
            return ResponseEntity.badRequest().build();
        } catch (DuplicateSubscriptionException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).build();
        }
    }

    /**
     * Get the subscription of an organisation. Canceled subscriptions are returned as well.
     */
    @Operation(summary = "Get subscription")
    @ApiResponses({
        @ApiResponse(responseCode = "200"),
        @ApiResponse(responseCode = "401", description = "user is not authenticated", content = @Content),
        @ApiResponse(responseCode = "404", description = "organisation never had a subscription", content = @Content),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
    })
    @NonNull
    @GetMapping("/{orgId}")
    ResponseEntity<SubscriptionResponse> getSubscription(@Valid @NotBlank @PathVariable String orgId) {
        try {
            return ResponseEntity.ok(subscriptionService.getSubscription(orgId));
        } catch (SubscriptionNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
    }

    /**
     * Requests the cancellation of the organisation's subscription. Stripe is configured to cancel
     * subscriptions at the end of their billing cycles.
     */
    @Operation(summary = "Cancel subscription")
    @ApiResponses({
        @ApiResponse(responseCode = "204", description = "subscription cancellation requested"),
        @ApiResponse(responseCode = "401", description = "user is not authenticated"),
        @ApiResponse(responseCode = "404", description = "organisation has no trialing, active or past due subscription"),
        @ApiResponse(responseCode = "500", description = "internal server error"),
    })
    @NonNull
    @DeleteMapping("/{orgId}")
    ResponseEntity<Void> cancelSubscription(
        @NonNull @AuthenticationPrincipal String principalId,
        @Valid @NotBlank @PathVariable String orgId
    ) {
        try {
            subscriptionService.cancelSubscription(principalId, orgId);
            return ResponseEntity.noContent().build();
        } catch (SubscriptionNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
    }

    /**
     * Creates a short-lived Stripe billing portal session where the user manages payment methods
     * and invoices of the organisation.
     */
    @Operation(summary = "Open billing portal")
    @ApiResponses({
        @ApiResponse(responseCode = "200"),
        @ApiResponse(responseCode = "400", description = "request is not valid", content = @Content),
        @ApiResponse(responseCode = "401", description = "user is not authenticated", content = @Content),
        @ApiResponse(responseCode = "404", description = "organisation isn't linked to a Stripe customer", content = @Content),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
    })
    @NonNull
    @PostMapping("/{orgId}/portal")
    ResponseEntity<StripeCustomerPortalUrlResponse> createBillingPortalSession(
        @NonNull @AuthenticationPrincipal String principalId,
        @Valid @NotBlank @PathVariable String orgId,
        @Valid @NotNull @RequestBody BillingPortalParams params
    ) {
        try {
            return ResponseEntity.ok(subscriptionService.createBillingPortalSession(principalId, orgId, params.getReturnUrl()));
        } catch (StripeCustomerPortalUrlException e) {
            return ResponseEntity.notFound().build();
        }
    }
}
