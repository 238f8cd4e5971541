package com.meterly.api.subscription;

import com.meterly.api.subscription.exceptions.WebhookEventException;
import com.meterly.api.subscription.exceptions.WebhookPayloadException;
import com.meterly.api.subscription.payload.WebhookEventResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for the Stripe webhook route and the failed event triage route.
 */
@Validated
@RestController
@Slf4j
@Tag(name = "webhook")
class WebhookController {

    private final WebhookEventProcessor webhookEventProcessor;

    @Autowired
    WebhookController(@NonNull WebhookEventProcessor webhookEventProcessor) {
        this.webhookEventProcessor = webhookEventProcessor;
    }

    /**
     * <p>
     * Receives Stripe events and applies them to the local subscription state. Each event is
     * applied at most once, however often Stripe delivers it.</p>
     *
     * <p><b>See also:</b></p>
     * <ul>
     *     <li><a href="https://stripe.com/docs/billing/subscriptions/webhooks">Subscription
     *     webhooks</a></li>
     *     <li><a href="https://stripe.com/docs/webhooks#retries">Webhook retries</a></li>
     * </ul>
     *
     * @return <ul>
     * <li>{@code HTTP 200} if the event was processed, ignored or already handled.</li>
     * <li>{@code HTTP 400} if the event can never be applied, e.g. its signature or payload is
     * invalid.</li>
     * <li>{@code HTTP 409} if another delivery of the event is being processed.</li>
     * <li>{@code HTTP 422} if the server was unable to process the event. Stripe retries it.</li>
     * <li>{@code HTTP 500} on internal server errors.</li>
     * </ul>
     */
    @Operation(hidden = true)
    @NonNull
    @PostMapping("/v1/webhooks/stripe")
    ResponseEntity<ProcessResult> stripeWebhook(
        @Valid @NotBlank @RequestHeader("Stripe-Signature") String payloadSignature,
        @Valid @NotBlank @RequestBody String body
    ) {
        try {
            val result = webhookEventProcessor.processPayload(body, payloadSignature);
            return result.getOutcome() == ProcessResult.Outcome.IN_PROGRESS
                ? ResponseEntity.status(HttpStatus.CONFLICT).body(result)
                : ResponseEntity.ok(result);
        } catch (WebhookPayloadException e) {
            log.info("failed to parse the event payload", e);
            return ResponseEntity.badRequest().build();
        } catch (WebhookEventException e) {
            log.info("failed to process the event payload", e);
            return ResponseEntity.unprocessableEntity().build();
        }
    }

    /**
     * Lists a {@code page} of webhook events that failed processing, oldest first. Each page
     * contains at most 20 entries.
     *
     * @param page 0-indexed page number. Causes {@literal HTTP 404} on exceeding the available
     *             limit.
     */
    @Operation(summary = "List failed webhook events")
    @ApiResponses({
        @ApiResponse(responseCode = "200"),
        @ApiResponse(responseCode = "400", description = "request is not valid", content = @Content),
        @ApiResponse(responseCode = "401", description = "service api key is invalid", content = @Content),
        @ApiResponse(responseCode = "404", description = "the requested page number is higher than available", content = @Content),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
    })
    @NonNull
    @GetMapping("/v1/internal/webhooks/failed")
    ResponseEntity<List<WebhookEventResponse>> listFailedEvents(
        @Valid @NotNull @Min(0) @RequestParam(required = false, defaultValue = "0") Integer page
    ) {
        val events = webhookEventProcessor.listFailedEvents(page);
        return page > 0 && events.isEmpty()
            ? ResponseEntity.notFound().build()
            : ResponseEntity.ok(events);
    }
}
