package com.meterly.api.subscription;

import com.meterly.api.subscription.entities.WebhookEvent;
import com.meterly.api.subscription.entities.WebhookEventRepository;
import com.meterly.api.subscription.exceptions.WebhookEventException;
import com.meterly.api.subscription.exceptions.WebhookPayloadException;
import com.meterly.api.subscription.payload.WebhookEventResponse;
import com.meterly.api.subscription.upstream.StripeApi;
import com.stripe.exception.SignatureVerificationException;
import com.stripe.model.Event;
import com.stripe.model.Invoice;
import com.stripe.model.StripeObject;
import com.stripe.model.checkout.Session;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * <p>
 * {@link WebhookEventProcessor} applies each Stripe webhook event at most once, no matter how
 * often Stripe delivers it.</p>
 *
 * <p>
 * Before an event is dispatched to the {@link SubscriptionStateMachine}, it is recorded (or
 * claimed) as {@link WebhookEvent.Status#PROCESSING processing} in a transaction of its own. The
 * recorded outcome then decides what happens on redelivery:</p>
 *
 * <ul>
 *     <li>{@code PROCESSED}: nothing is applied again.</li>
 *     <li>{@code FAILED} and not retryable: nothing is applied again. The event needs a manual
 *     follow-up.</li>
 *     <li>{@code FAILED} and retryable: the event is applied again.</li>
 *     <li>{@code PROCESSING}: another delivery owns the event, unless its claim is older than the
 *     processing timeout.</li>
 * </ul>
 *
 * <p>
 * It isn't transactional. Outcomes are recorded even when the handler's transaction rolls
 * back.</p>
 */
@Service
@Slf4j
class WebhookEventProcessor {

    static final Set<String> SUPPORTED_EVENT_TYPES = Set.of(
        "checkout.session.completed",
        "customer.subscription.created",
        "customer.subscription.updated",
        "customer.subscription.deleted",
        "invoice.payment_succeeded",
        "invoice.payment_failed");

    private static final int MAX_ERROR_LENGTH = 512;
    private static final int FAILED_EVENTS_PAGE_SIZE = 20;

    private final WebhookEventRepository webhookEventRepository;
    private final SubscriptionStateMachine stateMachine;
    private final StripeApi stripeApi;
    private final SubscriptionConfiguration subscriptionConfig;
    private final WebhookConfiguration webhookConfig;
    private final Clock clock;

    @Autowired
    WebhookEventProcessor(
        @NonNull WebhookEventRepository webhookEventRepository,
        @NonNull SubscriptionStateMachine stateMachine,
        @NonNull StripeApi stripeApi,
        @NonNull SubscriptionConfiguration subscriptionConfig,
        @NonNull WebhookConfiguration webhookConfig,
        @NonNull Clock clock
    ) {
        this.webhookEventRepository = webhookEventRepository;
        this.stateMachine = stateMachine;
        this.stripeApi = stripeApi;
        this.subscriptionConfig = subscriptionConfig;
        this.webhookConfig = webhookConfig;
        this.clock = clock;
    }

    /**
     * Verifies the signature of a webhook payload and processes the event that it carries.
     *
     * @param payload   raw request body.
     * @param signature value of the {@code Stripe-Signature} header.
     * @throws WebhookPayloadException if the signature doesn't match the payload, or if the event
     *                                 can never be applied.
     * @throws WebhookEventException   if the event couldn't be applied this time, but a
     *                                 redelivery may succeed.
     * @see #processEvent(Event, String)
     */
    @NonNull
    ProcessResult processPayload(@NonNull String payload, @NonNull String signature) throws WebhookPayloadException, WebhookEventException {
        final Event event;
        try {
            event = stripeApi.decodeWebhookPayload(payload, signature, subscriptionConfig.getStripeWebhookSecret());
        } catch (SignatureVerificationException e) {
            throw new WebhookPayloadException("failed to verify payload signature", e);
        }

        return processEvent(event, payload);
    }

    /**
     * Records and applies a decoded Stripe event.
     *
     * @param event   the decoded event.
     * @param payload raw event payload, stored for triage of failed events.
     * @return the outcome of this delivery.
     * @throws WebhookPayloadException if the event can never be applied.
     * @throws WebhookEventException   if the event couldn't be applied this time.
     */
    @NonNull
    ProcessResult processEvent(@NonNull Event event, String payload) throws WebhookPayloadException, WebhookEventException {
        val eventId = event.getId();
        val eventType = event.getType();
        val now = OffsetDateTime.now(clock);
        val existing = webhookEventRepository.findByStripeEventId(eventId).orElse(null);
        final long recordId;
        if (existing != null) {
            switch (existing.getStatus()) {
                case PROCESSED:
                    log.debug("skipping already processed event {}", eventId);
                    return ProcessResult.duplicate(eventId, eventType);
                case FAILED:
                    if (!existing.isRetryable()) {
                        log.debug("skipping terminally failed event {}", eventId);
                        return ProcessResult.duplicate(eventId, eventType);
                    }

                    break;
                case PROCESSING:
                    if (existing.getUpdatedAt().isAfter(now.minus(webhookConfig.getProcessingTimeout()))) {
                        return ProcessResult.inProgress(eventId, eventType);
                    }

                    log.info("reclaiming event {} from a stale delivery", eventId);
                    break;
                default:
                    break;
            }

            if (webhookEventRepository.claim(existing.getId(), existing.getStatus(), existing.getAttemptCount(), now) == 0) {
                return ProcessResult.inProgress(eventId, eventType);
            }

            recordId = existing.getId();
        } else {
            try {
                recordId = webhookEventRepository.save(WebhookEvent.builder()
                        .stripeEventId(eventId)
                        .eventType(eventType)
                        .payload(payload)
                        .status(WebhookEvent.Status.PROCESSING)
                        .createdAt(now)
                        .updatedAt(now)
                        .build())
                    .getId();
            } catch (DataIntegrityViolationException e) {
                log.debug("event {} was recorded by a concurrent delivery", eventId);
                return ProcessResult.inProgress(eventId, eventType);
            }
        }

        if (!SUPPORTED_EVENT_TYPES.contains(eventType)) {
            webhookEventRepository.markProcessed(recordId, OffsetDateTime.now(clock));
            log.debug("ignoring unsupported event type '{}'", eventType);
            return ProcessResult.ignored(eventId, eventType);
        }

        try {
            dispatch(event);
        } catch (WebhookPayloadException e) {
            markFailed(recordId, false, e);
            throw e;
        } catch (WebhookEventException e) {
            markFailed(recordId, true, e);
            throw e;
        } catch (OptimisticLockingFailureException | DataIntegrityViolationException e) {
            markFailed(recordId, true, e);
            throw new WebhookEventException("local store conflict", e);
        } catch (IllegalArgumentException | IllegalStateException e) {
            // a handler bug fails the same way on every delivery.
            markFailed(recordId, false, e);
            throw e;
        } catch (RuntimeException e) {
            markFailed(recordId, true, e);
            throw e;
        }

        webhookEventRepository.markProcessed(recordId, OffsetDateTime.now(clock));
        log.info("processed event {} of type '{}'", eventId, eventType);
        return ProcessResult.processed(eventId, eventType);
    }

    /**
     * Lists a {@code page} of events that failed processing, oldest first. Each page contains at
     * most 20 entries.
     *
     * @param page 0-indexed page number.
     */
    @NonNull
    List<WebhookEventResponse> listFailedEvents(int page) {
        val pageable = PageRequest.of(page, FAILED_EVENTS_PAGE_SIZE, Sort.by(Sort.Order.asc("createdAt")));
        return webhookEventRepository.findAllFailed(pageable)
            .stream()
            .map(WebhookEventProcessor::buildWebhookEventResponse)
            .collect(Collectors.toUnmodifiableList());
    }

    /**
     * Releases stale claims and deletes processed events that are older than the retention period.
     */
    void performGarbageCollection() {
        val now = OffsetDateTime.now(clock);
        val released = webhookEventRepository.releaseStaleClaims(now.minus(webhookConfig.getProcessingTimeout()));
        val deleted = webhookEventRepository.deleteAllProcessedBefore(now.minus(webhookConfig.getRetainProcessedEventsFor()));
        log.info("released {} stale webhook event claims, deleted {} processed webhook events", released, deleted);
    }

    private void dispatch(@NonNull Event event) throws WebhookPayloadException, WebhookEventException {
        switch (event.getType()) {
            case "checkout.session.completed":
                stateMachine.onCheckoutCompleted(extractObject(event, Session.class));
                break;
            case "customer.subscription.created":
                stateMachine.onSubscriptionCreated(extractObject(event, com.stripe.model.Subscription.class).getId());
                break;
            case "customer.subscription.updated":
                stateMachine.onSubscriptionUpdated(extractObject(event, com.stripe.model.Subscription.class).getId());
                break;
            case "customer.subscription.deleted":
                stateMachine.onSubscriptionDeleted(extractObject(event, com.stripe.model.Subscription.class).getId());
                break;
            case "invoice.payment_succeeded":
                stateMachine.onInvoicePaymentSucceeded(extractObject(event, Invoice.class));
                break;
            case "invoice.payment_failed":
                stateMachine.onInvoicePaymentFailed(extractObject(event, Invoice.class));
                break;
            default:
                throw new IllegalStateException("no handler for event type: " + event.getType());
        }
    }

    private void markFailed(long recordId, boolean isRetryable, @NonNull Exception e) {
        log.info("failed to process webhook event (retryable: {})", isRetryable, e);
        webhookEventRepository.markFailed(recordId, isRetryable, truncateError(e), OffsetDateTime.now(clock));
    }

    @NonNull
    private static <T extends StripeObject> T extractObject(@NonNull Event event, @NonNull Class<T> type) throws WebhookPayloadException {
        val object = event.getDataObjectDeserializer().getObject()
            .orElseThrow(() -> new WebhookPayloadException("failed to get data object from the event payload"));

        if (!type.isInstance(object)) {
            throw new WebhookPayloadException(
                String.format("expected %s in the event payload, found %s", type.getSimpleName(), object.getClass().getSimpleName()));
        }

        return type.cast(object);
    }

    @NonNull
    private static String truncateError(@NonNull Exception e) {
        val message = String.format("%s: %s", e.getClass().getSimpleName(), e.getMessage());
        return message.length() > MAX_ERROR_LENGTH ? message.substring(0, MAX_ERROR_LENGTH) : message;
    }

    @NonNull
    private static WebhookEventResponse buildWebhookEventResponse(@NonNull WebhookEvent event) {
        return WebhookEventResponse.builder()
            .eventId(event.getStripeEventId())
            .eventType(event.getEventType())
            .isRetryable(event.isRetryable())
            .error(event.getError())
            .attemptCount(event.getAttemptCount())
            .createdAt(event.getCreatedAt())
            .processedAt(event.getProcessedAt())
            .build();
    }
}
