package com.meterly.api.subscription;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.meterly.api.contracts.CatalogServiceContract;
import com.meterly.api.contracts.CatalogSnapshot;
import com.meterly.api.contracts.SubscriptionItem;
import com.meterly.api.platform.transaction.annotations.ReasonablyTransactional;
import com.meterly.api.subscription.entities.Subscription;
import com.meterly.api.subscription.entities.SubscriptionLog;
import com.meterly.api.subscription.entities.SubscriptionLogRepository;
import com.meterly.api.subscription.entities.SubscriptionRepository;
import com.meterly.api.subscription.entities.SubscriptionStatus;
import com.meterly.api.subscription.entities.TrialStatus;
import com.meterly.api.subscription.entities.TrialStatusRepository;
import com.meterly.api.subscription.exceptions.WebhookEventException;
import com.meterly.api.subscription.exceptions.WebhookPayloadException;
import com.meterly.api.subscription.upstream.StripeApi;
import com.stripe.exception.StripeException;
import com.stripe.model.Invoice;
import com.stripe.model.checkout.Session;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.cache.Cache;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNullElse;

/**
 * <p>
 * {@link SubscriptionStateMachine} applies Stripe webhook events to the local {@link Subscription}
 * records. It is the only writer of subscription status.</p>
 *
 * <p>
 * Handlers never trust the state carried by an event. They re-fetch the canonical subscription
 * from Stripe, so retried or out-of-order deliveries converge to the same local state. Each
 * handler holds a row lock on the organisation's subscription for the duration of its
 * transaction.</p>
 *
 * @see SubscriptionStatus#canTransitionTo(SubscriptionStatus)
 */
@Service
@Slf4j
class SubscriptionStateMachine {

    static final String METADATA_ORG_ID = "orgId";
    static final String METADATA_USER_ID = "userId";
    static final String METADATA_PLAN_KEY = "planKey";
    static final String METADATA_MODULE_KEYS = "moduleKeys";

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final SubscriptionRepository subscriptionRepository;
    private final TrialStatusRepository trialStatusRepository;
    private final SubscriptionLogRepository subscriptionLogRepository;
    private final CatalogServiceContract catalogServiceContract;
    private final StripeApi stripeApi;
    private final Cache cache;

    @Autowired
    SubscriptionStateMachine(
        @NonNull SubscriptionRepository subscriptionRepository,
        @NonNull TrialStatusRepository trialStatusRepository,
        @NonNull SubscriptionLogRepository subscriptionLogRepository,
        @NonNull CatalogServiceContract catalogServiceContract,
        @NonNull StripeApi stripeApi,
        @NonNull @Qualifier(SubscriptionBeans.CACHE_NAME) Cache cache
    ) {
        this.subscriptionRepository = subscriptionRepository;
        this.trialStatusRepository = trialStatusRepository;
        this.subscriptionLogRepository = subscriptionLogRepository;
        this.catalogServiceContract = catalogServiceContract;
        this.stripeApi = stripeApi;
        this.cache = cache;
    }

    /**
     * <p>
     * Creates (or resyncs) the organisation's subscription from a completed checkout session.</p>
     *
     * <ul>
     *     <li>If the organisation has no subscription, a new one is created.</li>
     *     <li>If its subscription refers to the same Stripe subscription, it is resynced.</li>
     *     <li>If its subscription is canceled, the record starts a new lifecycle.</li>
     *     <li>If it owns another trialing, active or past due subscription, the new Stripe
     *     subscription is refunded and the local record is left untouched.</li>
     * </ul>
     *
     * @throws WebhookPayloadException if the session is not a completed subscription checkout or
     *                                 its metadata is missing or malformed.
     * @throws WebhookEventException   if the subscription couldn't be retrieved from Stripe.
     */
    @ReasonablyTransactional
    public void onCheckoutCompleted(@NonNull Session session) throws WebhookPayloadException, WebhookEventException {
        if (!"subscription".equals(session.getMode())) {
            throw new WebhookPayloadException("checkout session mode is not subscription");
        } else if (!"complete".equals(session.getStatus())) {
            throw new WebhookPayloadException("checkout session status is not complete");
        } else if (session.getSubscription() == null) {
            throw new WebhookPayloadException("checkout session subscription id is null");
        }

        val metadata = requireNonNullElse(session.getMetadata(), Map.<String, String>of());
        val orgId = requireMetadata(metadata, METADATA_ORG_ID);
        val userId = requireMetadata(metadata, METADATA_USER_ID);
        val planKey = requireMetadata(metadata, METADATA_PLAN_KEY);
        val moduleKeys = parseModuleKeys(metadata.get(METADATA_MODULE_KEYS));

        val stripeSubscription = fetchStripeSubscription(session.getSubscription());
        val status = SubscriptionStatus.fromStripeStatus(stripeSubscription.getStatus()).orElse(null);
        if (status == null) {
            log.warn("ignoring checkout of org {} with unsupported stripe subscription status '{}'",
                orgId, stripeSubscription.getStatus());
            return;
        }

        val items = buildItems(stripeSubscription, planKey);
        val existing = subscriptionRepository.findByOrgIdForUpdate(orgId).orElse(null);
        if (existing != null
            && existing.getStatus() != SubscriptionStatus.CANCELED
            && !stripeSubscription.getId().equals(existing.getStripeSubscriptionId())) {
            // the organisation completed two checkout sessions concurrently.
            try {
                stripeApi.refundSubscription(stripeSubscription.getId());
            } catch (StripeException e) {
                throw new WebhookEventException("failed to refund duplicate stripe subscription", e);
            }

            val logMetadata = new LinkedHashMap<String, Object>();
            logMetadata.put("stripeSubscriptionId", stripeSubscription.getId());
            logMetadata.put("existingStripeSubscriptionId", existing.getStripeSubscriptionId());
            appendLog(orgId, existing.getId(), "duplicate_checkout_refunded", logMetadata);
            log.info("refunded duplicate checkout of org {}", orgId);
            return;
        }

        final Subscription subscription;
        final SubscriptionStatus previousStatus;
        if (existing != null && stripeSubscription.getId().equals(existing.getStripeSubscriptionId())) {
            previousStatus = existing.getStatus();
            if (!transition(existing, status)) {
                return;
            }

            subscription = existing;
        } else {
            // a canceled record starts its new lifecycle from the implicit 'none' state.
            previousStatus = null;
            subscription = existing != null ? existing : Subscription.builder().orgId(orgId).status(status).build();
            subscription.setStatus(status);
            subscription.setCanceledAt(null);
        }

        subscription.setPayerId(userId);
        subscription.setStripeSubscriptionId(stripeSubscription.getId());
        if (session.getCustomer() != null) {
            subscription.setStripeCustomerId(session.getCustomer());
        }

        copyDetailsFromStripe(subscription, stripeSubscription, items);
        val saved = subscriptionRepository.save(subscription);
        if (status == SubscriptionStatus.TRIALING) {
            recordTrial(userId, orgId);
        }

        val logMetadata = new LinkedHashMap<String, Object>();
        logMetadata.put("stripeSubscriptionId", stripeSubscription.getId());
        logMetadata.put("planKey", planKey);
        logMetadata.put("moduleKeys", moduleKeys);
        logMetadata.put("previousStatus", previousStatus == null ? "none" : previousStatus.getValue());
        logMetadata.put("status", status.getValue());
        appendLog(orgId, saved.getId(), "checkout_completed", logMetadata);
        evictIsSubscribedCache(orgId);
        log.info("org {} completed checkout, subscription status: {}", orgId, status.getValue());
    }

    /**
     * Syncs a subscription from Stripe. If the subscription is unknown locally, but its Stripe
     * metadata names an organisation, a local record is created for it.
     *
     * @param stripeSubscriptionId id of the created subscription.
     * @throws WebhookEventException if the subscription couldn't be retrieved from Stripe.
     */
    @ReasonablyTransactional
    public void onSubscriptionCreated(@NonNull String stripeSubscriptionId) throws WebhookEventException {
        syncFromStripe(stripeSubscriptionId, "subscription_created");
    }

    /**
     * Syncs status, items and billing period of a subscription from Stripe.
     *
     * @param stripeSubscriptionId id of the updated subscription.
     * @throws WebhookEventException if the subscription couldn't be retrieved from Stripe.
     */
    @ReasonablyTransactional
    public void onSubscriptionUpdated(@NonNull String stripeSubscriptionId) throws WebhookEventException {
        syncFromStripe(stripeSubscriptionId, "subscription_updated");
    }

    /**
     * Moves a subscription to its terminal {@link SubscriptionStatus#CANCELED canceled} state.
     * Its items are retained.
     *
     * @param stripeSubscriptionId id of the deleted subscription.
     */
    @ReasonablyTransactional
    public void onSubscriptionDeleted(@NonNull String stripeSubscriptionId) {
        val subscription = subscriptionRepository.findByStripeSubscriptionIdForUpdate(stripeSubscriptionId).orElse(null);
        if (subscription == null) {
            log.warn("received deletion of unknown stripe subscription {}", stripeSubscriptionId);
            return;
        }

        if (subscription.getStatus() == SubscriptionStatus.CANCELED) {
            return;
        }

        val previousStatus = subscription.getStatus();
        subscription.setStatus(SubscriptionStatus.CANCELED);
        subscription.setCancelAtPeriodEnd(false);
        subscription.setCanceledAt(OffsetDateTime.now());
        subscriptionRepository.save(subscription);

        val logMetadata = new LinkedHashMap<String, Object>();
        logMetadata.put("stripeSubscriptionId", stripeSubscriptionId);
        logMetadata.put("previousStatus", previousStatus.getValue());
        appendLog(subscription.getOrgId(), subscription.getId(), "subscription_deleted", logMetadata);
        evictIsSubscribedCache(subscription.getOrgId());
        log.info("subscription of org {} canceled", subscription.getOrgId());
    }

    /**
     * Restores a {@link SubscriptionStatus#PAST_DUE past due} subscription to {@link
     * SubscriptionStatus#ACTIVE active} if Stripe reports it active. Other statuses are left
     * untouched.
     *
     * @throws WebhookEventException if the subscription couldn't be retrieved from Stripe.
     */
    @ReasonablyTransactional
    public void onInvoicePaymentSucceeded(@NonNull Invoice invoice) throws WebhookEventException {
        applyInvoiceOutcome(invoice, SubscriptionStatus.PAST_DUE, SubscriptionStatus.ACTIVE, "payment_succeeded");
    }

    /**
     * Moves an {@link SubscriptionStatus#ACTIVE active} subscription to {@link
     * SubscriptionStatus#PAST_DUE past due} if Stripe reports it past due. A failed payment on a
     * trialing subscription is only logged. Whether to suspend a past due subscription is left to
     * Stripe's dunning.
     *
     * @throws WebhookEventException if the subscription couldn't be retrieved from Stripe.
     */
    @ReasonablyTransactional
    public void onInvoicePaymentFailed(@NonNull Invoice invoice) throws WebhookEventException {
        applyInvoiceOutcome(invoice, SubscriptionStatus.ACTIVE, SubscriptionStatus.PAST_DUE, "payment_failed");
    }

    /**
     * Moves the invoice's subscription from {@code from} to {@code to}, but only if Stripe's
     * current subscription status agrees. Invoice events arrive out of order with respect to
     * payment retries, so the event alone doesn't decide the status.
     */
    private void applyInvoiceOutcome(
        @NonNull Invoice invoice,
        @NonNull SubscriptionStatus from,
        @NonNull SubscriptionStatus to,
        @NonNull String action
    ) throws WebhookEventException {
        val subscription = findByInvoice(invoice);
        if (subscription == null) {
            return;
        }

        val previousStatus = subscription.getStatus();
        if (previousStatus == from) {
            val stripeSubscription = fetchStripeSubscription(invoice.getSubscription());
            val stripeStatus = SubscriptionStatus.fromStripeStatus(stripeSubscription.getStatus()).orElse(null);
            if (stripeStatus != to) {
                log.info("ignoring {} of invoice {}, stripe reports subscription {} as '{}'",
                    action, invoice.getId(), invoice.getSubscription(), stripeSubscription.getStatus());
            } else if (transition(subscription, to)) {
                subscriptionRepository.save(subscription);
                evictIsSubscribedCache(subscription.getOrgId());
                log.info("subscription of org {} moved to {} after {}", subscription.getOrgId(), to.getValue(), action);
            }
        }

        appendInvoiceLog(subscription, invoice, previousStatus, action);
    }

    private void syncFromStripe(@NonNull String stripeSubscriptionId, @NonNull String action) throws WebhookEventException {
        val stripeSubscription = fetchStripeSubscription(stripeSubscriptionId);
        val stripeMetadata = requireNonNullElse(stripeSubscription.getMetadata(), Map.<String, String>of());
        Subscription subscription = subscriptionRepository.findByStripeSubscriptionIdForUpdate(stripeSubscriptionId).orElse(null);
        SubscriptionStatus previousStatus = null;
        if (subscription == null) {
            subscription = newSubscriptionFromMetadata(stripeSubscriptionId, stripeMetadata);
            if (subscription == null) {
                return;
            }
        } else {
            previousStatus = subscription.getStatus();
        }

        if (previousStatus == SubscriptionStatus.CANCELED) {
            log.info("ignoring update of canceled stripe subscription {}", stripeSubscriptionId);
            return;
        }

        val status = SubscriptionStatus.fromStripeStatus(stripeSubscription.getStatus()).orElse(null);
        if (status == null) {
            log.warn("ignoring unsupported status '{}' of stripe subscription {}",
                stripeSubscription.getStatus(), stripeSubscriptionId);
            return;
        }

        if (previousStatus != null && !transition(subscription, status)) {
            return;
        }

        subscription.setStatus(status);
        if (stripeSubscription.getCustomer() != null) {
            subscription.setStripeCustomerId(stripeSubscription.getCustomer());
        }

        val fallbackPlanKey = subscription.findPlanKey().orElse(stripeMetadata.get(METADATA_PLAN_KEY));
        copyDetailsFromStripe(subscription, stripeSubscription, buildItems(stripeSubscription, fallbackPlanKey));
        val saved = subscriptionRepository.save(subscription);

        val logMetadata = new LinkedHashMap<String, Object>();
        logMetadata.put("stripeSubscriptionId", stripeSubscriptionId);
        logMetadata.put("previousStatus", previousStatus == null ? "none" : previousStatus.getValue());
        logMetadata.put("status", status.getValue());
        appendLog(saved.getOrgId(), saved.getId(), action, logMetadata);
        evictIsSubscribedCache(saved.getOrgId());
    }

    /**
     * Handles a subscription that Stripe reports before its checkout session completes.
     *
     * @return a new record for the organisation named in the metadata, or {@literal null} if the
     * event can't be linked to an organisation without a conflicting subscription.
     */
    private Subscription newSubscriptionFromMetadata(
        @NonNull String stripeSubscriptionId,
        @NonNull Map<String, String> stripeMetadata
    ) {
        val orgId = stripeMetadata.get(METADATA_ORG_ID);
        if (orgId == null || orgId.isBlank()) {
            log.warn("stripe subscription {} is unknown and has no org id in its metadata", stripeSubscriptionId);
            return null;
        }

        val existing = subscriptionRepository.findByOrgIdForUpdate(orgId).orElse(null);
        if (existing != null && existing.getStatus() != SubscriptionStatus.CANCELED) {
            log.warn("org {} already owns stripe subscription {}, skipping {}",
                orgId, existing.getStripeSubscriptionId(), stripeSubscriptionId);
            return null;
        }

        val subscription = existing != null
            ? existing
            : Subscription.builder().orgId(orgId).status(SubscriptionStatus.TRIALING).build();

        subscription.setStripeSubscriptionId(stripeSubscriptionId);
        subscription.setPayerId(stripeMetadata.get(METADATA_USER_ID));
        subscription.setCanceledAt(null);
        return subscription;
    }

    private Subscription findByInvoice(@NonNull Invoice invoice) {
        // invoices of one-off payments aren't linked to a subscription.
        if (invoice.getSubscription() == null) {
            log.debug("ignoring invoice {} without a subscription", invoice.getId());
            return null;
        }

        val subscription = subscriptionRepository.findByStripeSubscriptionIdForUpdate(invoice.getSubscription()).orElse(null);
        if (subscription == null) {
            log.warn("received invoice {} of unknown stripe subscription {}", invoice.getId(), invoice.getSubscription());
        }

        return subscription;
    }

    private boolean transition(@NonNull Subscription subscription, @NonNull SubscriptionStatus next) {
        if (!subscription.getStatus().canTransitionTo(next)) {
            log.warn("rejected subscription status transition of org {}: {} -> {}",
                subscription.getOrgId(), subscription.getStatus().getValue(), next.getValue());
            return false;
        }

        subscription.setStatus(next);
        return true;
    }

    @NonNull
    private com.stripe.model.Subscription fetchStripeSubscription(@NonNull String id) throws WebhookEventException {
        try {
            return stripeApi.getSubscription(id);
        } catch (StripeException e) {
            throw new WebhookEventException("failed to get subscription object from stripe api", e);
        }
    }

    /**
     * Maps Stripe subscription items to local items using the prices in the catalog. Prices that
     * the catalog doesn't know are kept as {@code unknown_<priceId>} modules, so that they remain
     * visible. If Stripe doesn't report a plan item, {@code fallbackPlanKey} fills it in.
     */
    @NonNull
    private List<SubscriptionItem> buildItems(
        @NonNull com.stripe.model.Subscription stripeSubscription,
        String fallbackPlanKey
    ) {
        final CatalogSnapshot catalog = catalogServiceContract.getSnapshot();
        SubscriptionItem planItem = null;
        val moduleItems = new ArrayList<SubscriptionItem>();
        val stripeItems = stripeSubscription.getItems() == null ? null : stripeSubscription.getItems().getData();
        for (val stripeItem : requireNonNullElse(stripeItems, List.<com.stripe.model.SubscriptionItem>of())) {
            if (stripeItem == null || stripeItem.getPrice() == null || stripeItem.getPrice().getId() == null) {
                continue;
            }

            val priceId = stripeItem.getPrice().getId();
            val quantity = (int) Math.max(1, requireNonNullElse(stripeItem.getQuantity(), 1L));
            val plan = catalog.findPlanByPriceId(priceId);
            if (plan.isPresent()) {
                if (planItem == null) {
                    planItem = SubscriptionItem.plan(plan.get().getKey(), plan.get().getName(), priceId);
                } else {
                    log.warn("stripe subscription {} has more than one plan price", stripeSubscription.getId());
                }

                continue;
            }

            moduleItems.add(catalog.findModuleByPriceId(priceId)
                .map(m -> SubscriptionItem.module(m.getKey(), m.getName(), priceId, quantity))
                .orElseGet(() -> SubscriptionItem.module("unknown_" + priceId, "unknown_" + priceId, priceId, quantity)));
        }

        if (planItem == null && fallbackPlanKey != null && !fallbackPlanKey.isBlank()) {
            planItem = catalog.findPlan(fallbackPlanKey)
                .map(p -> SubscriptionItem.plan(p.getKey(), p.getName(), p.getStripePriceId()))
                .orElseGet(() -> SubscriptionItem.plan(fallbackPlanKey, fallbackPlanKey, null));
        }

        val items = new ArrayList<SubscriptionItem>(moduleItems.size() + 1);
        if (planItem != null) {
            items.add(planItem);
        }

        items.addAll(moduleItems);
        return items;
    }

    private static void copyDetailsFromStripe(
        @NonNull Subscription subscription,
        @NonNull com.stripe.model.Subscription stripeSubscription,
        @NonNull List<SubscriptionItem> items
    ) {
        subscription.setItems(items);
        subscription.setCancelAtPeriodEnd(requireNonNullElse(stripeSubscription.getCancelAtPeriodEnd(), false));
        subscription.setBillingCycleAnchorSeconds(stripeSubscription.getBillingCycleAnchor());
        subscription.setCurrentPeriodEndSeconds(stripeSubscription.getCurrentPeriodEnd());
        if (subscription.getStatus() == SubscriptionStatus.CANCELED) {
            subscription.setCanceledAtSeconds(stripeSubscription.getCanceledAt());
            if (subscription.getCanceledAt() == null) {
                subscription.setCanceledAt(OffsetDateTime.now());
            }
        }
    }

    private void recordTrial(@NonNull String payerId, @NonNull String orgId) {
        val trialStatus = trialStatusRepository.findById(payerId)
            .orElseGet(() -> TrialStatus.builder().payerId(payerId).build());

        trialStatus.recordTrial(orgId);
        trialStatusRepository.save(trialStatus);
    }

    private void appendInvoiceLog(
        @NonNull Subscription subscription,
        @NonNull Invoice invoice,
        @NonNull SubscriptionStatus previousStatus,
        @NonNull String action
    ) {
        val logMetadata = new LinkedHashMap<String, Object>();
        logMetadata.put("invoiceId", invoice.getId());
        logMetadata.put("previousStatus", previousStatus.getValue());
        logMetadata.put("status", subscription.getStatus().getValue());
        appendLog(subscription.getOrgId(), subscription.getId(), action, logMetadata);
    }

    private void appendLog(@NonNull String orgId, Long subscriptionId, @NonNull String action, @NonNull Map<String, Object> metadata) {
        subscriptionLogRepository.save(SubscriptionLog.builder()
            .orgId(orgId)
            .subscriptionId(subscriptionId)
            .action(action)
            .metadata(metadata)
            .build());
    }

    /**
     * Evicts the cached subscription check of an organisation once the surrounding transaction
     * commits, so that concurrent readers can't cache the uncommitted state again.
     */
    private void evictIsSubscribedCache(@NonNull String orgId) {
        final String key = "isSubscribed:" + orgId;
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            cache.evictIfPresent(key);
            return;
        }

        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                cache.evictIfPresent(key);
            }
        });
    }

    @NonNull
    private static String requireMetadata(@NonNull Map<String, String> metadata, @NonNull String key) throws WebhookPayloadException {
        val value = metadata.get(key);
        if (value == null || value.isBlank()) {
            throw new WebhookPayloadException(String.format("checkout session metadata is missing '%s'", key));
        }

        return value;
    }

    @NonNull
    static List<String> parseModuleKeys(String json) throws WebhookPayloadException {
        if (json == null || json.isBlank()) {
            return List.of();
        }

        final List<String> keys;
        try {
            keys = objectMapper.readValue(json, new TypeReference<List<String>>() {
            });
        } catch (JsonProcessingException e) {
            throw new WebhookPayloadException("checkout session metadata has malformed 'moduleKeys'", e);
        }

        if (keys == null || keys.stream().anyMatch(k -> k == null || k.isBlank())) {
            throw new WebhookPayloadException("checkout session metadata has malformed 'moduleKeys'");
        }

        return keys;
    }

    @NonNull
    static String formatModuleKeys(@NonNull List<String> moduleKeys) {
        try {
            return objectMapper.writeValueAsString(moduleKeys);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("failed to serialize module keys", e);
        }
    }
}
