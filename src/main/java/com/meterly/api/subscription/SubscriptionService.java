package com.meterly.api.subscription;

import com.meterly.api.contracts.CatalogServiceContract;
import com.meterly.api.contracts.CatalogSnapshot;
import com.meterly.api.contracts.SubscriptionServiceContract;
import com.meterly.api.platform.transaction.annotations.ReasonablyTransactional;
import com.meterly.api.subscription.entities.Subscription;
import com.meterly.api.subscription.entities.SubscriptionLog;
import com.meterly.api.subscription.entities.SubscriptionLogRepository;
import com.meterly.api.subscription.entities.SubscriptionRepository;
import com.meterly.api.subscription.entities.TrialStatus;
import com.meterly.api.subscription.entities.TrialStatusRepository;
import com.meterly.api.subscription.exceptions.DuplicateSubscriptionException;
import com.meterly.api.subscription.exceptions.StripeCustomerPortalUrlException;
import com.meterly.api.subscription.exceptions.SubscriptionModuleNotFoundException;
import com.meterly.api.subscription.exceptions.SubscriptionNotFoundException;
import com.meterly.api.subscription.exceptions.SubscriptionPlanNotFoundException;
import com.meterly.api.subscription.payload.CheckoutSessionParams;
import com.meterly.api.subscription.payload.CheckoutSessionResponse;
import com.meterly.api.subscription.payload.StripeCustomerPortalUrlResponse;
import com.meterly.api.subscription.payload.SubscriptionResponse;
import com.meterly.api.subscription.upstream.StripeApi;
import com.stripe.exception.StripeException;
import jakarta.validation.ConstraintViolationException;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNullElse;

/**
 * {@link SubscriptionService} implements operations that users start on their organisation's
 * subscription. Status changes that follow from these operations arrive through Stripe webhook
 * events and are applied by the {@link SubscriptionStateMachine}.
 */
@Service
@Slf4j
class SubscriptionService implements SubscriptionServiceContract {

    private final SubscriptionConfiguration subscriptionConfig;
    private final SubscriptionRepository subscriptionRepository;
    private final TrialStatusRepository trialStatusRepository;
    private final SubscriptionLogRepository subscriptionLogRepository;
    private final CatalogServiceContract catalogServiceContract;
    private final StripeApi stripeApi;

    @Autowired
    SubscriptionService(
        @NonNull SubscriptionConfiguration subscriptionConfig,
        @NonNull SubscriptionRepository subscriptionRepository,
        @NonNull TrialStatusRepository trialStatusRepository,
        @NonNull SubscriptionLogRepository subscriptionLogRepository,
        @NonNull CatalogServiceContract catalogServiceContract,
        @NonNull StripeApi stripeApi
    ) {
        this.subscriptionConfig = subscriptionConfig;
        this.subscriptionRepository = subscriptionRepository;
        this.trialStatusRepository = trialStatusRepository;
        this.subscriptionLogRepository = subscriptionLogRepository;
        this.catalogServiceContract = catalogServiceContract;
        this.stripeApi = stripeApi;
    }

    /**
     * <p>
     * Creates a Stripe checkout session for the requested plan and add-on modules. The session
     * carries the organisation, the paying user and the requested items in its metadata, so that
     * the {@code checkout.session.completed} event can create the local subscription.</p>
     *
     * <p>
     * A trial period is offered only if the plan has one and the user has never started a trial
     * before, for any organisation.</p>
     *
     * @param userId id of the paying user.
     * @param params checkout parameters.
     * @return the id and url of the new checkout session.
     * @throws SubscriptionPlanNotFoundException   if the plan doesn't exist or can't be purchased.
     * @throws SubscriptionModuleNotFoundException if a module doesn't exist or can't be purchased.
     * @throws DuplicateSubscriptionException      if the organisation already has a trialing,
     *                                             active or past due subscription.
     * @throws ConstraintViolationException        if a module that can't be purchased more than
     *                                             once is requested more than once.
     */
    @NonNull
    @ReasonablyTransactional
    CheckoutSessionResponse createCheckoutSession(
        @NonNull String userId,
        @NonNull CheckoutSessionParams params
    ) throws SubscriptionPlanNotFoundException, SubscriptionModuleNotFoundException, DuplicateSubscriptionException {
        val plan = catalogServiceContract.getPlanByKey(params.getPlanKey())
            .filter(CatalogSnapshot.Plan::isPurchasable)
            .orElseThrow(() -> new SubscriptionPlanNotFoundException(
                String.format("plan '%s' is not available for purchase", params.getPlanKey())));

        val moduleKeys = requireNonNullElse(params.getModuleKeys(), List.<String>of());
        final Map<String, Long> moduleQuantities = moduleKeys.stream()
            .collect(Collectors.groupingBy(Function.identity(), LinkedHashMap::new, Collectors.counting()));

        val modules = catalogServiceContract.getModulesByKeys(moduleQuantities.keySet());
        if (modules.size() != moduleQuantities.size()) {
            throw new SubscriptionModuleNotFoundException("one or more requested modules don't exist");
        }

        val quantitiesByPriceId = new LinkedHashMap<String, Long>();
        quantitiesByPriceId.put(plan.getStripePriceId(), 1L);
        for (val module : modules) {
            if (!module.isPurchasable()) {
                throw new SubscriptionModuleNotFoundException(
                    String.format("module '%s' is not available for purchase", module.getKey()));
            }

            val quantity = moduleQuantities.get(module.getKey());
            if (quantity > 1 && !module.isAllowMultiple()) {
                throw new ConstraintViolationException(
                    String.format("module '%s' can't be purchased more than once", module.getKey()), null);
            }

            quantitiesByPriceId.merge(module.getStripePriceId(), quantity, Long::sum);
        }

        val existing = subscriptionRepository.findByOrgId(params.getOrgId()).orElse(null);
        if (existing != null && existing.getStatus().isEntitling()) {
            throw new DuplicateSubscriptionException();
        }

        val isTrialOffered = plan.getTrialDurationDays() > 0 && !hasUsedTrial(userId);
        val stripeCustomerId = Optional.ofNullable(existing)
            .map(Subscription::getStripeCustomerId)
            .orElseGet(() -> createStripeCustomer(params.getOrgId(), userId));

        val metadata = new LinkedHashMap<String, String>();
        metadata.put(SubscriptionStateMachine.METADATA_ORG_ID, params.getOrgId());
        metadata.put(SubscriptionStateMachine.METADATA_USER_ID, userId);
        metadata.put(SubscriptionStateMachine.METADATA_PLAN_KEY, plan.getKey());
        metadata.put(SubscriptionStateMachine.METADATA_MODULE_KEYS, SubscriptionStateMachine.formatModuleKeys(moduleKeys));

        val subscriptionMetadata = new LinkedHashMap<String, String>();
        subscriptionMetadata.put(SubscriptionStateMachine.METADATA_ORG_ID, params.getOrgId());
        subscriptionMetadata.put(SubscriptionStateMachine.METADATA_USER_ID, userId);
        subscriptionMetadata.put(SubscriptionStateMachine.METADATA_PLAN_KEY, plan.getKey());

        final com.stripe.model.checkout.Session session;
        try {
            session = stripeApi.createCheckoutSession(
                requireNonNullElse(params.getSuccessUrl(), subscriptionConfig.getCheckoutSuccessUrl()),
                requireNonNullElse(params.getCancelUrl(), subscriptionConfig.getCheckoutCancelUrl()),
                quantitiesByPriceId,
                subscriptionConfig.getStripeCheckoutSessionExpiry(),
                stripeCustomerId,
                metadata,
                subscriptionMetadata,
                isTrialOffered ? (long) plan.getTrialDurationDays() : null);
        } catch (StripeException e) {
            throw new RuntimeException("failed to create stripe checkout session", e);
        }

        val logMetadata = new LinkedHashMap<String, Object>();
        logMetadata.put("sessionId", session.getId());
        logMetadata.put("planKey", plan.getKey());
        logMetadata.put("moduleKeys", moduleKeys);
        logMetadata.put("isTrialOffered", isTrialOffered);
        appendLog(params.getOrgId(), existing == null ? null : existing.getId(), "checkout_session_created", logMetadata);

        return CheckoutSessionResponse.builder()
            .sessionId(session.getId())
            .url(session.getUrl())
            .isTrialOffered(isTrialOffered)
            .build();
    }

    /**
     * @param orgId id of the organisation.
     * @return the organisation's subscription, including a canceled one.
     * @throws SubscriptionNotFoundException if the organisation never had a subscription.
     */
    @NonNull
    SubscriptionResponse getSubscription(@NonNull String orgId) throws SubscriptionNotFoundException {
        return subscriptionRepository.findByOrgId(orgId)
            .map(SubscriptionService::buildSubscriptionResponse)
            .orElseThrow(SubscriptionNotFoundException::new);
    }

    /**
     * Requests Stripe to cancel the organisation's subscription at the end of the current billing
     * cycle. The subscription stays entitling until Stripe deletes it.
     *
     * @param userId id of the user that requests the cancellation.
     * @param orgId  id of the organisation.
     * @throws SubscriptionNotFoundException if the organisation has no trialing, active or past
     *                                       due subscription.
     */
    @ReasonablyTransactional
    void cancelSubscription(@NonNull String userId, @NonNull String orgId) throws SubscriptionNotFoundException {
        val subscription = subscriptionRepository.findByOrgIdForUpdate(orgId)
            .filter(s -> s.getStatus().isEntitling())
            .orElseThrow(SubscriptionNotFoundException::new);

        if (subscription.getStripeSubscriptionId() == null) {
            throw new SubscriptionNotFoundException();
        }

        try {
            stripeApi.cancelSubscription(subscription.getStripeSubscriptionId());
        } catch (StripeException e) {
            throw new RuntimeException("stripe api error", e);
        }

        subscription.setCancelAtPeriodEnd(true);
        subscriptionRepository.save(subscription);

        val logMetadata = new LinkedHashMap<String, Object>();
        logMetadata.put("userId", userId);
        logMetadata.put("stripeSubscriptionId", subscription.getStripeSubscriptionId());
        appendLog(orgId, subscription.getId(), "cancel_requested", logMetadata);
        log.info("org {} requested subscription cancellation", orgId);
    }

    /**
     * Creates a new Stripe billing portal session for the organisation's Stripe customer.
     *
     * @param userId    id of the user that accesses the portal.
     * @param orgId     id of the organisation.
     * @param returnUrl a not {@literal null} redirect url for exiting the billing portal.
     * @return a not {@literal null} {@link StripeCustomerPortalUrlResponse}.
     * @throws StripeCustomerPortalUrlException if the organisation isn't linked to a Stripe
     *                                          customer.
     */
    @NonNull
    @ReasonablyTransactional
    StripeCustomerPortalUrlResponse createBillingPortalSession(
        @NonNull String userId,
        @NonNull String orgId,
        @NonNull String returnUrl
    ) throws StripeCustomerPortalUrlException {
        val subscription = subscriptionRepository.findByOrgId(orgId)
            .filter(s -> s.getStripeCustomerId() != null)
            .orElseThrow(StripeCustomerPortalUrlException::new);

        final com.stripe.model.billingportal.Session session;
        try {
            session = stripeApi.createCustomerPortalSession(subscription.getStripeCustomerId(), returnUrl);
        } catch (StripeException e) {
            throw new RuntimeException("failed to create stripe billing portal session", e);
        }

        val logMetadata = new LinkedHashMap<String, Object>();
        logMetadata.put("userId", userId);
        appendLog(orgId, subscription.getId(), "billing_portal_accessed", logMetadata);
        return StripeCustomerPortalUrlResponse.builder()
            .url(session.getUrl())
            .build();
    }

    @NonNull
    @Override
    @Transactional(readOnly = true)
    public Optional<OrgSubscription> findOrgSubscription(@NonNull String orgId) {
        return subscriptionRepository.findByOrgId(orgId)
            .map(s -> OrgSubscription.builder()
                .orgId(s.getOrgId())
                .status(s.getStatus().getValue())
                .items(s.getItems())
                .build());
    }

    @Override
    @Cacheable(cacheNames = SubscriptionBeans.CACHE_NAME, key = "'isSubscribed:' + #orgId")
    public boolean isOrgSubscribed(@NonNull String orgId) {
        return subscriptionRepository.existsEntitlingByOrgId(orgId);
    }

    private boolean hasUsedTrial(@NonNull String userId) {
        return trialStatusRepository.findById(userId)
            .map(TrialStatus::isHasUsedTrial)
            .orElse(false);
    }

    @NonNull
    private String createStripeCustomer(@NonNull String orgId, @NonNull String userId) {
        try {
            return stripeApi.createCustomer(Map.of(
                    SubscriptionStateMachine.METADATA_ORG_ID, orgId,
                    SubscriptionStateMachine.METADATA_USER_ID, userId))
                .getId();
        } catch (StripeException e) {
            throw new RuntimeException("failed to create stripe customer", e);
        }
    }

    private void appendLog(@NonNull String orgId, Long subscriptionId, @NonNull String action, @NonNull Map<String, Object> metadata) {
        subscriptionLogRepository.save(SubscriptionLog.builder()
            .orgId(orgId)
            .subscriptionId(subscriptionId)
            .action(action)
            .metadata(metadata)
            .build());
    }

    @NonNull
    private static SubscriptionResponse buildSubscriptionResponse(@NonNull Subscription subscription) {
        return SubscriptionResponse.builder()
            .orgId(subscription.getOrgId())
            .status(subscription.getStatus().getValue())
            .planKey(subscription.findPlanKey().orElse(null))
            .items(subscription.getItems())
            .cancelAtPeriodEnd(subscription.isCancelAtPeriodEnd())
            .billingCycleAnchor(subscription.getBillingCycleAnchor())
            .currentPeriodEnd(subscription.getCurrentPeriodEnd())
            .canceledAt(subscription.getCanceledAt())
            .createdAt(subscription.getCreatedAt())
            .build();
    }
}
