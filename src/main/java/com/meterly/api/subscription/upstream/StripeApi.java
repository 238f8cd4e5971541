package com.meterly.api.subscription.upstream;

import com.stripe.Stripe;
import com.stripe.StripeClient;
import com.stripe.exception.SignatureVerificationException;
import com.stripe.exception.StripeException;
import com.stripe.model.Customer;
import com.stripe.model.Event;
import com.stripe.model.Invoice;
import com.stripe.model.Subscription;
import com.stripe.model.checkout.Session;
import com.stripe.param.CustomerCreateParams;
import com.stripe.param.RefundCreateParams;
import com.stripe.param.SubscriptionRetrieveParams;
import com.stripe.param.SubscriptionUpdateParams;
import com.stripe.param.checkout.SessionCreateParams;
import lombok.NonNull;
import lombok.val;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNullElse;

/**
 * A thin wrapper around {@link Stripe} api to enable easy mocking.
 */
public class StripeApi {

    private final StripeClient client;

    public StripeApi(@NonNull String apiKey) {
        client = new StripeClient(apiKey);
    }

    /**
     * Creates a Stripe customer that pays for an organisation's subscription.
     *
     * @param metadata ids that link the customer to the organisation and the paying user.
     * @return the new customer.
     * @throws StripeException on api call error
     */
    @NonNull
    public Customer createCustomer(@NonNull Map<String, String> metadata) throws StripeException {
        return client.customers().create(
            CustomerCreateParams.builder()
                .putAllMetadata(metadata)
                .build());
    }

    /**
     * Creates a Stripe checkout session in {@link SessionCreateParams.Mode#SUBSCRIPTION
     * subscription} mode with one line item per price.
     *
     * @param successUrl           url where user will be redirected after a successful checkout.
     * @param cancelUrl            url where user will be redirected on cancelling the checkout.
     * @param quantitiesByPriceId  line items of the subscription, keyed by Stripe price id.
     * @param expireAfter          duration in range 30 minutes and 24 hours after which the
     *                             checkout session expires.
     * @param stripeCustomerId     customer id assigned by Stripe to the payer.
     * @param metadata             metadata attached to the checkout session. It is echoed back in
     *                             the {@code checkout.session.completed} event.
     * @param subscriptionMetadata metadata attached to the subscription created by the checkout.
     * @param trialPeriodDays      the number of days for offering a trial period on the new
     *                             subscription. If it is {@literal null}, no trial period is
     *                             offered. If it is not {@literal null}, it has to be at least 1.
     * @return a new checkout session
     * @throws StripeException on api call error
     */
    @NonNull
    public Session createCheckoutSession(
        @NonNull String successUrl,
        @NonNull String cancelUrl,
        @NonNull Map<String, Long> quantitiesByPriceId,
        @NonNull Duration expireAfter,
        @NonNull String stripeCustomerId,
        @NonNull Map<String, String> metadata,
        @NonNull Map<String, String> subscriptionMetadata,
        Long trialPeriodDays
    ) throws StripeException {
        val subscriptionData = SessionCreateParams.SubscriptionData.builder()
            .putAllMetadata(subscriptionMetadata);

        if (trialPeriodDays != null) {
            subscriptionData.setTrialPeriodDays(trialPeriodDays);
        }

        val params = new SessionCreateParams.Builder()
            .setSuccessUrl(successUrl)
            .setCancelUrl(cancelUrl)
            .setMode(SessionCreateParams.Mode.SUBSCRIPTION)
            .setExpiresAt(OffsetDateTime.now().plus(expireAfter).toEpochSecond())
            .setCustomer(stripeCustomerId)
            .putAllMetadata(metadata)
            .setSubscriptionData(subscriptionData.build());

        quantitiesByPriceId.forEach((priceId, quantity) -> params.addLineItem(
            new SessionCreateParams.LineItem.Builder()
                .setPrice(priceId)
                .setQuantity(quantity)
                .build()));

        return client.checkout().sessions().create(params.build());
    }

    /**
     * @see StripeClient#constructEvent(String, String, String)
     */
    @NonNull
    public Event decodeWebhookPayload(
        @NonNull String payload,
        @NonNull String signature,
        @NonNull String secret
    ) throws SignatureVerificationException {
        return client.constructEvent(payload, signature, secret);
    }

    /**
     * Retrieves a subscription with the prices of its items expanded.
     *
     * @see com.stripe.service.SubscriptionService#retrieve(String, SubscriptionRetrieveParams,
     * com.stripe.net.RequestOptions)
     */
    @NonNull
    public Subscription getSubscription(@NonNull String id) throws StripeException {
        return client.subscriptions().retrieve(
            id,
            SubscriptionRetrieveParams.builder()
                .addExpand("items.data.price")
                .build(),
            null);
    }

    /**
     * Marks an uncancelled subscription to be cancelled at the end of the current billing cycle.
     *
     * @param id id of the subscription to cancel.
     * @throws StripeException on Stripe API errors.
     * @see com.stripe.service.SubscriptionService#update(String, SubscriptionUpdateParams)
     */
    public void cancelSubscription(@NonNull String id) throws StripeException {
        val subscription = client.subscriptions().retrieve(id);
        if ("canceled".equals(subscription.getStatus())) {
            return;
        }

        if (!requireNonNullElse(subscription.getCancelAtPeriodEnd(), false)) {
            client.subscriptions()
                .update(
                    id,
                    SubscriptionUpdateParams.builder()
                        .setCancelAtPeriodEnd(true)
                        .build());
        }
    }

    /**
     * Immediately cancel a subscription and refund its payment. It is safe to call it again for
     * a subscription that was already refunded.
     *
     * @param id id of the stripe subscription.
     * @throws StripeException on Stripe API errors.
     */
    public void refundSubscription(@NonNull String id) throws StripeException {
        val subscription = client.subscriptions().retrieve(
            id,
            SubscriptionRetrieveParams.builder()
                .addExpand("latest_invoice")
                .build(),
            null);

        // charge may be null if the latest invoice is for a trial period.
        val charge = Optional.ofNullable(subscription.getLatestInvoiceObject())
            .map(Invoice::getCharge)
            .orElse(null);

        if (charge != null) {
            try {
                client.refunds().create(
                    RefundCreateParams.builder()
                        .setCharge(charge)
                        .build());
            } catch (StripeException e) {
                if (!"charge_already_refunded".equals(e.getCode())) {
                    throw e;
                }
            }
        }

        if (!"canceled".equals(subscription.getStatus())) {
            client.subscriptions().cancel(id);
        }
    }

    /**
     * @see com.stripe.service.billingportal.SessionService#create(com.stripe.param.billingportal.SessionCreateParams)
     */
    @NonNull
    public com.stripe.model.billingportal.Session createCustomerPortalSession(
        @NonNull String customerId,
        String returnUrl
    ) throws StripeException {
        return client.billingPortal().sessions().create(
            com.stripe.param.billingportal.SessionCreateParams.builder()
                .setCustomer(customerId)
                .setReturnUrl(returnUrl)
                .build());
    }
}
