package com.meterly.api.subscription.exceptions;

/**
 * Thrown by createBillingPortalSession operation in SubscriptionService if the organisation isn't
 * linked to a Stripe customer.
 */
public class StripeCustomerPortalUrlException extends Exception {
}
