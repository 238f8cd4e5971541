package com.meterly.api.subscription.exceptions;

/**
 * Thrown by createCheckoutSession operation in SubscriptionService if the requested plan doesn't
 * exist, isn't active or isn't available on Stripe.
 */
public class SubscriptionPlanNotFoundException extends Exception {

    public SubscriptionPlanNotFoundException(String message) {
        super(message);
    }
}
