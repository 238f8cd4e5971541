package com.meterly.api.subscription.exceptions;

/**
 * Thrown by createCheckoutSession operation in SubscriptionService if a requested add-on module
 * doesn't exist, isn't active or isn't available on Stripe.
 */
public class SubscriptionModuleNotFoundException extends Exception {

    public SubscriptionModuleNotFoundException(String message) {
        super(message);
    }
}
