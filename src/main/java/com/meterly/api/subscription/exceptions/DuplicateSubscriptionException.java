package com.meterly.api.subscription.exceptions;

/**
 * Thrown by createCheckoutSession operation in SubscriptionService if the organisation already has
 * a trialing, active or past due subscription.
 */
public class DuplicateSubscriptionException extends Exception {
}
