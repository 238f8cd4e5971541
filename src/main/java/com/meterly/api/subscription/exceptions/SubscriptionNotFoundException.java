package com.meterly.api.subscription.exceptions;

/**
 * Thrown by operations in SubscriptionService when the organisation has no matching subscription.
 */
public class SubscriptionNotFoundException extends Exception {
}
