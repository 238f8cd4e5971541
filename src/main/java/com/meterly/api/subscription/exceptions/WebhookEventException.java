package com.meterly.api.subscription.exceptions;

/**
 * Thrown by webhook event handlers when a well-formed event could not be applied, e.g. because
 * Stripe was unreachable or a concurrent write won. Redeliveries of the event are applied again.
 */
public class WebhookEventException extends Exception {

    public WebhookEventException(String message) {
        super(message);
    }

    public WebhookEventException(String message, Throwable cause) {
        super(message, cause);
    }
}
