package com.meterly.api.subscription.exceptions;

/**
 * Thrown by webhook event handlers when the event payload is invalid. Such events are never
 * applied, even if Stripe redelivers them.
 */
public class WebhookPayloadException extends Exception {

    public WebhookPayloadException(String message) {
        super(message);
    }

    public WebhookPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
