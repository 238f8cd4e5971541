package com.meterly.api.subscription;

import lombok.NonNull;
import lombok.Value;

/**
 * Outcome of a single delivery of a Stripe webhook event.
 */
@Value
public class ProcessResult {

    boolean success;

    @NonNull
    String eventId;

    @NonNull
    String eventType;

    @NonNull
    Outcome outcome;

    String message;

    @NonNull
    static ProcessResult processed(@NonNull String eventId, @NonNull String eventType) {
        return new ProcessResult(true, eventId, eventType, Outcome.PROCESSED, null);
    }

    @NonNull
    static ProcessResult ignored(@NonNull String eventId, @NonNull String eventType) {
        return new ProcessResult(true, eventId, eventType, Outcome.IGNORED, "unsupported event type");
    }

    @NonNull
    static ProcessResult duplicate(@NonNull String eventId, @NonNull String eventType) {
        return new ProcessResult(true, eventId, eventType, Outcome.DUPLICATE, "event already handled");
    }

    @NonNull
    static ProcessResult inProgress(@NonNull String eventId, @NonNull String eventType) {
        return new ProcessResult(false, eventId, eventType, Outcome.IN_PROGRESS, "event is being processed by another delivery");
    }

    public enum Outcome {
        /**
         * The event was applied by this delivery.
         */
        PROCESSED,

        /**
         * The event type has no handler. It was recorded, but nothing was applied.
         */
        IGNORED,

        /**
         * An earlier delivery already processed the event, or failed it terminally.
         */
        DUPLICATE,

        /**
         * Another delivery currently owns the event. Stripe should redeliver it later.
         */
        IN_PROGRESS,
    }
}
