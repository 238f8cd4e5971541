package com.meterly.api.subscription.entities;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;

import java.time.OffsetDateTime;

/**
 * A data access object that maps to the {@code webhook_event} table in the database. A row is
 * written for every Stripe event id before the event is applied, and its unique
 * {@link #stripeEventId} guards against applying an event twice.
 */
@Entity
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private long id;

    @NonNull
    @Column(updatable = false)
    private String stripeEventId;

    @NonNull
    @Column(updatable = false)
    private String eventType;

    @Column(columnDefinition = "text", updatable = false)
    private String payload;

    @NonNull
    @Enumerated(EnumType.STRING)
    private Status status;

    /**
     * Whether a failed event may be applied again when Stripe redelivers it.
     */
    private boolean isRetryable;

    private String error;

    @Builder.Default
    private int attemptCount = 1;

    @NonNull
    @Column(updatable = false)
    @Builder.Default
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @NonNull
    @Builder.Default
    private OffsetDateTime updatedAt = OffsetDateTime.now();

    private OffsetDateTime processedAt;

    public enum Status {
        /**
         * Recorded, but not claimed by any delivery. Stale claims are moved back to this state.
         */
        RECEIVED,
        PROCESSING,
        PROCESSED,
        FAILED,
    }
}
