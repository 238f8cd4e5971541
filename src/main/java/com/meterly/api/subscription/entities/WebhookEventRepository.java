package com.meterly.api.subscription.entities;

import lombok.NonNull;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.Optional;

import static com.meterly.api.subscription.entities.WebhookEvent.Status.FAILED;
import static com.meterly.api.subscription.entities.WebhookEvent.Status.PROCESSED;
import static com.meterly.api.subscription.entities.WebhookEvent.Status.PROCESSING;
import static com.meterly.api.subscription.entities.WebhookEvent.Status.RECEIVED;

/**
 * A JPA {@link Repository} declaration for database interactions of {@link WebhookEvent} entity.
 * Status changes use conditional updates, so two deliveries of the same event can never both
 * claim it.
 */
@Repository
public interface WebhookEventRepository extends CrudRepository<WebhookEvent, Long> {

    @NonNull
    @Transactional(readOnly = true)
    @Query("select e from WebhookEvent e where e.stripeEventId = ?1")
    Optional<WebhookEvent> findByStripeEventId(@NonNull String stripeEventId);

    /**
     * Moves an event to {@link WebhookEvent.Status#PROCESSING} if it is still in the observed
     * {@code status} with the observed {@code attemptCount}.
     *
     * @return the number of updated rows, {@literal 0} if another delivery claimed it first.
     */
    default int claim(long id, @NonNull WebhookEvent.Status status, int attemptCount, @NonNull OffsetDateTime now) {
        return updateStatusIfUnchanged(id, status, attemptCount, PROCESSING, now);
    }

    default void markProcessed(long id, @NonNull OffsetDateTime now) {
        updateOutcome(id, PROCESSED, false, null, now);
    }

    default void markFailed(long id, boolean isRetryable, String error, @NonNull OffsetDateTime now) {
        updateOutcome(id, FAILED, isRetryable, error, now);
    }

    /**
     * Releases claims of deliveries that crashed or timed out before recording an outcome.
     *
     * @param claimedBefore events claimed before this timestamp are released.
     * @return the number of released events.
     */
    default int releaseStaleClaims(@NonNull OffsetDateTime claimedBefore) {
        return updateStatusClaimedBefore(PROCESSING, RECEIVED, claimedBefore);
    }

    @NonNull
    default Page<WebhookEvent> findAllFailed(@NonNull Pageable pageable) {
        return findAllByStatus(FAILED, pageable);
    }

    /**
     * Deletes processed events that were processed before the given timestamp.
     */
    default int deleteAllProcessedBefore(@NonNull OffsetDateTime processedBefore) {
        return deleteAllByStatusProcessedBefore(PROCESSED, processedBefore);
    }

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("update WebhookEvent e set e.status = ?4, e.attemptCount = e.attemptCount + 1, e.error = null, e.updatedAt = ?5 " +
        "where e.id = ?1 and e.status = ?2 and e.attemptCount = ?3")
    int updateStatusIfUnchanged(
        long id,
        @NonNull WebhookEvent.Status expectedStatus,
        int expectedAttemptCount,
        @NonNull WebhookEvent.Status newStatus,
        @NonNull OffsetDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("update WebhookEvent e set e.status = ?2, e.isRetryable = ?3, e.error = ?4, e.processedAt = ?5, e.updatedAt = ?5 " +
        "where e.id = ?1")
    void updateOutcome(long id, @NonNull WebhookEvent.Status status, boolean isRetryable, String error, @NonNull OffsetDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("update WebhookEvent e set e.status = ?2 where e.status = ?1 and e.updatedAt < ?3")
    int updateStatusClaimedBefore(
        @NonNull WebhookEvent.Status status,
        @NonNull WebhookEvent.Status newStatus,
        @NonNull OffsetDateTime claimedBefore);

    @NonNull
    @Transactional(readOnly = true)
    @Query("select e from WebhookEvent e where e.status = ?1")
    Page<WebhookEvent> findAllByStatus(@NonNull WebhookEvent.Status status, @NonNull Pageable pageable);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("delete from WebhookEvent e where e.status = ?1 and e.processedAt < ?2")
    int deleteAllByStatusProcessedBefore(@NonNull WebhookEvent.Status status, @NonNull OffsetDateTime processedBefore);
}
