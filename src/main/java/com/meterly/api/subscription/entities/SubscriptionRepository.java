package com.meterly.api.subscription.entities;

import jakarta.persistence.LockModeType;
import lombok.NonNull;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * A JPA {@link Repository} declaration for database interactions of {@link Subscription} entity.
 */
@Repository
public interface SubscriptionRepository extends CrudRepository<Subscription, Long> {

    /**
     * Find the {@link Subscription} entity of an organisation.
     *
     * @param orgId a non-null organisation id.
     * @return an optional {@link Subscription} entity.
     */
    @NonNull
    @Transactional(readOnly = true)
    @Query("select e from Subscription e where e.orgId = ?1")
    Optional<Subscription> findByOrgId(@NonNull String orgId);

    /**
     * Same as {@link #findByOrgId(String)}, but holds a row lock until the surrounding transaction
     * ends. Writers of the same organisation's subscription are thereby serialized.
     *
     * @param orgId a non-null organisation id.
     * @return an optional {@link Subscription} entity.
     */
    @NonNull
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select e from Subscription e where e.orgId = ?1")
    Optional<Subscription> findByOrgIdForUpdate(@NonNull String orgId);

    /**
     * Find a {@link Subscription} entity by its Stripe assigned subscription id and lock it until
     * the surrounding transaction ends.
     *
     * @param stripeSubscriptionId a non-null Stripe subscription id.
     * @return an optional {@link Subscription} entity.
     */
    @NonNull
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select e from Subscription e where e.stripeSubscriptionId = ?1")
    Optional<Subscription> findByStripeSubscriptionIdForUpdate(@NonNull String stripeSubscriptionId);

    /**
     * Checks whether an organisation has a trialing, active or past due subscription.
     *
     * @param orgId a non-null organisation id.
     * @return whether such a subscription exists.
     */
    default boolean existsEntitlingByOrgId(@NonNull String orgId) {
        return existsByOrgIdAndStatusNot(orgId, SubscriptionStatus.CANCELED);
    }

    @Transactional(readOnly = true)
    @Query("select case when count(e) > 0 then true else false end from Subscription e where e.orgId = ?1 and e.status <> ?2")
    boolean existsByOrgIdAndStatusNot(@NonNull String orgId, @NonNull SubscriptionStatus status);
}
