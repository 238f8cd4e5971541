package com.meterly.api.usage.entities;

import lombok.NonNull;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * A JPA {@link Repository} declaration for database interactions of {@link
 * ConcurrentRequestLease} entity.
 */
@Repository
public interface ConcurrentRequestLeaseRepository extends CrudRepository<ConcurrentRequestLease, UUID> {

    /**
     * Counts leases of an organisation's service that haven't expired at {@code now}.
     */
    @Transactional(readOnly = true)
    @Query("select count(e) from ConcurrentRequestLease e where e.orgId = ?1 and e.serviceKey = ?2 and e.expiresAt > ?3")
    long countActive(@NonNull String orgId, @NonNull String serviceKey, @NonNull OffsetDateTime now);

    /**
     * @return expiry of the lease that expires first among the unexpired leases.
     */
    @NonNull
    @Transactional(readOnly = true)
    @Query("select min(e.expiresAt) from ConcurrentRequestLease e where e.orgId = ?1 and e.serviceKey = ?2 and e.expiresAt > ?3")
    Optional<OffsetDateTime> findEarliestExpiry(@NonNull String orgId, @NonNull String serviceKey, @NonNull OffsetDateTime now);

    @NonNull
    @Transactional(readOnly = true)
    @Query("select e from ConcurrentRequestLease e where e.orgId = ?1 and e.expiresAt > ?2")
    List<ConcurrentRequestLease> findAllActiveByOrgId(@NonNull String orgId, @NonNull OffsetDateTime now);

    /**
     * Deletes a lease if it belongs to the given organisation and service.
     *
     * @return the number of deleted leases, {@literal 0} if it was already released or expired.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("delete from ConcurrentRequestLease e where e.id = ?1 and e.orgId = ?2 and e.serviceKey = ?3")
    int deleteOwned(@NonNull UUID id, @NonNull String orgId, @NonNull String serviceKey);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("delete from ConcurrentRequestLease e where e.expiresAt < ?1")
    int deleteAllExpiredBefore(@NonNull OffsetDateTime before);
}
