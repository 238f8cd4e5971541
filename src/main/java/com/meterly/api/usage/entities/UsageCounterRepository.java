package com.meterly.api.usage.entities;

import lombok.NonNull;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * A JPA {@link Repository} declaration for database interactions of {@link UsageCounter} entity.
 */
@Repository
public interface UsageCounterRepository extends CrudRepository<UsageCounter, Long> {

    /**
     * Atomically increments the counter of a window, creating it if it doesn't exist yet.
     *
     * @param windowKind name of a {@link UsageWindow}.
     * @return the counter value after the increment.
     */
    @Transactional
    @Query(
        value = "insert into usage_counter (org_id, service_key, window_kind, window_start, count, updated_at) " +
            "values (:orgId, :serviceKey, :windowKind, :windowStart, 1, :now) " +
            "on conflict (org_id, service_key, window_kind, window_start) " +
            "do update set count = usage_counter.count + 1, updated_at = :now " +
            "returning count",
        nativeQuery = true)
    long increment(
        @NonNull @Param("orgId") String orgId,
        @NonNull @Param("serviceKey") String serviceKey,
        @NonNull @Param("windowKind") String windowKind,
        @NonNull @Param("windowStart") OffsetDateTime windowStart,
        @NonNull @Param("now") OffsetDateTime now);

    /**
     * Find counters of an organisation's windows that started at the given time.
     */
    @NonNull
    @Transactional(readOnly = true)
    @Query("select e from UsageCounter e where e.orgId = ?1 and e.windowKind = ?2 and e.windowStart = ?3")
    List<UsageCounter> findAllByWindow(@NonNull String orgId, @NonNull UsageWindow windowKind, @NonNull OffsetDateTime windowStart);

    /**
     * Deletes counters of the given window kind whose windows started before the given time.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("delete from UsageCounter e where e.windowKind = ?1 and e.windowStart < ?2")
    int deleteAllByWindowKindStartedBefore(@NonNull UsageWindow windowKind, @NonNull OffsetDateTime startedBefore);
}
