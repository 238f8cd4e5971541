package com.meterly.api.catalog.entities;

import lombok.NonNull;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * A read-only JPA {@link Repository} declaration for {@link Plan} entities.
 */
@Repository
public interface PlanRepository extends CrudRepository<Plan, String> {

    @NonNull
    @Override
    default <S extends Plan> S save(@NonNull S entity) {
        throw new UnsupportedOperationException("plan entities doesn't support updates");
    }

    @NonNull
    @Override
    default <S extends Plan> Iterable<S> saveAll(@NonNull Iterable<S> entities) {
        throw new UnsupportedOperationException("plan entities doesn't support updates");
    }

    /**
     * @return all plans, including the inactive and deprecated ones, ordered by their keys.
     */
    @NonNull
    @Transactional(readOnly = true)
    @Query("select e from Plan e order by e.key")
    List<Plan> findAllOrdered();
}
