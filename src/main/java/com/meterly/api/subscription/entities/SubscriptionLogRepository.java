package com.meterly.api.subscription.entities;

import lombok.NonNull;
import org.springframework.data.repository.CrudRepository;
import org.springframework.stereotype.Repository;

/**
 * An append-only JPA {@link Repository} declaration for {@link SubscriptionLog} entities.
 */
@Repository
public interface SubscriptionLogRepository extends CrudRepository<SubscriptionLog, Long> {

    @Override
    default void deleteById(@NonNull Long id) {
        throw new UnsupportedOperationException("subscription logs are append-only");
    }

    @Override
    default void delete(@NonNull SubscriptionLog entity) {
        throw new UnsupportedOperationException("subscription logs are append-only");
    }

    @Override
    default void deleteAllById(@NonNull Iterable<? extends Long> ids) {
        throw new UnsupportedOperationException("subscription logs are append-only");
    }

    @Override
    default void deleteAll(@NonNull Iterable<? extends SubscriptionLog> entities) {
        throw new UnsupportedOperationException("subscription logs are append-only");
    }

    @Override
    default void deleteAll() {
        throw new UnsupportedOperationException("subscription logs are append-only");
    }
}
