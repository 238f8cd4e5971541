package com.meterly.api.subscription.entities;

import org.springframework.data.repository.CrudRepository;
import org.springframework.stereotype.Repository;

/**
 * A JPA {@link Repository} declaration for database interactions of {@link TrialStatus} entity.
 */
@Repository
public interface TrialStatusRepository extends CrudRepository<TrialStatus, String> {
}
