package com.meterly.api.catalog.entities;

import lombok.NonNull;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * A read-only JPA {@link Repository} declaration for {@link CatalogModule} entities.
 */
@Repository
public interface CatalogModuleRepository extends CrudRepository<CatalogModule, String> {

    @NonNull
    @Override
    default <S extends CatalogModule> S save(@NonNull S entity) {
        throw new UnsupportedOperationException("module entities doesn't support updates");
    }

    @NonNull
    @Override
    default <S extends CatalogModule> Iterable<S> saveAll(@NonNull Iterable<S> entities) {
        throw new UnsupportedOperationException("module entities doesn't support updates");
    }

    @NonNull
    @Transactional(readOnly = true)
    @Query("select e from CatalogModule e order by e.key")
    List<CatalogModule> findAllOrdered();
}
