package com.meterly.api.catalog.entities;

import com.meterly.api.contracts.CatalogSnapshot;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;

/**
 * A data access object that maps to the {@code module} table in the database.
 */
@Entity
@Table(name = "module")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CatalogModule {

    @Id
    @NonNull
    private String key;

    @NonNull
    private String name;

    private String stripePriceId;

    @NonNull
    @Enumerated(EnumType.STRING)
    private CatalogSnapshot.Status status;

    private boolean allowMultiple;

    @NonNull
    public CatalogSnapshot.Module toSnapshot() {
        return CatalogSnapshot.Module.builder()
            .key(key)
            .name(name)
            .stripePriceId(stripePriceId)
            .status(status)
            .allowMultiple(allowMultiple)
            .build();
    }
}
