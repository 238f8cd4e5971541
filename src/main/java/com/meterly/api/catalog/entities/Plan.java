package com.meterly.api.catalog.entities;

import com.meterly.api.contracts.CatalogSnapshot;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.List;

/**
 * A data access object that maps to the {@code plan} table in the database. Plans are managed by
 * the catalog admin service; this service only reads them.
 */
@Entity
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Plan {

    @Id
    @NonNull
    private String key;

    @NonNull
    private String name;

    private String stripePriceId;

    @NonNull
    @Enumerated(EnumType.STRING)
    private CatalogSnapshot.Status status;

    private int trialDurationDays;

    private String usageTier;

    @NonNull
    @Builder.Default
    @Column(columnDefinition = "text")
    @Convert(converter = IncludedModulesConverter.class)
    private List<CatalogSnapshot.IncludedModule> includedModules = new ArrayList<>();

    @NonNull
    public CatalogSnapshot.Plan toSnapshot() {
        return CatalogSnapshot.Plan.builder()
            .key(key)
            .name(name)
            .stripePriceId(stripePriceId)
            .status(status)
            .trialDurationDays(trialDurationDays)
            .usageTier(usageTier)
            .includedModules(List.copyOf(includedModules))
            .build();
    }
}
