package com.meterly.api.subscription.entities;

import com.fasterxml.jackson.core.type.TypeReference;
import com.meterly.api.platform.persistence.JsonTextConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Converter;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Version;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;

import java.time.OffsetDateTime;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A data access object that maps to the {@code trial_status} table in the database. It remembers
 * whether a payer has ever started a trial, across all of their organisations.
 */
@Entity
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrialStatus {

    @Id
    @NonNull
    private String payerId;

    @Version
    private long version;

    private boolean hasUsedTrial;

    private OffsetDateTime trialActivatedAt;

    @NonNull
    @Builder.Default
    @Column(columnDefinition = "text")
    @Convert(converter = OrgIdsConverter.class)
    private Set<String> initialTrialOrgIds = new LinkedHashSet<>();

    /**
     * Records a trial started by the payer for the given organisation. Once a trial is recorded,
     * {@link #hasUsedTrial} stays {@literal true}.
     */
    public void recordTrial(@NonNull String orgId) {
        if (!hasUsedTrial) {
            hasUsedTrial = true;
            trialActivatedAt = OffsetDateTime.now();
        }

        initialTrialOrgIds.add(orgId);
    }

    @Converter
    public static class OrgIdsConverter extends JsonTextConverter<Set<String>> {

        public OrgIdsConverter() {
            super(new TypeReference<Set<String>>() {
            });
        }

        @Override
        protected Set<String> emptyValue() {
            return new LinkedHashSet<>();
        }
    }
}
