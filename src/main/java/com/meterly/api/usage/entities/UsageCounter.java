package com.meterly.api.usage.entities;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;

import java.time.OffsetDateTime;

/**
 * A data access object that maps to the {@code usage_counter} table in the database. There is one
 * row per organisation, service and window. Rows are only written through {@link
 * UsageCounterRepository#increment(String, String, String, OffsetDateTime, OffsetDateTime)}.
 */
@Entity
@Table(uniqueConstraints = @UniqueConstraint(columnNames = {"org_id", "service_key", "window_kind", "window_start"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UsageCounter {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private long id;

    @NonNull
    @Column(updatable = false)
    private String orgId;

    @NonNull
    @Column(updatable = false)
    private String serviceKey;

    @NonNull
    @Enumerated(EnumType.STRING)
    @Column(updatable = false)
    private UsageWindow windowKind;

    @NonNull
    @Column(updatable = false)
    private OffsetDateTime windowStart;

    private long count;

    @NonNull
    @Builder.Default
    private OffsetDateTime updatedAt = OffsetDateTime.now();
}
