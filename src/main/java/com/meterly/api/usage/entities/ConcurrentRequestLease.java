package com.meterly.api.usage.entities;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * A data access object that maps to the {@code concurrent_request_lease} table in the database.
 * A lease is held for the duration of a metered request. Leases of crashed callers are released
 * once they expire.
 */
@Entity
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConcurrentRequestLease {

    @Id
    @NonNull
    private UUID id;

    @NonNull
    @Column(updatable = false)
    private String orgId;

    @NonNull
    @Column(updatable = false)
    private String serviceKey;

    @NonNull
    @Column(updatable = false)
    private OffsetDateTime startedAt;

    @NonNull
    @Column(updatable = false)
    private OffsetDateTime expiresAt;
}
