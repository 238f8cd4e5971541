package com.meterly.api.subscription.entities;

import com.meterly.api.contracts.SubscriptionItem;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Version;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A data access object that maps to the {@code subscription} table in the database. Each
 * organisation owns at most one row.
 */
@Entity
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Subscription {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private long id;

    @NonNull
    @Column(updatable = false)
    @Builder.Default
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @NonNull
    @Builder.Default
    private OffsetDateTime updatedAt = OffsetDateTime.now();

    @Version
    private long version;

    @NonNull
    @Column(updatable = false)
    private String orgId;

    @NonNull
    @Enumerated(EnumType.STRING)
    private SubscriptionStatus status;

    /**
     * Id of the user that paid for the subscription.
     */
    private String payerId;

    private String stripeSubscriptionId;

    private String stripeCustomerId;

    private boolean cancelAtPeriodEnd;

    private OffsetDateTime billingCycleAnchor, currentPeriodEnd, canceledAt;

    @NonNull
    @Builder.Default
    @Column(columnDefinition = "text")
    @Convert(converter = SubscriptionItemsConverter.class)
    private List<SubscriptionItem> items = new ArrayList<>();

    @PreUpdate
    void touch() {
        this.updatedAt = OffsetDateTime.now();
    }

    /**
     * Helper to set {@link Subscription#billingCycleAnchor} using Epoch seconds.
     */
    public void setBillingCycleAnchorSeconds(Long seconds) {
        this.billingCycleAnchor = fromEpochSeconds(seconds);
    }

    /**
     * Helper to set {@link Subscription#currentPeriodEnd} using Epoch seconds.
     */
    public void setCurrentPeriodEndSeconds(Long seconds) {
        this.currentPeriodEnd = fromEpochSeconds(seconds);
    }

    /**
     * Helper to set {@link Subscription#canceledAt} using Epoch seconds.
     */
    public void setCanceledAtSeconds(Long seconds) {
        this.canceledAt = fromEpochSeconds(seconds);
    }

    /**
     * @return the key of the subscribed plan, if the subscription has a plan item.
     */
    @NonNull
    public Optional<String> findPlanKey() {
        return items.stream()
            .filter(i -> i.getType() == SubscriptionItem.Type.PLAN)
            .map(SubscriptionItem::getKey)
            .findFirst();
    }

    private static OffsetDateTime fromEpochSeconds(Long seconds) {
        return seconds == null ? null : OffsetDateTime.ofInstant(Instant.ofEpochSecond(seconds), ZoneId.systemDefault());
    }
}
