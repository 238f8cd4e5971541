package com.meterly.api.subscription.entities;

import com.fasterxml.jackson.core.type.TypeReference;
import com.meterly.api.platform.persistence.JsonTextConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Converter;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A data access object that maps to the append-only {@code subscription_log} table in the
 * database.
 */
@Entity
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubscriptionLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private long id;

    @NonNull
    @Column(updatable = false)
    @Builder.Default
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @NonNull
    @Column(updatable = false)
    private String orgId;

    /**
     * {@literal null} for actions that happen before a subscription exists, e.g. checkout
     * creation.
     */
    @Column(updatable = false)
    private Long subscriptionId;

    @NonNull
    @Column(updatable = false)
    private String action;

    @NonNull
    @Builder.Default
    @Column(columnDefinition = "text", updatable = false)
    @Convert(converter = MetadataConverter.class)
    private Map<String, Object> metadata = new LinkedHashMap<>();

    @Converter
    public static class MetadataConverter extends JsonTextConverter<Map<String, Object>> {

        public MetadataConverter() {
            super(new TypeReference<Map<String, Object>>() {
            });
        }

        @Override
        protected Map<String, Object> emptyValue() {
            return new LinkedHashMap<>();
        }
    }
}
