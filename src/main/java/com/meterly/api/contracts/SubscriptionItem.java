package com.meterly.api.contracts;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.NonNull;
import lombok.Value;

/**
 * A line of a subscription: either the single plan the organisation pays for, or an add-on
 * module. Items are validated on construction, including when they are decoded from JSON.
 */
@Value
public class SubscriptionItem {

    @NonNull
    Type type;

    @NonNull
    String key;

    @NonNull
    String name;

    String stripePriceId;

    int quantity;

    @JsonCreator
    public SubscriptionItem(
        @JsonProperty("type") Type type,
        @JsonProperty("key") String key,
        @JsonProperty("name") String name,
        @JsonProperty("stripePriceId") String stripePriceId,
        @JsonProperty("quantity") int quantity
    ) {
        if (type == null) {
            throw new IllegalArgumentException("subscription item type is required");
        }

        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("subscription item key is required");
        }

        if (quantity < 1) {
            throw new IllegalArgumentException("subscription item quantity must be positive: " + quantity);
        }

        this.type = type;
        this.key = key;
        this.name = name == null ? key : name;
        this.stripePriceId = stripePriceId;
        this.quantity = quantity;
    }

    @NonNull
    public static SubscriptionItem plan(@NonNull String key, @NonNull String name, String stripePriceId) {
        return new SubscriptionItem(Type.PLAN, key, name, stripePriceId, 1);
    }

    @NonNull
    public static SubscriptionItem module(@NonNull String key, @NonNull String name, String stripePriceId, int quantity) {
        return new SubscriptionItem(Type.MODULE, key, name, stripePriceId, quantity);
    }

    public enum Type {
        PLAN,
        MODULE,
    }
}
