package com.meterly.api.subscription.entities;

import com.fasterxml.jackson.core.type.TypeReference;
import com.meterly.api.contracts.SubscriptionItem;
import com.meterly.api.platform.persistence.JsonTextConverter;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

/**
 * Stores the ordered items of a subscription as a JSON array of tagged objects.
 */
@Converter
public class SubscriptionItemsConverter extends JsonTextConverter<List<SubscriptionItem>> {

    public SubscriptionItemsConverter() {
        super(new TypeReference<List<SubscriptionItem>>() {
        });
    }

    @Override
    protected List<SubscriptionItem> emptyValue() {
        return new ArrayList<>();
    }
}
