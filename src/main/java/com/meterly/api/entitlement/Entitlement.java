package com.meterly.api.entitlement;

import lombok.NonNull;
import lombok.Value;

import java.util.List;

/**
 * What an organisation's subscription grants: its plan and the resulting module quotas.
 */
@Value
public class Entitlement {

    String planKey;

    @NonNull
    List<ModuleQuota> quotas;

    @NonNull
    public static Entitlement empty() {
        return new Entitlement(null, List.of());
    }
}
