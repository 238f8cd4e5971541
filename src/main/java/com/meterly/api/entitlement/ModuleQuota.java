package com.meterly.api.entitlement;

import com.fasterxml.jackson.annotation.JsonValue;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * The number of units of a module an organisation may use, derived from its subscription.
 */
@Value
@Builder(toBuilder = true)
@Schema(name = "ModuleQuota")
public class ModuleQuota {

    @Schema(required = true, description = "key of the module")
    @NonNull
    String moduleKey;

    @Schema(required = true, description = "units of the module the organisation may use")
    int purchasedCount;

    @Schema(required = true, description = "whether the module can be used more than once")
    boolean allowMultiple;

    @Schema(required = true, description = "'plan_included' when the plan grants all units, 'addon' when any unit was bought separately")
    @NonNull
    Source source;

    public enum Source {
        PLAN_INCLUDED,
        ADDON;

        @JsonValue
        public String toJson() {
            return name().toLowerCase();
        }
    }
}
