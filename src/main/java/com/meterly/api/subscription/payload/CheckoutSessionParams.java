package com.meterly.api.subscription.payload;

import com.meterly.api.platform.validation.annotations.HttpUrl;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A data transfer object to hold the body of create-checkout-session requests.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CheckoutSessionParams {

    @Schema(requiredMode = Schema.RequiredMode.REQUIRED, description = "id of the organisation that subscribes")
    @NotBlank
    @Size(max = 64)
    private String orgId;

    @Schema(requiredMode = Schema.RequiredMode.REQUIRED, description = "key of the selected plan")
    @NotBlank
    private String planKey;

    @Schema(description = "keys of the selected add-on modules. a key that repeats is purchased as many times.")
    @NotNull
    private List<@NotBlank String> moduleKeys = new ArrayList<>();

    @Schema(description = "redirect url when the user completes the checkout session. defaults to the configured url.")
    @HttpUrl
    private String successUrl;

    @Schema(description = "redirect url when the user cancels the checkout session. defaults to the configured url.")
    @HttpUrl
    private String cancelUrl;
}
