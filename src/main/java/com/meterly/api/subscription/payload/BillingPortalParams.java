package com.meterly.api.subscription.payload;

import com.meterly.api.platform.validation.annotations.HttpUrl;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A data transfer object to hold the body of billing portal requests.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BillingPortalParams {

    @Schema(requiredMode = Schema.RequiredMode.REQUIRED, description = "redirect url for exiting the billing portal")
    @NotBlank
    @HttpUrl
    private String returnUrl;
}
