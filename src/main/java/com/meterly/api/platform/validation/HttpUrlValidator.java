package com.meterly.api.platform.validation;

import com.meterly.api.platform.validation.annotations.HttpUrl;
import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;
import lombok.val;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Validates a {@link String} as an absolute HTTP URL that Stripe accepts as a redirect target.
 */
public class HttpUrlValidator implements ConstraintValidator<HttpUrl, String> {

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        if (value == null) {
            return true;
        }

        final URI uri;
        try {
            // Stripe redirect urls may carry template strings such as {CHECKOUT_SESSION_ID}.
            uri = new URI(value.replace("{", "%7B").replace("}", "%7D"));
        } catch (URISyntaxException e) {
            return false;
        }

        val scheme = uri.getScheme();
        return ("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))
            && uri.getHost() != null
            && !uri.getHost().isBlank();
    }
}
