package com.meterly.api.platform.validation.annotations;

import com.meterly.api.platform.validation.HttpUrlValidator;
import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Validates the annotated {@link String} as an absolute URL with {@code http} or {@code https}
 * scheme and a host. <b>{@code null} values are considered valid.</b>
 */
@Target({ElementType.FIELD, ElementType.PARAMETER})
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Constraint(validatedBy = HttpUrlValidator.class)
public @interface HttpUrl {

    String message() default "must be an absolute http/https url";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
