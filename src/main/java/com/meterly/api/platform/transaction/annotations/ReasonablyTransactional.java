package com.meterly.api.platform.transaction.annotations;

import org.springframework.transaction.annotation.Transactional;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * A meta-annotation for {@link Transactional} that rolls back on any {@link Exception}, including
 * the checked webhook exceptions thrown by subscription state handlers, instead of only on
 * {@link RuntimeException} and {@link Error}.
 *
 * @see <a
 * href="https://docs.spring.io/spring-framework/reference/data-access/transaction/declarative/rolling-back.html">
 * Rolling back a declarative transaction - Spring documentation</a>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.METHOD, ElementType.TYPE})
@Transactional(rollbackFor = Exception.class)
public @interface ReasonablyTransactional {
}
