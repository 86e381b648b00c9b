package com.kumc.anam.gateway.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Both ends are real calendar dates in {@code yyyyMMdd} form and the end is not before the start.
 * Missing ends are left to {@code @NotNull}.
 */
@Documented
@Constraint(validatedBy = DateRangeValidator.class)
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface ValidDateRange {

    String message() default "invalid date range";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
