package com.foliotrack.api.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.TYPE;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * from must not be after to when both are given.
 * Error code for API: INVALID_DATE_RANGE.
 */
@Target({TYPE})
@Retention(RUNTIME)
@Documented
@Constraint(validatedBy = ValidDateRangeValidator.class)
public @interface ValidDateRange {

    String message() default "INVALID_DATE_RANGE";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
