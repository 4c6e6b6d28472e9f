package com.foliotrack.api.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

public class ValidDateRangeValidator implements ConstraintValidator<ValidDateRange, DateRange> {

    @Override
    public boolean isValid(DateRange value, ConstraintValidatorContext context) {
        if (value == null || value.getFrom() == null || value.getTo() == null) {
            return true;
        }
        return !value.getFrom().isAfter(value.getTo());
    }
}
