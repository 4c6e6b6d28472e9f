package com.foliotrack.api.validation;

import java.time.LocalDate;

/**
 * Anything carrying an optional inclusive [from, to] window.
 */
public interface DateRange {

    LocalDate getFrom();

    LocalDate getTo();
}
