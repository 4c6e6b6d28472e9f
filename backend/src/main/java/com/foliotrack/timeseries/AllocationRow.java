package com.foliotrack.timeseries;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

/**
 * Cumulative snapshot of value per asset class on one date. Every class known to the series has an entry.
 */
public record AllocationRow(LocalDate date, Map<String, BigDecimal> values) {

    public BigDecimal value(String category) {
        return values.getOrDefault(category, BigDecimal.ZERO);
    }
}
