package com.foliotrack.timeseries;

import java.time.LocalDate;
import java.util.List;

/**
 * Value and allocation series over the same ascending date axis.
 */
public record PortfolioTimeSeries(
        List<ValuePoint> values,
        List<AllocationRow> allocations,
        List<String> categories
) {

    public static PortfolioTimeSeries empty() {
        return new PortfolioTimeSeries(List.of(), List.of(), List.of());
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * Keep only points within [from, to]; either bound may be null. Values are not recomputed.
     */
    public PortfolioTimeSeries window(LocalDate from, LocalDate to) {
        if (from == null && to == null) {
            return this;
        }
        return new PortfolioTimeSeries(
                values.stream().filter(p -> within(p.date(), from, to)).toList(),
                allocations.stream().filter(r -> within(r.date(), from, to)).toList(),
                categories);
    }

    private static boolean within(LocalDate date, LocalDate from, LocalDate to) {
        return (from == null || !date.isBefore(from)) && (to == null || !date.isAfter(to));
    }
}
