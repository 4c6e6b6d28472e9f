package com.foliotrack.api.dto;

import com.foliotrack.aggregation.CategoryKey;
import com.foliotrack.api.validation.DateRange;
import com.foliotrack.api.validation.ValidDateRange;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.format.annotation.DateTimeFormat;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Query parameters shared by the analytics endpoints. An empty portfolioIds list means every portfolio.
 */
@ValidDateRange
@NoArgsConstructor
@Getter
@Setter
public class AnalyticsQuery implements DateRange {

    private List<String> portfolioIds = new ArrayList<>();
    @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
    private LocalDate from;
    @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
    private LocalDate to;
    /** Point in time for state and allocation; null means latest. */
    @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
    private LocalDate asOf;
    private CategoryKey groupBy = CategoryKey.ASSET_CLASS;
}
