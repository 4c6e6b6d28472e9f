package com.foliotrack.api.dto;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

/**
 * Serialized flat, one property per asset class: {"date": "2024-01-01", "Stock": 360, "Cash": 500}.
 */
@JsonPropertyOrder({"date"})
public class AllocationRowResponse {

    private final LocalDate date;
    private final Map<String, BigDecimal> categories;

    public AllocationRowResponse(LocalDate date, Map<String, BigDecimal> categories) {
        this.date = date;
        this.categories = categories;
    }

    public LocalDate getDate() {
        return date;
    }

    @JsonAnyGetter
    public Map<String, BigDecimal> getCategories() {
        return categories;
    }
}
