package com.foliotrack.aggregation;

import java.math.BigDecimal;

public record AggregationSlice(String name, BigDecimal value) {
}
