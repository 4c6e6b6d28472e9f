package com.foliotrack.api.dto;

import java.math.BigDecimal;

public record AllocationSliceResponse(String name, BigDecimal value) {
}
