package com.foliotrack.api.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

public record ValuePointResponse(LocalDate date, BigDecimal value) {
}
