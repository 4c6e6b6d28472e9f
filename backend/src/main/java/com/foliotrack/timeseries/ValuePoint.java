package com.foliotrack.timeseries;

import java.math.BigDecimal;
import java.time.LocalDate;

public record ValuePoint(LocalDate date, BigDecimal value) {
}
