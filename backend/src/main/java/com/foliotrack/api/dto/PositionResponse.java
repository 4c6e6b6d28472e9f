package com.foliotrack.api.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

public record PositionResponse(
        String portfolioId,
        String assetId,
        String assetClass,
        BigDecimal quantity,
        BigDecimal costBasis,
        BigDecimal price,
        LocalDate valuationDate,
        boolean priced,
        BigDecimal currentValue,
        BigDecimal unrealizedGainLoss,
        BigDecimal realizedGainLoss,
        boolean inconsistent
) {
}
