package com.foliotrack.api.dto;

import java.math.BigDecimal;

public record HoldingResponse(
        String portfolioId,
        String assetId,
        String assetClass,
        BigDecimal quantity,
        BigDecimal costBasis,
        BigDecimal averageCost,
        BigDecimal realizedGainLoss,
        boolean inconsistent
) {
}
