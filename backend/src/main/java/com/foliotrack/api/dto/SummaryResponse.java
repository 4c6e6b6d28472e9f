package com.foliotrack.api.dto;

import java.math.BigDecimal;

public record SummaryResponse(
        BigDecimal totalValue,
        BigDecimal totalCostBasis,
        BigDecimal totalUnrealizedGainLoss,
        BigDecimal totalRealizedGainLoss,
        BigDecimal totalGainLoss,
        BigDecimal capitalInvested,
        BigDecimal returnPercentage,
        BigDecimal totalFees,
        int openPositions,
        int unpricedPositions,
        boolean inconsistent
) {
}
