package com.foliotrack.costbasis.state;

import java.math.BigDecimal;

/**
 * Totals across every open position in scope. returnPercentage is null when no capital is invested.
 */
public record PortfolioSummary(
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
