package com.foliotrack.costbasis.engine;

import java.math.BigDecimal;

/**
 * Derived position per (portfolio, asset) after replay. Never persisted.
 * quantity and costBasis are the raw replay output and may be negative when {@code inconsistent} is set.
 */
public record Holding(
        String portfolioId,
        String assetId,
        String assetClass,
        boolean cash,
        BigDecimal quantity,
        BigDecimal costBasis,
        BigDecimal averageCost,
        BigDecimal realizedGainLoss,
        BigDecimal capitalInvested,
        BigDecimal fees,
        boolean inconsistent
) {

    public boolean isOpen(BigDecimal epsilon) {
        return quantity.compareTo(epsilon) > 0;
    }
}
