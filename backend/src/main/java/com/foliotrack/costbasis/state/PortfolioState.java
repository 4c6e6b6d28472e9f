package com.foliotrack.costbasis.state;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Current value and gain/loss of one open holding.
 * price is the valuation used: per-unit for regular assets, the balance itself for Cash.
 * priced is false when no valuation existed, in which case price and currentValue are zero.
 */
public record PortfolioState(
        String portfolioId,
        String assetId,
        String assetClass,
        boolean cash,
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
