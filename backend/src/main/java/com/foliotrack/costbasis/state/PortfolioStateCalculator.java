package com.foliotrack.costbasis.state;

import com.foliotrack.costbasis.engine.Holding;
import com.foliotrack.costbasis.engine.LedgerResult;
import com.foliotrack.valuation.ValuationIndex;
import com.foliotrack.valuation.ValuationLookup;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Values open holdings against the valuation index. Pure function of (ledger, index, asOf).
 * Cash holdings are worth their valuation; everything else is quantity x valuation.
 * A cash balance held in several portfolios is valued once and split by each portfolio's share of the open quantity.
 */
@Component
@Slf4j
public class PortfolioStateCalculator {

    private static final int SCALE = 18;
    private static final RoundingMode ROUNDING = RoundingMode.HALF_UP;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public PortfolioStateReport calculate(LedgerResult ledger, ValuationIndex index) {
        return calculate(ledger, index, null);
    }

    /**
     * Value holdings using the latest valuation on or before {@code asOf}; a null asOf uses the latest overall.
     */
    public PortfolioStateReport calculate(LedgerResult ledger, ValuationIndex index, LocalDate asOf) {
        ValuationIndex valuations = index != null ? index : ValuationIndex.empty();
        List<PortfolioState> positions = new ArrayList<>();
        BigDecimal totalValue = BigDecimal.ZERO;
        BigDecimal totalCostBasis = BigDecimal.ZERO;
        BigDecimal totalUnrealized = BigDecimal.ZERO;
        int unpriced = 0;

        List<Holding> active = ledger.activeHoldings();
        Map<String, BigDecimal> openCashByAsset = new HashMap<>();
        active.stream()
                .filter(Holding::cash)
                .forEach(h -> openCashByAsset.merge(h.assetId(), h.quantity(), BigDecimal::add));

        for (Holding holding : active) {
            ValuationLookup lookup = valuations.asOf(holding.assetId(), asOf);
            if (lookup.isMissing()) {
                unpriced++;
                log.debug("No valuation for asset {} as of {}; valuing at zero", holding.assetId(), asOf);
            }
            BigDecimal price = lookup.valueOrZero();
            BigDecimal currentValue = holding.cash()
                    ? cashShare(price, holding.quantity(), openCashByAsset.get(holding.assetId()))
                    : holding.quantity().multiply(price);
            BigDecimal unrealized = currentValue.subtract(holding.costBasis());
            positions.add(new PortfolioState(
                    holding.portfolioId(),
                    holding.assetId(),
                    holding.assetClass(),
                    holding.cash(),
                    holding.quantity(),
                    holding.costBasis(),
                    price,
                    lookup.getDate(),
                    !lookup.isMissing(),
                    currentValue,
                    unrealized,
                    holding.realizedGainLoss(),
                    holding.inconsistent()));
            totalValue = totalValue.add(currentValue);
            totalCostBasis = totalCostBasis.add(holding.costBasis());
            totalUnrealized = totalUnrealized.add(unrealized);
        }

        BigDecimal totalGainLoss = totalUnrealized.add(ledger.totalRealizedGainLoss());
        BigDecimal capital = ledger.totalCapitalInvested();
        BigDecimal returnPercentage = capital.signum() > 0
                ? totalGainLoss.multiply(HUNDRED).divide(capital, SCALE, ROUNDING)
                : null;
        PortfolioSummary summary = new PortfolioSummary(
                totalValue,
                totalCostBasis,
                totalUnrealized,
                ledger.totalRealizedGainLoss(),
                totalGainLoss,
                capital,
                returnPercentage,
                ledger.totalFees(),
                positions.size(),
                unpriced,
                ledger.isInconsistent());
        return new PortfolioStateReport(List.copyOf(positions), summary, ledger.diagnostics());
    }

    private static BigDecimal cashShare(BigDecimal balance, BigDecimal quantity, BigDecimal openQuantity) {
        if (quantity.compareTo(openQuantity) == 0) {
            return balance;
        }
        return balance.multiply(quantity).divide(openQuantity, SCALE, ROUNDING);
    }
}
