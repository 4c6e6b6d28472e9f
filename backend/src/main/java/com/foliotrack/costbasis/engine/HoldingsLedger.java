package com.foliotrack.costbasis.engine;

import com.foliotrack.common.CategoryLabels;
import com.foliotrack.common.EngineProperties;
import com.foliotrack.domain.Asset;
import com.foliotrack.domain.Transaction;
import com.foliotrack.domain.TransactionType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Average-cost replay of BUY/SELL transactions per (portfolio, asset).
 * Transactions are sorted by date ascending with a stable sort, so same-day ties keep input order.
 * On SELL the cost of the sold units is quantity x current average cost; average cost is zero at zero quantity.
 * Cash-class assets move quantity and cost basis but never capital invested or realized gain/loss.
 * Oversells are replayed as-is (no clamping) and reported as diagnostics.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HoldingsLedger {

    private static final int SCALE = 18;
    private static final RoundingMode ROUNDING = RoundingMode.HALF_UP;

    private final EngineProperties engineProperties;

    public LedgerResult replay(Collection<Transaction> transactions, Map<String, Asset> assetsById) {
        return replay(transactions, assetsById, null);
    }

    /**
     * Replay transactions dated on or before {@code asOf}; a null asOf replays everything.
     */
    public LedgerResult replay(Collection<Transaction> transactions, Map<String, Asset> assetsById, LocalDate asOf) {
        BigDecimal epsilon = engineProperties.getQuantityEpsilon();
        if (transactions == null || transactions.isEmpty()) {
            return LedgerResult.empty(epsilon);
        }
        Map<String, Asset> assets = assetsById != null ? assetsById : Map.of();

        List<Transaction> ordered = transactions.stream()
                .filter(Objects::nonNull)
                .filter(t -> asOf == null || (t.getTransactionDate() != null && !t.getTransactionDate().isAfter(asOf)))
                .sorted(replayOrder())
                .toList();

        Map<String, Position> positions = new LinkedHashMap<>();
        List<OversellDiagnostic> diagnostics = new ArrayList<>();
        BigDecimal totalRealized = BigDecimal.ZERO;
        BigDecimal totalCapital = BigDecimal.ZERO;
        BigDecimal totalFees = BigDecimal.ZERO;

        for (Transaction tx : ordered) {
            if (tx.getType() == null) {
                log.debug("Skipping transaction {} without type", tx.getId());
                continue;
            }
            Asset asset = assets.get(tx.getAssetId());
            Position position = positions.computeIfAbsent(key(tx.getPortfolioId(), tx.getAssetId()),
                    k -> {
                        if (asset == null) {
                            log.warn("No asset record for {}; treating it as non-cash {}", tx.getAssetId(),
                                    CategoryLabels.UNCATEGORIZED);
                        }
                        return new Position(tx.getPortfolioId(), tx.getAssetId(), asset);
                    });
            BigDecimal qty = tx.getQuantity() != null ? tx.getQuantity() : BigDecimal.ZERO;
            BigDecimal price = tx.getPricePerUnit() != null ? tx.getPricePerUnit() : BigDecimal.ZERO;
            BigDecimal fee = tx.getFeeOrZero();
            position.fees = position.fees.add(fee);
            totalFees = totalFees.add(fee);

            if (tx.getType() == TransactionType.BUY) {
                BigDecimal cost = qty.multiply(price);
                position.quantity = position.quantity.add(qty);
                position.costBasis = position.costBasis.add(cost);
                if (!position.cash) {
                    position.capitalInvested = position.capitalInvested.add(cost);
                    totalCapital = totalCapital.add(cost);
                }
            } else {
                if (position.quantity.compareTo(epsilon) <= 0 || qty.subtract(position.quantity).compareTo(epsilon) > 0) {
                    OversellDiagnostic d = new OversellDiagnostic(tx.getPortfolioId(), tx.getAssetId(), tx.getId(),
                            tx.getTransactionDate(), position.quantity, qty);
                    diagnostics.add(d);
                    position.inconsistent = true;
                    log.warn("Oversell in portfolio {} asset {} on {}: selling {} against open {}",
                            d.portfolioId(), d.assetId(), d.transactionDate(), d.sellQuantity(), d.openQuantityBefore());
                }
                BigDecimal avgCost = averageCost(position.costBasis, position.quantity);
                BigDecimal costOfSold = qty.multiply(avgCost);
                position.costBasis = position.costBasis.subtract(costOfSold);
                position.quantity = position.quantity.subtract(qty);
                if (!position.cash) {
                    BigDecimal realized = qty.multiply(price).subtract(costOfSold);
                    position.realized = position.realized.add(realized);
                    position.capitalInvested = position.capitalInvested.subtract(costOfSold);
                    totalRealized = totalRealized.add(realized);
                    totalCapital = totalCapital.subtract(costOfSold);
                }
            }
        }

        List<Holding> holdings = positions.values().stream()
                .map(Position::toHolding)
                .toList();
        return new LedgerResult(holdings, totalRealized, totalCapital, totalFees, List.copyOf(diagnostics), epsilon);
    }

    /**
     * Date ascending, null dates last. List.sort is stable so equal dates keep insertion order.
     */
    static Comparator<Transaction> replayOrder() {
        return Comparator.comparing(Transaction::getTransactionDate, Comparator.nullsLast(Comparator.naturalOrder()));
    }

    static BigDecimal averageCost(BigDecimal costBasis, BigDecimal quantity) {
        if (quantity.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return costBasis.divide(quantity, SCALE, ROUNDING);
    }

    private static String key(String portfolioId, String assetId) {
        return portfolioId + "\0" + assetId;
    }

    private static final class Position {
        private final String portfolioId;
        private final String assetId;
        private final String assetClass;
        private final boolean cash;
        private BigDecimal quantity = BigDecimal.ZERO;
        private BigDecimal costBasis = BigDecimal.ZERO;
        private BigDecimal realized = BigDecimal.ZERO;
        private BigDecimal capitalInvested = BigDecimal.ZERO;
        private BigDecimal fees = BigDecimal.ZERO;
        private boolean inconsistent;

        private Position(String portfolioId, String assetId, Asset asset) {
            this.portfolioId = portfolioId;
            this.assetId = assetId;
            this.assetClass = CategoryLabels.orUncategorized(asset != null ? asset.getAssetClass() : null);
            this.cash = asset != null && asset.isCash();
        }

        private Holding toHolding() {
            return new Holding(portfolioId, assetId, assetClass, cash, quantity, costBasis,
                    averageCost(costBasis, quantity), realized, capitalInvested, fees, inconsistent);
        }
    }
}
