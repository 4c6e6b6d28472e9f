package com.foliotrack.timeseries;

import com.foliotrack.common.CategoryLabels;
import com.foliotrack.common.EngineProperties;
import com.foliotrack.domain.Asset;
import com.foliotrack.domain.Transaction;
import com.foliotrack.domain.TransactionType;
import com.foliotrack.valuation.ValuationIndex;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Rebuilds daily portfolio value and allocation by asset class from transactions and sparse valuations.
 * <p>
 * The date axis is the sorted union of transaction dates and the valuation dates of the assets those
 * transactions touch; today is appended (carrying the last point) when the axis ends earlier.
 * On each date the open quantity of a (portfolio, asset) position is the cumulative BUY minus SELL up to
 * that date. Positions above the quantity epsilon are summed per asset and valued with the latest valuation on or
 * before the date (Cash at the valuation itself). Allocation rows forward-fill a class that has no
 * open position with its last known value; classes never held so far are zero.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TimeSeriesReconstructor {

    private final EngineProperties engineProperties;
    private final Clock clock;

    public PortfolioTimeSeries reconstruct(Collection<Transaction> transactions,
                                           ValuationIndex index,
                                           Map<String, Asset> assetsById) {
        if (transactions == null || transactions.isEmpty()) {
            return PortfolioTimeSeries.empty();
        }
        ValuationIndex valuations = index != null ? index : ValuationIndex.empty();
        Map<String, Asset> assets = assetsById != null ? assetsById : Map.of();
        BigDecimal epsilon = engineProperties.getQuantityEpsilon();

        List<Transaction> dated = transactions.stream()
                .filter(Objects::nonNull)
                .filter(t -> t.getTransactionDate() != null && t.getType() != null)
                .sorted(Comparator.comparing(Transaction::getTransactionDate))
                .toList();
        if (dated.size() < transactions.size()) {
            log.debug("Ignoring {} transactions without date or type", transactions.size() - dated.size());
        }
        if (dated.isEmpty()) {
            return PortfolioTimeSeries.empty();
        }

        Map<String, AssetInfo> assetInfo = new LinkedHashMap<>();
        Set<String> categories = new LinkedHashSet<>();
        for (Transaction tx : dated) {
            assetInfo.computeIfAbsent(tx.getAssetId(), id -> AssetInfo.of(assets.get(id)));
            categories.add(assetInfo.get(tx.getAssetId()).assetClass());
        }

        SortedSet<LocalDate> axis = new TreeSet<>();
        dated.forEach(t -> axis.add(t.getTransactionDate()));
        axis.addAll(valuations.dates(assetInfo.keySet()));

        Map<PositionKey, BigDecimal> quantities = new LinkedHashMap<>();
        Map<String, BigDecimal> lastKnownByClass = new HashMap<>();
        List<ValuePoint> values = new ArrayList<>(axis.size() + 1);
        List<AllocationRow> allocations = new ArrayList<>(axis.size() + 1);
        int cursor = 0;

        for (LocalDate date : axis) {
            while (cursor < dated.size() && !dated.get(cursor).getTransactionDate().isAfter(date)) {
                apply(quantities, dated.get(cursor++));
            }

            Map<String, BigDecimal> openByAsset = openQuantities(quantities, epsilon);
            BigDecimal total = BigDecimal.ZERO;
            Map<String, BigDecimal> byClass = new HashMap<>();
            Set<String> openClasses = new HashSet<>();
            for (Map.Entry<String, BigDecimal> entry : openByAsset.entrySet()) {
                AssetInfo info = assetInfo.get(entry.getKey());
                BigDecimal price = valuations.asOf(entry.getKey(), date).valueOrZero();
                BigDecimal value = info.cash() ? price : entry.getValue().multiply(price);
                total = total.add(value);
                byClass.merge(info.assetClass(), value, BigDecimal::add);
                openClasses.add(info.assetClass());
            }
            values.add(new ValuePoint(date, total));

            Map<String, BigDecimal> row = new LinkedHashMap<>();
            for (String category : categories) {
                if (openClasses.contains(category)) {
                    BigDecimal value = byClass.get(category);
                    lastKnownByClass.put(category, value);
                    row.put(category, value);
                } else {
                    row.put(category, lastKnownByClass.getOrDefault(category, BigDecimal.ZERO));
                }
            }
            allocations.add(new AllocationRow(date, Collections.unmodifiableMap(row)));
        }

        LocalDate today = LocalDate.now(clock);
        if (axis.last().isBefore(today)) {
            ValuePoint last = values.get(values.size() - 1);
            AllocationRow lastRow = allocations.get(allocations.size() - 1);
            values.add(new ValuePoint(today, last.value()));
            allocations.add(new AllocationRow(today, lastRow.values()));
        }

        return new PortfolioTimeSeries(List.copyOf(values), List.copyOf(allocations), List.copyOf(categories));
    }

    private static void apply(Map<PositionKey, BigDecimal> quantities, Transaction tx) {
        BigDecimal qty = tx.getQuantity() != null ? tx.getQuantity() : BigDecimal.ZERO;
        BigDecimal delta = tx.getType() == TransactionType.SELL ? qty.negate() : qty;
        quantities.merge(new PositionKey(tx.getPortfolioId(), tx.getAssetId()), delta, BigDecimal::add);
    }

    /**
     * Open quantity per asset, summing only the portfolios whose own position is above epsilon.
     * An oversold portfolio never offsets another portfolio's holding.
     */
    private static Map<String, BigDecimal> openQuantities(Map<PositionKey, BigDecimal> quantities, BigDecimal epsilon) {
        Map<String, BigDecimal> open = new LinkedHashMap<>();
        quantities.forEach((key, qty) -> {
            if (qty.compareTo(epsilon) > 0) {
                open.merge(key.assetId(), qty, BigDecimal::add);
            }
        });
        return open;
    }

    private record PositionKey(String portfolioId, String assetId) {
    }

    private record AssetInfo(String assetClass, boolean cash) {

        static AssetInfo of(Asset asset) {
            if (asset == null) {
                return new AssetInfo(CategoryLabels.UNCATEGORIZED, false);
            }
            return new AssetInfo(CategoryLabels.orUncategorized(asset.getAssetClass()), asset.isCash());
        }
    }
}
