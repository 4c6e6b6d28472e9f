package com.foliotrack.aggregation;

import com.foliotrack.common.CategoryLabels;
import com.foliotrack.common.EngineProperties;
import com.foliotrack.costbasis.state.PortfolioState;
import com.foliotrack.domain.Asset;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Groups value snapshots by a categorical key and sums them. Blank keys fall into Uncategorized and
 * buckets at or below the aggregation epsilon are dropped. Output keeps first-seen order.
 */
@Component
@RequiredArgsConstructor
public class AggregationReporter {

    private final EngineProperties engineProperties;

    public <T> List<AggregationSlice> group(Collection<T> items,
                                            Function<? super T, String> keyExtractor,
                                            Function<? super T, BigDecimal> valueExtractor) {
        if (items == null || items.isEmpty()) {
            return List.of();
        }
        Map<String, BigDecimal> buckets = new LinkedHashMap<>();
        for (T item : items) {
            BigDecimal value = valueExtractor.apply(item);
            if (value == null) {
                continue;
            }
            buckets.merge(CategoryLabels.orUncategorized(keyExtractor.apply(item)), value, BigDecimal::add);
        }
        BigDecimal epsilon = engineProperties.getAggregationEpsilon();
        return buckets.entrySet().stream()
                .filter(e -> e.getValue().compareTo(epsilon) > 0)
                .map(e -> new AggregationSlice(e.getKey(), e.getValue()))
                .toList();
    }

    /** Group valued positions by a metadata key of their asset. */
    public List<AggregationSlice> byCategory(Collection<PortfolioState> positions,
                                             CategoryKey key,
                                             Map<String, Asset> assetsById) {
        Map<String, Asset> assets = assetsById != null ? assetsById : Map.of();
        return group(positions, p -> key.extract(assets.get(p.assetId())), PortfolioState::currentValue);
    }
}
