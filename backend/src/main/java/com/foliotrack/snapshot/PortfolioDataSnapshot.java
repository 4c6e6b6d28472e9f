package com.foliotrack.snapshot;

import com.foliotrack.domain.Asset;
import com.foliotrack.domain.Transaction;
import com.foliotrack.domain.Valuation;

import java.util.List;
import java.util.Map;

/**
 * Fully materialized input for one engine invocation. Lists are in insertion order.
 */
public record PortfolioDataSnapshot(
        List<String> portfolioIds,
        List<Transaction> transactions,
        List<Valuation> valuations,
        Map<String, Asset> assetsById
) {

    public static PortfolioDataSnapshot empty(List<String> portfolioIds) {
        return new PortfolioDataSnapshot(portfolioIds, List.of(), List.of(), Map.of());
    }
}
