package com.foliotrack.snapshot;

import com.foliotrack.domain.Asset;
import com.foliotrack.domain.AssetRepository;
import com.foliotrack.domain.Portfolio;
import com.foliotrack.domain.PortfolioRepository;
import com.foliotrack.domain.Transaction;
import com.foliotrack.domain.TransactionRepository;
import com.foliotrack.domain.Valuation;
import com.foliotrack.domain.ValuationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Reads the portfolios in scope, their transactions, then the assets and valuations those reference, once per request.
 * An empty portfolio list means every stored portfolio; requested ids with no stored portfolio are dropped.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PortfolioSnapshotLoader {

    private final PortfolioRepository portfolioRepository;
    private final TransactionRepository transactionRepository;
    private final ValuationRepository valuationRepository;
    private final AssetRepository assetRepository;

    public PortfolioDataSnapshot load(List<String> portfolioIds) {
        List<String> requested = portfolioIds == null ? List.of() : portfolioIds.stream()
                .filter(id -> id != null && !id.isBlank())
                .map(String::strip)
                .distinct()
                .toList();
        List<String> scope = resolveScope(requested);
        if (scope.isEmpty()) {
            return PortfolioDataSnapshot.empty(scope);
        }
        List<Transaction> transactions = transactionRepository.findByPortfolioIdInOrderByCreatedAtAsc(scope);
        if (transactions.isEmpty()) {
            return PortfolioDataSnapshot.empty(scope);
        }

        Set<String> assetIds = new LinkedHashSet<>();
        transactions.stream()
                .map(Transaction::getAssetId)
                .filter(Objects::nonNull)
                .forEach(assetIds::add);
        Map<String, Asset> assets = new LinkedHashMap<>();
        for (Asset asset : assetRepository.findByIdIn(assetIds)) {
            assets.put(asset.getId(), asset);
        }
        List<Valuation> valuations = valuationRepository.findByAssetIdInOrderByCreatedAtAsc(assetIds);

        log.debug("Loaded snapshot for portfolios {}: {} transactions, {} assets, {} valuations",
                scope, transactions.size(), assets.size(), valuations.size());
        return new PortfolioDataSnapshot(scope, transactions, valuations, assets);
    }

    private List<String> resolveScope(List<String> requested) {
        if (requested.isEmpty()) {
            return portfolioRepository.findAll().stream()
                    .map(Portfolio::getId)
                    .toList();
        }
        Set<String> known = new HashSet<>();
        portfolioRepository.findAllById(requested).forEach(p -> known.add(p.getId()));
        List<String> scope = requested.stream().filter(known::contains).toList();
        if (scope.size() < requested.size()) {
            log.warn("Ignoring unknown portfolios {}", requested.stream().filter(id -> !known.contains(id)).toList());
        }
        return scope;
    }
}
