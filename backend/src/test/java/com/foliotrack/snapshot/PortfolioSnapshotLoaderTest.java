package com.foliotrack.snapshot;

import com.foliotrack.domain.AssetRepository;
import com.foliotrack.domain.Portfolio;
import com.foliotrack.domain.PortfolioRepository;
import com.foliotrack.domain.Transaction;
import com.foliotrack.domain.TransactionRepository;
import com.foliotrack.domain.ValuationRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static com.foliotrack.testsupport.Fixtures.asset;
import static com.foliotrack.testsupport.Fixtures.buy;
import static com.foliotrack.testsupport.Fixtures.valuation;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PortfolioSnapshotLoaderTest {

    @Mock
    PortfolioRepository portfolioRepository;
    @Mock
    TransactionRepository transactionRepository;
    @Mock
    ValuationRepository valuationRepository;
    @Mock
    AssetRepository assetRepository;

    @InjectMocks
    PortfolioSnapshotLoader loader;

    @Test
    @DisplayName("scoped load reads transactions, then only the assets and valuations they reference")
    void scopedLoad() {
        Transaction t1 = buy("A", "1", "10", "2024-01-01");
        Transaction t2 = buy("B", "1", "10", "2024-01-02");
        when(portfolioRepository.findAllById(List.of("p1"))).thenReturn(List.of(portfolio("p1")));
        when(transactionRepository.findByPortfolioIdInOrderByCreatedAtAsc(List.of("p1")))
                .thenReturn(List.of(t1, t2));
        when(assetRepository.findByIdIn(Set.of("A", "B")))
                .thenReturn(List.of(asset("A", "Stock"), asset("B", "Cash")));
        when(valuationRepository.findByAssetIdInOrderByCreatedAtAsc(Set.of("A", "B")))
                .thenReturn(List.of(valuation("A", "2024-01-01", "10")));

        PortfolioDataSnapshot snapshot = loader.load(Arrays.asList(" p1 ", "p1", null, ""));

        assertThat(snapshot.portfolioIds()).containsExactly("p1");
        assertThat(snapshot.transactions()).containsExactly(t1, t2);
        assertThat(snapshot.assetsById()).containsOnlyKeys("A", "B");
        assertThat(snapshot.valuations()).hasSize(1);
    }

    @Test
    @DisplayName("no portfolio ids scopes to every stored portfolio")
    void unscopedLoad() {
        when(portfolioRepository.findAll()).thenReturn(List.of(portfolio("p1"), portfolio("p2")));
        when(transactionRepository.findByPortfolioIdInOrderByCreatedAtAsc(List.of("p1", "p2"))).thenReturn(List.of());

        PortfolioDataSnapshot snapshot = loader.load(null);

        assertThat(snapshot.portfolioIds()).containsExactly("p1", "p2");
        assertThat(snapshot.transactions()).isEmpty();
    }

    @Test
    @DisplayName("unknown portfolio ids are dropped from the scope")
    void unknownPortfoliosDropped() {
        when(portfolioRepository.findAllById(List.of("p1", "ghost"))).thenReturn(List.of(portfolio("p1")));
        when(transactionRepository.findByPortfolioIdInOrderByCreatedAtAsc(List.of("p1"))).thenReturn(List.of());

        assertThat(loader.load(List.of("p1", "ghost")).portfolioIds()).containsExactly("p1");
    }

    @Test
    @DisplayName("only unknown portfolio ids means no transaction read")
    void onlyUnknownPortfolios() {
        when(portfolioRepository.findAllById(List.of("ghost"))).thenReturn(List.of());

        PortfolioDataSnapshot snapshot = loader.load(List.of("ghost"));

        assertThat(snapshot.portfolioIds()).isEmpty();
        verify(transactionRepository, never()).findByPortfolioIdInOrderByCreatedAtAsc(any());
    }

    @Test
    @DisplayName("no transactions skips the asset and valuation reads")
    void emptyScopeSkipsReads() {
        when(portfolioRepository.findAllById(List.of("p9"))).thenReturn(List.of(portfolio("p9")));
        when(transactionRepository.findByPortfolioIdInOrderByCreatedAtAsc(List.of("p9"))).thenReturn(List.of());

        PortfolioDataSnapshot snapshot = loader.load(List.of("p9"));

        assertThat(snapshot.assetsById()).isEmpty();
        verify(assetRepository, never()).findByIdIn(any());
        verify(valuationRepository, never()).findByAssetIdInOrderByCreatedAtAsc(any());
    }

    private static Portfolio portfolio(String id) {
        Portfolio portfolio = new Portfolio();
        portfolio.setId(id);
        portfolio.setName(id);
        return portfolio;
    }
}
