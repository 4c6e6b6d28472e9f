package com.foliotrack.aggregation;

import com.foliotrack.costbasis.engine.HoldingsLedger;
import com.foliotrack.costbasis.state.PortfolioState;
import com.foliotrack.costbasis.state.PortfolioStateCalculator;
import com.foliotrack.costbasis.state.PortfolioStateReport;
import com.foliotrack.domain.Asset;
import com.foliotrack.valuation.ValuationIndex;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static com.foliotrack.testsupport.Fixtures.asset;
import static com.foliotrack.testsupport.Fixtures.assets;
import static com.foliotrack.testsupport.Fixtures.buy;
import static com.foliotrack.testsupport.Fixtures.engineProperties;
import static com.foliotrack.testsupport.Fixtures.valuation;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.assertj.core.api.Assertions.within;

class AggregationReporterTest {

    private static final Map<String, Asset> ASSETS = assets(
            asset("AAPL", "Stock", "Technology", "US", "Broker"),
            asset("MSFT", "Stock", "Technology", "US", "Broker"),
            asset("VWCE", "ETF", "", "Global", "Broker"),
            asset("FLAT", "Real Estate"),
            asset("CASH", "Cash", null, null, "Bank"));

    private final AggregationReporter reporter = new AggregationReporter(engineProperties());
    private List<PortfolioState> positions;

    @BeforeEach
    void setUp() {
        PortfolioStateReport report = new PortfolioStateCalculator().calculate(
                new HoldingsLedger(engineProperties()).replay(List.of(
                        buy("AAPL", "2", "100", "2024-01-01"),
                        buy("MSFT", "1", "300", "2024-01-01"),
                        buy("VWCE", "10", "90", "2024-01-01"),
                        buy("FLAT", "1", "250000", "2024-01-01"),
                        buy("CASH", "1000", "1", "2024-01-01")), ASSETS),
                ValuationIndex.of(List.of(
                        valuation("AAPL", "2024-02-01", "110"),
                        valuation("MSFT", "2024-02-01", "310"),
                        valuation("VWCE", "2024-02-01", "100"),
                        valuation("FLAT", "2024-02-01", "260000"),
                        valuation("CASH", "2024-02-01", "1000"))));
        positions = report.positions();
    }

    @Test
    @DisplayName("groups by sector with absent or blank values under Uncategorized")
    void bySector() {
        List<AggregationSlice> slices = reporter.byCategory(positions, CategoryKey.SECTOR, ASSETS);

        assertThat(slices).extracting(AggregationSlice::name, s -> s.value().stripTrailingZeros())
                .containsExactlyInAnyOrder(
                        tuple("Technology", new BigDecimal("530").stripTrailingZeros()),
                        tuple("Uncategorized", new BigDecimal("262000").stripTrailingZeros()));
    }

    @ParameterizedTest
    @EnumSource(CategoryKey.class)
    @DisplayName("sum of slices equals sum of current values for every key")
    void totalInvariant(CategoryKey key) {
        BigDecimal expected = positions.stream()
                .map(PortfolioState::currentValue)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        BigDecimal actual = reporter.byCategory(positions, key, ASSETS).stream()
                .map(AggregationSlice::value)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        assertThat(actual).isCloseTo(expected, within(new BigDecimal("0.001")));
    }

    @Test
    @DisplayName("buckets at or below epsilon are dropped")
    void dropsNegligibleBuckets() {
        record Item(String key, BigDecimal value) {}

        List<AggregationSlice> slices = reporter.group(List.of(
                        new Item("a", new BigDecimal("5")),
                        new Item("b", new BigDecimal("0.00005")),
                        new Item("c", BigDecimal.ZERO),
                        new Item("a", new BigDecimal("1"))),
                Item::key, Item::value);

        assertThat(slices).containsExactly(new AggregationSlice("a", new BigDecimal("6")));
    }

    @Test
    @DisplayName("cash spelled in any case lands in the single Cash bucket")
    void cashLabelsMerge() {
        Map<String, Asset> mixed = assets(asset("BANK", " cash "), asset("WALLET", "CASH"), asset("AAPL", "Stock"));
        List<PortfolioState> valued = new PortfolioStateCalculator().calculate(
                new HoldingsLedger(engineProperties()).replay(List.of(
                        buy("BANK", "100", "1", "2024-01-01"),
                        buy("WALLET", "50", "1", "2024-01-01"),
                        buy("AAPL", "1", "100", "2024-01-01")), mixed),
                ValuationIndex.of(List.of(
                        valuation("BANK", "2024-01-01", "100"),
                        valuation("WALLET", "2024-01-01", "50"),
                        valuation("AAPL", "2024-01-01", "100")))).positions();

        List<AggregationSlice> slices = reporter.byCategory(valued, CategoryKey.ASSET_CLASS, mixed);

        assertThat(slices).extracting(AggregationSlice::name).containsExactly("Cash", "Stock");
        assertThat(slices.get(0).value()).isEqualByComparingTo("150");
        assertThat(valued).allSatisfy(p -> assertThat(p.assetClass()).isIn("Cash", "Stock"));
    }

    @Test
    @DisplayName("empty input yields no slices")
    void emptyInput() {
        assertThat(reporter.byCategory(List.of(), CategoryKey.PLATFORM, ASSETS)).isEmpty();
    }
}
