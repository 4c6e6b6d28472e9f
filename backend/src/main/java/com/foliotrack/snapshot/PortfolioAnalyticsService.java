package com.foliotrack.snapshot;

import com.foliotrack.aggregation.AggregationReporter;
import com.foliotrack.aggregation.AggregationSlice;
import com.foliotrack.aggregation.CategoryKey;
import com.foliotrack.costbasis.engine.HoldingsLedger;
import com.foliotrack.costbasis.engine.LedgerResult;
import com.foliotrack.costbasis.state.PortfolioStateCalculator;
import com.foliotrack.costbasis.state.PortfolioStateReport;
import com.foliotrack.timeseries.PortfolioTimeSeries;
import com.foliotrack.timeseries.TimeSeriesReconstructor;
import com.foliotrack.valuation.ValuationIndex;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;

/**
 * Single entry point for every screen: load one snapshot, run the engine, return plain data.
 * Nothing is cached between calls.
 */
@Service
@RequiredArgsConstructor
public class PortfolioAnalyticsService {

    private final PortfolioSnapshotLoader snapshotLoader;
    private final HoldingsLedger holdingsLedger;
    private final PortfolioStateCalculator stateCalculator;
    private final TimeSeriesReconstructor timeSeriesReconstructor;
    private final AggregationReporter aggregationReporter;

    public LedgerResult holdings(List<String> portfolioIds) {
        PortfolioDataSnapshot snapshot = snapshotLoader.load(portfolioIds);
        return holdingsLedger.replay(snapshot.transactions(), snapshot.assetsById());
    }

    public PortfolioStateReport state(List<String> portfolioIds, LocalDate asOf) {
        return state(snapshotLoader.load(portfolioIds), asOf);
    }

    public PortfolioTimeSeries history(List<String> portfolioIds, LocalDate from, LocalDate to) {
        PortfolioDataSnapshot snapshot = snapshotLoader.load(portfolioIds);
        return reconstruct(snapshot).window(from, to);
    }

    /**
     * Allocation of valued positions by key, as of {@code date} or latest when null.
     * Slices always sum to the state total for the same date.
     */
    public List<AggregationSlice> allocation(List<String> portfolioIds, CategoryKey key, LocalDate date) {
        PortfolioDataSnapshot snapshot = snapshotLoader.load(portfolioIds);
        PortfolioStateReport report = state(snapshot, date);
        return aggregationReporter.byCategory(report.positions(), key, snapshot.assetsById());
    }

    private PortfolioStateReport state(PortfolioDataSnapshot snapshot, LocalDate asOf) {
        LedgerResult ledger = holdingsLedger.replay(snapshot.transactions(), snapshot.assetsById(), asOf);
        return stateCalculator.calculate(ledger, ValuationIndex.of(snapshot.valuations()), asOf);
    }

    private PortfolioTimeSeries reconstruct(PortfolioDataSnapshot snapshot) {
        return timeSeriesReconstructor.reconstruct(snapshot.transactions(),
                ValuationIndex.of(snapshot.valuations()), snapshot.assetsById());
    }
}
