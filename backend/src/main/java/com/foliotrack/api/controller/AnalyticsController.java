package com.foliotrack.api.controller;

import com.foliotrack.aggregation.AggregationSlice;
import com.foliotrack.api.dto.AllocationRowResponse;
import com.foliotrack.api.dto.AllocationSliceResponse;
import com.foliotrack.api.dto.AnalyticsQuery;
import com.foliotrack.api.dto.DiagnosticResponse;
import com.foliotrack.api.dto.HoldingResponse;
import com.foliotrack.api.dto.HoldingsResponse;
import com.foliotrack.api.dto.PortfolioStateResponse;
import com.foliotrack.api.dto.PositionResponse;
import com.foliotrack.api.dto.SummaryResponse;
import com.foliotrack.api.dto.ValuePointResponse;
import com.foliotrack.costbasis.engine.Holding;
import com.foliotrack.costbasis.engine.LedgerResult;
import com.foliotrack.costbasis.engine.OversellDiagnostic;
import com.foliotrack.costbasis.state.PortfolioStateReport;
import com.foliotrack.costbasis.state.PortfolioSummary;
import com.foliotrack.snapshot.PortfolioAnalyticsService;
import com.foliotrack.timeseries.PortfolioTimeSeries;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Comparator;
import java.util.List;

/**
 * Read-only analytics over transactions and valuations. Each call recomputes from a fresh snapshot.
 */
@RestController
@RequestMapping("/api/v1/analytics")
@RequiredArgsConstructor
public class AnalyticsController {

    private static final String OVERSELL = "OVERSELL";

    private final PortfolioAnalyticsService analyticsService;

    @GetMapping("/holdings")
    public ResponseEntity<HoldingsResponse> holdings(@Valid @ModelAttribute AnalyticsQuery query) {
        LedgerResult ledger = analyticsService.holdings(query.getPortfolioIds());
        List<Holding> active = ledger.activeHoldings();
        return ResponseEntity.ok(new HoldingsResponse(
                active.stream()
                        .map(h -> new HoldingResponse(
                                h.portfolioId(),
                                h.assetId(),
                                h.assetClass(),
                                h.quantity(),
                                h.costBasis(),
                                h.averageCost(),
                                h.realizedGainLoss(),
                                h.inconsistent()))
                        .toList(),
                ledger.holdings().size() - active.size(),
                ledger.totalRealizedGainLoss(),
                ledger.totalCapitalInvested(),
                ledger.totalFees(),
                diagnostics(ledger.diagnostics())
        ));
    }

    @GetMapping("/state")
    public ResponseEntity<PortfolioStateResponse> state(@Valid @ModelAttribute AnalyticsQuery query) {
        PortfolioStateReport report = analyticsService.state(query.getPortfolioIds(), query.getAsOf());
        PortfolioSummary s = report.summary();
        return ResponseEntity.ok(new PortfolioStateResponse(
                report.positions().stream()
                        .map(p -> new PositionResponse(
                                p.portfolioId(),
                                p.assetId(),
                                p.assetClass(),
                                p.quantity(),
                                p.costBasis(),
                                p.price(),
                                p.valuationDate(),
                                p.priced(),
                                p.currentValue(),
                                p.unrealizedGainLoss(),
                                p.realizedGainLoss(),
                                p.inconsistent()))
                        .toList(),
                new SummaryResponse(
                        s.totalValue(),
                        s.totalCostBasis(),
                        s.totalUnrealizedGainLoss(),
                        s.totalRealizedGainLoss(),
                        s.totalGainLoss(),
                        s.capitalInvested(),
                        s.returnPercentage(),
                        s.totalFees(),
                        s.openPositions(),
                        s.unpricedPositions(),
                        s.inconsistent()),
                diagnostics(report.diagnostics())
        ));
    }

    /**
     * Slices sorted by value descending for display.
     */
    @GetMapping("/allocation")
    public ResponseEntity<List<AllocationSliceResponse>> allocation(@Valid @ModelAttribute AnalyticsQuery query) {
        List<AggregationSlice> slices = analyticsService.allocation(
                query.getPortfolioIds(), query.getGroupBy(), query.getAsOf());
        return ResponseEntity.ok(slices.stream()
                .sorted(Comparator.comparing(AggregationSlice::value).reversed())
                .map(s -> new AllocationSliceResponse(s.name(), s.value()))
                .toList());
    }

    @GetMapping("/history/value")
    public ResponseEntity<List<ValuePointResponse>> valueHistory(@Valid @ModelAttribute AnalyticsQuery query) {
        PortfolioTimeSeries series = analyticsService.history(query.getPortfolioIds(), query.getFrom(), query.getTo());
        return ResponseEntity.ok(series.values().stream()
                .map(p -> new ValuePointResponse(p.date(), p.value()))
                .toList());
    }

    @GetMapping("/history/allocation")
    public ResponseEntity<List<AllocationRowResponse>> allocationHistory(@Valid @ModelAttribute AnalyticsQuery query) {
        PortfolioTimeSeries series = analyticsService.history(query.getPortfolioIds(), query.getFrom(), query.getTo());
        return ResponseEntity.ok(series.allocations().stream()
                .map(r -> new AllocationRowResponse(r.date(), r.values()))
                .toList());
    }

    private static List<DiagnosticResponse> diagnostics(List<OversellDiagnostic> diagnostics) {
        return diagnostics.stream()
                .map(d -> new DiagnosticResponse(
                        OVERSELL,
                        d.portfolioId(),
                        d.assetId(),
                        d.transactionId(),
                        d.transactionDate(),
                        d.openQuantityBefore(),
                        d.sellQuantity()))
                .toList();
    }
}
