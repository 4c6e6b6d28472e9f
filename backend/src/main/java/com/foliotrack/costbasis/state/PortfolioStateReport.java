package com.foliotrack.costbasis.state;

import com.foliotrack.costbasis.engine.OversellDiagnostic;

import java.util.List;

public record PortfolioStateReport(
        List<PortfolioState> positions,
        PortfolioSummary summary,
        List<OversellDiagnostic> diagnostics
) {
}
