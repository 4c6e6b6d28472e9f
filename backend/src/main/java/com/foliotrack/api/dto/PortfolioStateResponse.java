package com.foliotrack.api.dto;

import java.util.List;

/**
 * GET /api/v1/analytics/state response.
 */
public record PortfolioStateResponse(
        List<PositionResponse> positions,
        SummaryResponse summary,
        List<DiagnosticResponse> diagnostics
) {
}
