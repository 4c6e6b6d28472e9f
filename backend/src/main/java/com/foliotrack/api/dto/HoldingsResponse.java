package com.foliotrack.api.dto;

import java.math.BigDecimal;
import java.util.List;

/**
 * GET /api/v1/analytics/holdings response. holdings lists open positions only.
 */
public record HoldingsResponse(
        List<HoldingResponse> holdings,
        int closedPositions,
        BigDecimal totalRealizedGainLoss,
        BigDecimal totalCapitalInvested,
        BigDecimal totalFees,
        List<DiagnosticResponse> diagnostics
) {
}
