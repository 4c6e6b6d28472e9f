package com.foliotrack.api.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Oversell flag surfaced to the client; the numbers it refers to are reported unchanged.
 */
public record DiagnosticResponse(
        String code,
        String portfolioId,
        String assetId,
        String transactionId,
        LocalDate date,
        BigDecimal openQuantityBefore,
        BigDecimal sellQuantity
) {
}
