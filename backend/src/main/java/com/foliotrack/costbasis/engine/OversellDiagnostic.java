package com.foliotrack.costbasis.engine;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Non-fatal flag: a SELL exceeded the open quantity tracked at that point of the replay.
 */
public record OversellDiagnostic(
        String portfolioId,
        String assetId,
        String transactionId,
        LocalDate transactionDate,
        BigDecimal openQuantityBefore,
        BigDecimal sellQuantity
) {
}
