package com.foliotrack.costbasis.engine;

import java.math.BigDecimal;
import java.util.List;

/**
 * Output of a ledger replay: every (portfolio, asset) holding in first-seen order plus ledger-wide totals.
 */
public record LedgerResult(
        List<Holding> holdings,
        BigDecimal totalRealizedGainLoss,
        BigDecimal totalCapitalInvested,
        BigDecimal totalFees,
        List<OversellDiagnostic> diagnostics,
        BigDecimal quantityEpsilon
) {

    public static LedgerResult empty(BigDecimal quantityEpsilon) {
        return new LedgerResult(List.of(), BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, List.of(), quantityEpsilon);
    }

    /** Holdings with quantity above epsilon. Closed and negative positions are excluded. */
    public List<Holding> activeHoldings() {
        return holdings.stream()
                .filter(h -> h.isOpen(quantityEpsilon))
                .toList();
    }

    public boolean isInconsistent() {
        return !diagnostics.isEmpty();
    }
}
