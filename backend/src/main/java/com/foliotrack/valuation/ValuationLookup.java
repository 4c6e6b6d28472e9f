package com.foliotrack.valuation;

import com.foliotrack.domain.Valuation;
import com.foliotrack.domain.ValuationSource;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Result of a valuation lookup. Either a known value with its date, or MISSING.
 * A missing valuation prices the asset at zero but stays distinguishable from an explicit zero.
 */
@Getter
public class ValuationLookup {

    private static final ValuationLookup MISSING = new ValuationLookup(null, null, null);

    private final BigDecimal value;
    private final LocalDate date;
    private final ValuationSource source;

    private ValuationLookup(BigDecimal value, LocalDate date, ValuationSource source) {
        this.value = value;
        this.date = date;
        this.source = source;
    }

    public static ValuationLookup of(Valuation valuation) {
        if (valuation == null || valuation.getValue() == null) {
            return MISSING;
        }
        return new ValuationLookup(valuation.getValue(), valuation.getDate(), valuation.getSource());
    }

    public static ValuationLookup missing() {
        return MISSING;
    }

    public boolean isMissing() {
        return value == null;
    }

    public Optional<BigDecimal> getValue() {
        return Optional.ofNullable(value);
    }

    /** Value to use in arithmetic: zero when missing. */
    public BigDecimal valueOrZero() {
        return value != null ? value : BigDecimal.ZERO;
    }
}
