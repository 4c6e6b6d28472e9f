package com.foliotrack.domain;

/**
 * Origin of a valuation record. Informational only; never affects computation.
 */
public enum ValuationSource {
    API,
    MANUAL
}
