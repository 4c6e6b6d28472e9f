package com.foliotrack.domain;

/**
 * Direction of a recorded trade. Replay applies BUY as inflow and SELL as outflow at average cost.
 */
public enum TransactionType {
    BUY,
    SELL
}
