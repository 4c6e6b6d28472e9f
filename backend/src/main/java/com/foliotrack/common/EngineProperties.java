package com.foliotrack.common;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

/**
 * Engine tolerances and calendar settings. Documented in application.yml under foliotrack.engine.
 */
@ConfigurationProperties(prefix = "foliotrack.engine")
@Getter
@Setter
public class EngineProperties {

    /**
     * Holdings with quantity at or below this are closed. Used by the ledger, state and time series alike.
     */
    private BigDecimal quantityEpsilon = new BigDecimal("0.0001");

    /**
     * Aggregation buckets whose total is at or below this are dropped.
     */
    private BigDecimal aggregationEpsilon = new BigDecimal("0.0001");

    /**
     * Zone used to decide what "today" is when extending a time series.
     */
    private String zoneId = "UTC";
}
