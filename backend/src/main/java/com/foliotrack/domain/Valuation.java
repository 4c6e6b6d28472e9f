package com.foliotrack.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Point-in-time value of an asset: price per unit, or the absolute balance for Cash-class assets.
 * If two records share (assetId, date), the one inserted later is authoritative.
 */
@Document(collection = "valuations")
@CompoundIndex(name = "asset_date", def = "{'assetId': 1, 'date': -1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Valuation {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String assetId;
    private LocalDate date;
    private BigDecimal value;
    private ValuationSource source;
    private Instant createdAt;
}
