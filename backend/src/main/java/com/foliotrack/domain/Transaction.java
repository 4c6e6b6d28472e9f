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
 * Recorded BUY/SELL of an asset within a portfolio. Written by the CRUD layer; the engine only reads it.
 * createdAt carries insertion order, which breaks ties between transactions on the same date.
 */
@Document(collection = "transactions")
@CompoundIndex(name = "portfolio_asset_date", def = "{'portfolioId': 1, 'assetId': 1, 'transactionDate': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Transaction {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String portfolioId;
    private String assetId;
    private TransactionType type;
    private BigDecimal quantity;
    private BigDecimal pricePerUnit;
    private LocalDate transactionDate;
    /** Optional; null is read as zero. */
    private BigDecimal fee;
    private Instant createdAt;

    public BigDecimal getFeeOrZero() {
        return fee != null ? fee : BigDecimal.ZERO;
    }
}
