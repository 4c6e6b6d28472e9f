package com.foliotrack.config;

import org.bson.types.Decimal128;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class MongoConfigTest {

    @Test
    @DisplayName("18-digit average cost survives a write and read unchanged")
    void exactWithinPrecision() {
        BigDecimal avgCost = new BigDecimal("142.857142857142857143");

        Decimal128 stored = MongoConfig.BigDecimalToDecimal128.INSTANCE.convert(avgCost);

        assertThat(MongoConfig.Decimal128ToBigDecimal.INSTANCE.convert(stored)).isEqualByComparingTo(avgCost);
    }

    @Test
    @DisplayName("values wider than Decimal128 are rounded instead of rejected")
    void roundsWideValues() {
        BigDecimal wide = new BigDecimal("1234567890.123456789012345678901234567890");

        Decimal128 stored = MongoConfig.BigDecimalToDecimal128.INSTANCE.convert(wide);

        assertThat(stored.bigDecimalValue().precision()).isEqualTo(34);
        assertThat(stored.bigDecimalValue()).isEqualByComparingTo("1234567890.123456789012345678901235");
    }
}
