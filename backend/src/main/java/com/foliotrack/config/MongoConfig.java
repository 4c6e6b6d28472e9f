package com.foliotrack.config;

import org.bson.types.Decimal128;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;
import org.springframework.data.convert.WritingConverter;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.List;

/**
 * Quantities, prices, fees and valuations are stored as Decimal128, never as strings or doubles.
 * Collections and indexes come from the @Document / @CompoundIndex annotations on domain types.
 */
@Configuration
public class MongoConfig {

    @Bean
    public MongoCustomConversions customConversions() {
        return new MongoCustomConversions(List.of(
                BigDecimalToDecimal128.INSTANCE,
                Decimal128ToBigDecimal.INSTANCE
        ));
    }

    /** Values wider than 34 significant digits are rounded to fit; Decimal128 rejects them otherwise. */
    @WritingConverter
    enum BigDecimalToDecimal128 implements Converter<BigDecimal, Decimal128> {
        INSTANCE;

        @Override
        public Decimal128 convert(BigDecimal source) {
            BigDecimal value = source.precision() > MathContext.DECIMAL128.getPrecision()
                    ? source.round(MathContext.DECIMAL128)
                    : source;
            return new Decimal128(value);
        }
    }

    @ReadingConverter
    enum Decimal128ToBigDecimal implements Converter<Decimal128, BigDecimal> {
        INSTANCE;

        @Override
        public BigDecimal convert(Decimal128 source) {
            return source.bigDecimalValue();
        }
    }
}
