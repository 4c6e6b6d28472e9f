package com.foliotrack.testsupport;

import com.foliotrack.common.EngineProperties;
import com.foliotrack.domain.Asset;
import com.foliotrack.domain.AssetMetadata;
import com.foliotrack.domain.Transaction;
import com.foliotrack.domain.TransactionType;
import com.foliotrack.domain.Valuation;
import com.foliotrack.domain.ValuationSource;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Builders for engine inputs used across tests.
 */
public final class Fixtures {

    public static final String PORTFOLIO = "p1";

    private static final AtomicInteger IDS = new AtomicInteger();

    private Fixtures() {
    }

    public static Transaction buy(String assetId, String qty, String price, String date) {
        return tx(PORTFOLIO, assetId, TransactionType.BUY, qty, price, date);
    }

    public static Transaction sell(String assetId, String qty, String price, String date) {
        return tx(PORTFOLIO, assetId, TransactionType.SELL, qty, price, date);
    }

    public static Transaction tx(String portfolioId, String assetId, TransactionType type,
                                 String qty, String price, String date) {
        Transaction tx = new Transaction();
        tx.setId("tx-" + IDS.incrementAndGet());
        tx.setPortfolioId(portfolioId);
        tx.setAssetId(assetId);
        tx.setType(type);
        tx.setQuantity(new BigDecimal(qty));
        tx.setPricePerUnit(new BigDecimal(price));
        tx.setTransactionDate(date != null ? LocalDate.parse(date) : null);
        return tx;
    }

    public static Valuation valuation(String assetId, String date, String value) {
        Valuation v = new Valuation();
        v.setId("val-" + IDS.incrementAndGet());
        v.setAssetId(assetId);
        v.setDate(LocalDate.parse(date));
        v.setValue(new BigDecimal(value));
        v.setSource(ValuationSource.MANUAL);
        return v;
    }

    public static Asset asset(String id, String assetClass) {
        Asset asset = new Asset();
        asset.setId(id);
        asset.setName(id);
        asset.setAssetClass(assetClass);
        asset.setCurrency("EUR");
        return asset;
    }

    public static Asset asset(String id, String assetClass, String sector, String geography, String platform) {
        Asset asset = asset(id, assetClass);
        asset.setMetadata(new AssetMetadata(sector, geography, platform));
        return asset;
    }

    public static Map<String, Asset> assets(Asset... assets) {
        Map<String, Asset> byId = new LinkedHashMap<>();
        Arrays.stream(assets).forEach(a -> byId.put(a.getId(), a));
        return byId;
    }

    public static EngineProperties engineProperties() {
        return new EngineProperties();
    }
}
