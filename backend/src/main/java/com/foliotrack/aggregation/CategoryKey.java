package com.foliotrack.aggregation;

import com.foliotrack.domain.Asset;
import com.foliotrack.domain.AssetMetadata;

import java.util.function.Function;

/**
 * Categorical keys an asset can be grouped by. Extractors may return null; the reporter maps that to Uncategorized.
 */
public enum CategoryKey {
    ASSET_CLASS(Asset::getAssetClass),
    SECTOR(asset -> metadata(asset, AssetMetadata::getSector)),
    GEOGRAPHY(asset -> metadata(asset, AssetMetadata::getGeography)),
    PLATFORM(asset -> metadata(asset, AssetMetadata::getPlatform)),
    CURRENCY(Asset::getCurrency);

    private final Function<Asset, String> extractor;

    CategoryKey(Function<Asset, String> extractor) {
        this.extractor = extractor;
    }

    public String extract(Asset asset) {
        return asset == null ? null : extractor.apply(asset);
    }

    private static String metadata(Asset asset, Function<AssetMetadata, String> field) {
        return asset.getMetadata() == null ? null : field.apply(asset.getMetadata());
    }
}
