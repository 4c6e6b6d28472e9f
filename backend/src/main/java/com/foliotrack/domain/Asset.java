package com.foliotrack.domain;

import com.foliotrack.common.CategoryLabels;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Tracked instrument. assetClass is a free label; "Cash" is special because its valuation is its balance.
 */
@Document(collection = "assets")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Asset {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String userId;
    private String name;
    private String assetClass;
    /** Display only; values are never converted. */
    private String currency;
    private AssetMetadata metadata;

    public boolean isCash() {
        return CategoryLabels.isCash(assetClass);
    }
}
