package com.foliotrack.domain;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Free-form classification embedded in an asset. Any field may be absent.
 */
@NoArgsConstructor
@AllArgsConstructor
@Getter
@Setter
public class AssetMetadata {

    private String sector;
    private String geography;
    private String platform;
}
