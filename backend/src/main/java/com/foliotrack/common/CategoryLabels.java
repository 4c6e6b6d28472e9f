package com.foliotrack.common;

import java.util.Locale;

/**
 * Fixed category labels shared by the engine and the API.
 */
public final class CategoryLabels {

    public static final String CASH = "Cash";
    public static final String UNCATEGORIZED = "Uncategorized";

    private CategoryLabels() {
    }

    /** Cash is matched case-insensitively, ignoring surrounding whitespace. */
    public static boolean isCash(String assetClass) {
        return assetClass != null && CASH.toLowerCase(Locale.ROOT).equals(assetClass.strip().toLowerCase(Locale.ROOT));
    }

    /** Null or blank labels collapse to {@link #UNCATEGORIZED}; any spelling of cash becomes {@link #CASH}. */
    public static String orUncategorized(String label) {
        if (label == null || label.isBlank()) {
            return UNCATEGORIZED;
        }
        if (isCash(label)) {
            return CASH;
        }
        return label.strip();
    }
}
