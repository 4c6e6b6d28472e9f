package com.foliotrack.valuation;

import com.foliotrack.domain.Valuation;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Read-only index of valuations per asset, sorted by date descending once at construction.
 * Latest lookups are O(1); as-of lookups binary-search the per-asset history.
 * One authoritative record per (asset, date): the one that appears later in the input wins.
 */
@Slf4j
public final class ValuationIndex {

    private static final ValuationIndex EMPTY = new ValuationIndex(Map.of());

    private final Map<String, List<Valuation>> byAssetDescending;

    private ValuationIndex(Map<String, List<Valuation>> byAssetDescending) {
        this.byAssetDescending = byAssetDescending;
    }

    /**
     * Build from records in insertion order. Records with no asset, date or value are skipped.
     */
    public static ValuationIndex of(Collection<Valuation> valuations) {
        if (valuations == null || valuations.isEmpty()) {
            return EMPTY;
        }
        Map<String, Map<LocalDate, Valuation>> perAssetPerDate = new LinkedHashMap<>();
        int skipped = 0;
        for (Valuation v : valuations) {
            if (v == null || v.getAssetId() == null || v.getDate() == null || v.getValue() == null) {
                skipped++;
                continue;
            }
            perAssetPerDate.computeIfAbsent(v.getAssetId(), k -> new LinkedHashMap<>())
                    .put(v.getDate(), v);
        }
        if (skipped > 0) {
            log.debug("Skipped {} incomplete valuation records", skipped);
        }
        Map<String, List<Valuation>> index = new LinkedHashMap<>();
        perAssetPerDate.forEach((assetId, byDate) -> {
            List<Valuation> sorted = new ArrayList<>(byDate.values());
            sorted.sort(Comparator.comparing(Valuation::getDate).reversed());
            index.put(assetId, Collections.unmodifiableList(sorted));
        });
        return new ValuationIndex(Collections.unmodifiableMap(index));
    }

    public static ValuationIndex empty() {
        return EMPTY;
    }

    /** Most recent valuation of the asset regardless of date. */
    public ValuationLookup latest(String assetId) {
        List<Valuation> history = byAssetDescending.get(assetId);
        if (history == null || history.isEmpty()) {
            return ValuationLookup.missing();
        }
        return ValuationLookup.of(history.get(0));
    }

    /** Most recent valuation with {@code date <= asOf}; missing when there is none. */
    public ValuationLookup asOf(String assetId, LocalDate asOf) {
        if (asOf == null) {
            return latest(assetId);
        }
        List<Valuation> history = byAssetDescending.get(assetId);
        if (history == null || history.isEmpty()) {
            return ValuationLookup.missing();
        }
        // first index whose date is <= asOf in a descending list
        int lo = 0;
        int hi = history.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (history.get(mid).getDate().isAfter(asOf)) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo < history.size() ? ValuationLookup.of(history.get(lo)) : ValuationLookup.missing();
    }

    /** Deduplicated history of the asset, newest first. Empty for unknown assets. */
    public List<Valuation> history(String assetId) {
        return byAssetDescending.getOrDefault(assetId, List.of());
    }

    /** Distinct valuation dates of the given assets, ascending. */
    public SortedSet<LocalDate> dates(Set<String> assetIds) {
        SortedSet<LocalDate> dates = new TreeSet<>();
        for (String assetId : assetIds) {
            for (Valuation v : history(assetId)) {
                dates.add(v.getDate());
            }
        }
        return dates;
    }
}
