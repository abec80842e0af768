package com.riskplatform.common.portfolio;

import com.riskplatform.common.model.AssetRiskRow;

import java.util.Comparator;
import java.util.List;

/**
 * Orders a per-asset risk table by 95% ES, most negative (riskiest) first.
 * Failed rows are excluded from the ranking.
 */
public final class AssetRiskRanking {

    public static final int DEFAULT_TOP = 5;

    private AssetRiskRanking() {}

    public static List<AssetRiskRow> riskiestFirst(List<AssetRiskRow> rows) {
        return rows.stream()
            .filter(r -> !r.isFailed())
            .sorted(Comparator.comparingDouble(AssetRiskRow::es95))
            .toList();
    }

    public static List<AssetRiskRow> worst(List<AssetRiskRow> rows, int count) {
        List<AssetRiskRow> sorted = riskiestFirst(rows);
        return sorted.subList(0, Math.min(count, sorted.size()));
    }

    /** The {@code count} safest assets, still in riskiest-first order. */
    public static List<AssetRiskRow> best(List<AssetRiskRow> rows, int count) {
        List<AssetRiskRow> sorted = riskiestFirst(rows);
        return sorted.subList(Math.max(0, sorted.size() - count), sorted.size());
    }
}
