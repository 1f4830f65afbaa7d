package com.eainde.vendorrisk.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Counts of findings by type, risk level and category.
 */
public record FindingSummary(
        int total,
        Map<String, Integer> byType,
        Map<String, Integer> byRiskLevel,
        Map<String, Integer> byCategory
) implements Serializable {

    public static FindingSummary of(List<Finding> findings) {
        Map<String, Integer> byType = new LinkedHashMap<>();
        Map<String, Integer> byLevel = new LinkedHashMap<>();
        Map<String, Integer> byCategory = new LinkedHashMap<>();
        for (Finding f : findings) {
            byType.merge(f.type().value(), 1, Integer::sum);
            byLevel.merge(f.riskLevel().value(), 1, Integer::sum);
            byCategory.merge(f.category(), 1, Integer::sum);
        }
        return new FindingSummary(findings.size(),
                Collections.unmodifiableMap(byType),
                Collections.unmodifiableMap(byLevel),
                Collections.unmodifiableMap(byCategory));
    }

    public int count(FindingType type) {
        return byType.getOrDefault(type.value(), 0);
    }

    public int count(RiskLevel level) {
        return byRiskLevel.getOrDefault(level.value(), 0);
    }
}
