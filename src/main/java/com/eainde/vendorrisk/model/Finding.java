package com.eainde.vendorrisk.model;

import lombok.Builder;

import java.io.Serializable;

/**
 * A single classified observation about a document's compliance posture.
 *
 * @param category    one of {@link FindingCategory}
 * @param type        compliant / non_compliant / missing / unclear
 * @param riskLevel   severity of the observation
 * @param confidence  0.0 to 1.0
 * @param impact      1 to 10
 * @param description short human readable statement
 * @param evidence    quote or matched terms supporting the finding
 * @param sourceUrl   document the finding was produced from, may be {@code null}
 */
@Builder(toBuilder = true)
public record Finding(
        String category,
        FindingType type,
        RiskLevel riskLevel,
        double confidence,
        int impact,
        String description,
        String evidence,
        String sourceUrl
) implements Serializable {

    public Finding {
        category = FindingCategory.normalize(category);
        if (type == null) type = FindingType.UNCLEAR;
        if (riskLevel == null) riskLevel = RiskLevel.MEDIUM;
        if (Double.isNaN(confidence)) confidence = 0.0;
        confidence = Math.max(0.0, Math.min(1.0, confidence));
        impact = Math.max(1, Math.min(10, impact));
        if (description == null) description = "";
        if (evidence == null) evidence = "";
    }

    public boolean is(String category, FindingType type) {
        return this.category.equals(category) && this.type == type;
    }

    public Finding withSourceUrl(String url) {
        return toBuilder().sourceUrl(url).build();
    }
}
