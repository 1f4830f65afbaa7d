package com.eainde.vendorrisk.analysis;

import java.util.List;
import java.util.regex.Pattern;

/**
 * One row of the indicator table.
 *
 * @param category       finding category the indicator reports under
 * @param keywords       loose terms, matched case-insensitively as substrings
 * @param strictPatterns specific evidence of a control being in place
 * @param riskWeight     relative importance; impact is {@code round(weight * 10)}
 */
public record ComplianceIndicator(String category, List<String> keywords, List<Pattern> strictPatterns,
                                  double riskWeight) {

    public int impact() {
        return Math.max(1, (int) Math.round(riskWeight * 10));
    }
}
