package com.eainde.vendorrisk.analysis;

import com.eainde.vendorrisk.model.DocumentType;
import com.eainde.vendorrisk.model.Finding;
import com.eainde.vendorrisk.model.FindingCategory;
import com.eainde.vendorrisk.model.FindingType;
import com.eainde.vendorrisk.model.RiskLevel;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Emits a {@code missing_elements} finding for every checklist term absent from the document.
 */
public class ExpectedElementsChecker {

    public List<Finding> check(String text, DocumentType type) {
        List<String> expected = IndicatorCatalog.EXPECTED_ELEMENTS.getOrDefault(type, List.of());
        if (expected.isEmpty()) {
            return List.of();
        }
        String lower = text.toLowerCase(Locale.ROOT).replace('\u2019', '\'');
        List<Finding> findings = new ArrayList<>();
        for (String element : expected) {
            if (!lower.contains(element)) {
                findings.add(Finding.builder()
                        .category(FindingCategory.MISSING_ELEMENTS)
                        .type(FindingType.MISSING)
                        .riskLevel(RiskLevel.MEDIUM)
                        .confidence(0.8)
                        .impact(6)
                        .description("Expected element missing from " + type.label() + ": " + element)
                        .evidence("")
                        .build());
            }
        }
        return findings;
    }
}
