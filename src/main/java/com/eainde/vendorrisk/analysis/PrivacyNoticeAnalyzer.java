package com.eainde.vendorrisk.analysis;

import com.eainde.vendorrisk.model.Finding;
import com.eainde.vendorrisk.model.FindingCategory;
import com.eainde.vendorrisk.model.FindingType;
import com.eainde.vendorrisk.model.RiskLevel;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Checks a privacy notice for the required disclosures; one finding per disclosure.
 */
public class PrivacyNoticeAnalyzer {

    public List<Finding> analyze(String text) {
        List<Finding> findings = new ArrayList<>();
        for (IndicatorCatalog.Disclosure disclosure : IndicatorCatalog.PRIVACY_DISCLOSURES) {
            Optional<String> match = firstMatch(disclosure.patterns(), text);
            Finding.FindingBuilder finding = Finding.builder()
                    .category(FindingCategory.PRIVACY_COMPLIANCE)
                    .confidence(0.7);
            if (match.isPresent()) {
                finding.type(FindingType.COMPLIANT)
                        .riskLevel(RiskLevel.LOW)
                        .impact(2)
                        .description(disclosure.label() + " disclosed")
                        .evidence(match.get());
            } else {
                finding.type(FindingType.MISSING)
                        .riskLevel(RiskLevel.MEDIUM)
                        .impact(5)
                        .description(disclosure.label() + " not disclosed");
            }
            findings.add(finding.build());
        }
        return findings;
    }

    private static Optional<String> firstMatch(List<Pattern> patterns, String text) {
        for (Pattern p : patterns) {
            Matcher m = p.matcher(text);
            if (m.find()) {
                return Optional.of(m.group());
            }
        }
        return Optional.empty();
    }
}
