package com.eainde.vendorrisk.analysis;

import com.eainde.vendorrisk.model.Finding;
import com.eainde.vendorrisk.model.FindingCategory;
import com.eainde.vendorrisk.model.FindingType;
import com.eainde.vendorrisk.model.RiskLevel;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;

/**
 * Extra evidence for attestation (SOC 2 style) reports. Only matches produce findings.
 */
public class AttestationReportAnalyzer {

    public List<Finding> analyze(String text) {
        List<Finding> findings = new ArrayList<>();
        for (String name : IndicatorCatalog.ATTESTATION_ORDER) {
            Matcher m = IndicatorCatalog.ATTESTATION_PATTERNS.get(name).matcher(text);
            if (m.find()) {
                findings.add(Finding.builder()
                        .category(FindingCategory.SOC2_COMPLIANCE)
                        .type(FindingType.COMPLIANT)
                        .riskLevel(RiskLevel.LOW)
                        .confidence(0.9)
                        .impact(3)
                        .description("Attestation report contains " + name.replace('_', ' '))
                        .evidence(m.group())
                        .build());
            }
        }
        return findings;
    }
}
