package com.eainde.vendorrisk.analysis;

import com.eainde.vendorrisk.model.Finding;
import com.eainde.vendorrisk.model.FindingType;
import com.eainde.vendorrisk.model.RiskLevel;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic keyword/regex pass over {@link IndicatorCatalog#INDICATORS}. Emits exactly one
 * finding per indicator:
 * <ul>
 *   <li>any strict pattern matches → {@code compliant}, low, 0.8</li>
 *   <li>at least half of the keywords present → {@code unclear}, medium, 0.6</li>
 *   <li>otherwise → {@code missing}, high, 0.7</li>
 * </ul>
 */
public class PatternAnalyzer {

    static final double COMPLIANT_CONFIDENCE = 0.8;
    static final double UNCLEAR_CONFIDENCE = 0.6;
    static final double MISSING_CONFIDENCE = 0.7;

    private static final int MAX_EVIDENCE = 3;

    public List<Finding> analyze(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        List<Finding> findings = new ArrayList<>(IndicatorCatalog.INDICATORS.size());
        for (ComplianceIndicator indicator : IndicatorCatalog.INDICATORS) {
            findings.add(evaluate(indicator, text, lower));
        }
        return findings;
    }

    private Finding evaluate(ComplianceIndicator indicator, String text, String lower) {
        List<String> matches = strictMatches(indicator, text);
        List<String> keywords = indicator.keywords().stream().filter(lower::contains).toList();
        String label = indicator.category().replace('_', ' ');

        if (!matches.isEmpty()) {
            return Finding.builder()
                    .category(indicator.category())
                    .type(FindingType.COMPLIANT)
                    .riskLevel(RiskLevel.LOW)
                    .confidence(COMPLIANT_CONFIDENCE)
                    .impact(indicator.impact())
                    .description("Specific " + label + " controls are documented")
                    .evidence(String.join("; ", matches))
                    .build();
        }
        if (keywords.size() >= indicator.keywords().size() / 2 && !keywords.isEmpty()) {
            return Finding.builder()
                    .category(indicator.category())
                    .type(FindingType.UNCLEAR)
                    .riskLevel(RiskLevel.MEDIUM)
                    .confidence(UNCLEAR_CONFIDENCE)
                    .impact(indicator.impact())
                    .description(capitalize(label) + " is mentioned but no specific controls are described")
                    .evidence("Keywords found: " + String.join(", ", keywords))
                    .build();
        }
        return Finding.builder()
                .category(indicator.category())
                .type(FindingType.MISSING)
                .riskLevel(RiskLevel.HIGH)
                .confidence(MISSING_CONFIDENCE)
                .impact(indicator.impact())
                .description("No information about " + label + " was found")
                .evidence("")
                .build();
    }

    private List<String> strictMatches(ComplianceIndicator indicator, String text) {
        List<String> matches = new ArrayList<>();
        for (Pattern pattern : indicator.strictPatterns()) {
            Matcher m = pattern.matcher(text);
            while (m.find() && matches.size() < MAX_EVIDENCE) {
                matches.add(m.group());
            }
            if (matches.size() >= MAX_EVIDENCE) break;
        }
        return matches;
    }

    private static String capitalize(String s) {
        return s.isEmpty() ? s : Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }
}
