package com.eainde.vendorrisk.discovery;

import java.util.List;
import java.util.Locale;

/**
 * Decides whether a page is a vendor trust center by summing the weights of the trust indicators
 * present in its text. Each indicator counts once regardless of how often it appears.
 */
public class TrustCenterDetector {

    record Indicator(String term, double weight) {
    }

    static final List<Indicator> INDICATORS = List.of(
            new Indicator("trust center", 2.0),
            new Indicator("soc 2", 1.0),
            new Indicator("soc ii", 1.0),
            new Indicator("iso 27001", 1.0),
            new Indicator("gdpr", 1.0),
            new Indicator("hipaa", 1.0),
            new Indicator("pci dss", 1.0),
            new Indicator("compliance", 1.0),
            new Indicator("security certification", 1.0),
            new Indicator("security controls", 1.0),
            new Indicator("privacy policy", 1.0),
            new Indicator("data protection", 1.0));

    /** Link keywords that point towards a trust center, most specific first. */
    static final List<String> LINK_KEYWORDS = List.of("trust", "security", "compliance", "privacy", "certifications");

    private final double threshold;

    public TrustCenterDetector(double threshold) {
        this.threshold = threshold;
    }

    public double score(String text) {
        if (text == null || text.isBlank()) return 0.0;
        String lower = text.toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
        double total = 0.0;
        for (Indicator indicator : INDICATORS) {
            if (lower.contains(indicator.term())) {
                total += indicator.weight();
            }
        }
        return total;
    }

    public boolean isTrustCenter(String text) {
        return score(text) >= threshold;
    }
}
