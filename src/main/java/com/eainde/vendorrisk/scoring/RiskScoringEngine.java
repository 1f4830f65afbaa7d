package com.eainde.vendorrisk.scoring;

import com.eainde.vendorrisk.config.VendorRiskProperties;
import com.eainde.vendorrisk.model.Finding;
import com.eainde.vendorrisk.model.FindingCategory;
import com.eainde.vendorrisk.model.FindingSummary;
import com.eainde.vendorrisk.model.FindingType;
import com.eainde.vendorrisk.model.RiskAssessment;
import com.eainde.vendorrisk.model.RiskCriteria;
import com.eainde.vendorrisk.model.RiskLevel;
import com.eainde.vendorrisk.model.ScoreBreakdown;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Computes component and overall risk scores from findings and the caller's risk criteria.
 * <p>
 * Pure and deterministic: no I/O, no clock, same inputs give the same {@link RiskAssessment}.
 * Finding order does not matter. Higher scores mean riskier vendors.
 *
 * <pre>
 * overall = clamp( (0.30·dataSecurity + 0.25·privacy + 0.20·compliance + 0.25·operational)
 *                  × max(geography, regulatory, sensitivity, access) )
 * </pre>
 */
public class RiskScoringEngine {

    private static final Logger log = LoggerFactory.getLogger(RiskScoringEngine.class);

    static final double NEUTRAL = 50.0;

    private static final Map<FindingType, Double> TYPE_SCORES = Map.of(
            FindingType.COMPLIANT, 20.0,
            FindingType.UNCLEAR, 60.0,
            FindingType.NON_COMPLIANT, 80.0,
            FindingType.MISSING, 90.0);

    private static final Set<String> PRIVACY_REGIMES = Set.of("GDPR", "CCPA", "PIPEDA");
    private static final double PRIVACY_PENALTY_PER_REGIME = 10.0;
    private static final double PRIVACY_PENALTY_CAP = 30.0;

    private static final double COMPLIANCE_BASE = 60.0;
    private static final double COMPLIANCE_CREDIT = 5.0;
    private static final double COMPLIANCE_PENALTY = 8.0;

    private static final int HIGH_FINDINGS_FOR_REVIEW = 3;
    private static final int UNCERTAIN_FINDINGS_FOR_REVIEW = 2;

    private final VendorRiskProperties.Scoring settings;
    private final RiskFactorAnalyzer factorAnalyzer = new RiskFactorAnalyzer();

    public RiskScoringEngine(VendorRiskProperties.Scoring settings) {
        double sum = settings.getComponentWeights().sum();
        if (Math.abs(sum - 1.0) > 1e-6) {
            throw new IllegalArgumentException("Component weights must sum to 1.0 but sum to " + sum);
        }
        this.settings = settings;
    }

    public RiskAssessment score(List<Finding> findings, RiskCriteria criteria) {
        RiskCriteria c = criteria == null ? RiskCriteria.defaults() : criteria;
        List<Finding> f = findings == null ? List.of() : findings;

        ScoreBreakdown components = new ScoreBreakdown(
                round(dataSecurityScore(f, c)),
                round(privacyScore(f, c)),
                round(complianceScore(f)),
                round(operationalScore(f, c)));

        VendorRiskProperties.ComponentWeights w = settings.getComponentWeights();
        double base = w.getDataSecurity() * components.dataSecurity()
                + w.getPrivacy() * components.privacy()
                + w.getCompliance() * components.compliance()
                + w.getOperational() * components.operational();
        double multiplier = contextMultiplier(c);
        double overall = round(clamp(base * multiplier));

        RiskLevel category = categorize(overall);
        boolean review = requiresHumanReview(overall, f);
        List<String> factors = factorAnalyzer.keyRiskFactors(f, c);
        List<String> recommendations = factorAnalyzer.recommendations(f, c, components);

        log.info("Scored {} findings: overall={} ({}) base={} multiplier={} review={}",
                f.size(), overall, category.value(), round(base), multiplier, review);
        return new RiskAssessment(overall, components, category, factors, recommendations, review,
                FindingSummary.of(f));
    }

    // =========================================================================
    //  Components
    // =========================================================================

    double dataSecurityScore(List<Finding> findings, RiskCriteria criteria) {
        boolean elevated = criteria.dataSensitivity().isElevated();
        double total = 0.0;
        for (String category : FindingCategory.DATA_SECURITY_GROUP) {
            double weight;
            if (elevated) {
                weight = FindingCategory.ENCRYPTION.equals(category) ? 0.4 : 0.2;
            } else {
                weight = 1.0 / FindingCategory.DATA_SECURITY_GROUP.size();
            }
            total += weight * categoryScore(findings, category);
        }
        return clamp(total);
    }

    double privacyScore(List<Finding> findings, RiskCriteria criteria) {
        double base = groupMean(findings, FindingCategory.PRIVACY_GROUP);
        long regimes = criteria.regulatoryExposures().stream().filter(PRIVACY_REGIMES::contains).count();
        double penalty = Math.min(PRIVACY_PENALTY_PER_REGIME * regimes, PRIVACY_PENALTY_CAP);
        return clamp(base + penalty);
    }

    double complianceScore(List<Finding> findings) {
        int compliant = 0;
        int missing = 0;
        boolean any = false;
        for (Finding f : findings) {
            if (!FindingCategory.COMPLIANCE_GROUP.contains(f.category())) continue;
            any = true;
            if (f.type() == FindingType.COMPLIANT) compliant++;
            else if (f.type() == FindingType.MISSING) missing++;
        }
        if (!any) {
            return NEUTRAL;
        }
        return clamp(COMPLIANCE_BASE - COMPLIANCE_CREDIT * compliant + COMPLIANCE_PENALTY * missing);
    }

    double operationalScore(List<Finding> findings, RiskCriteria criteria) {
        double base = groupMean(findings, FindingCategory.OPERATIONAL_GROUP);
        double multiplier = lookup(settings.getCriticalityMultipliers(), criteria.businessCriticality().name(), 1.0);
        return clamp(base * multiplier);
    }

    /**
     * Confidence × impact weighted mean of finding-type scores; {@value #NEUTRAL} without findings.
     */
    static double categoryScore(List<Finding> findings, String category) {
        double weighted = 0.0;
        double totalWeight = 0.0;
        for (Finding f : findings) {
            if (!f.category().equals(category)) continue;
            double weight = f.confidence() * (f.impact() / 10.0);
            weighted += TYPE_SCORES.get(f.type()) * weight;
            totalWeight += weight;
        }
        return totalWeight > 0.0 ? weighted / totalWeight : NEUTRAL;
    }

    private static double groupMean(List<Finding> findings, List<String> categories) {
        double total = 0.0;
        for (String category : categories) {
            total += categoryScore(findings, category);
        }
        return total / categories.size();
    }

    // =========================================================================
    //  Context multiplier
    // =========================================================================

    double contextMultiplier(RiskCriteria criteria) {
        double geography = maxLookup(settings.getGeographyMultipliers(), criteria.geographicLocations());
        double regulatory = maxLookup(settings.getRegulatoryMultipliers(), criteria.regulatoryExposures());
        double sensitivity = lookup(settings.getSensitivityMultipliers(), criteria.dataSensitivity().name(), 1.0);
        double access = lookup(settings.getAccessMultipliers(), criteria.accessLevel().name(), 1.0);
        return Math.max(Math.max(geography, regulatory), Math.max(sensitivity, access));
    }

    /** Max over the listed keys; unknown keys use the table's {@code UNKNOWN} entry, an empty list is 1.0. */
    private static double maxLookup(Map<String, Double> table, List<String> keys) {
        if (keys.isEmpty()) return 1.0;
        double max = 0.0;
        for (String key : keys) {
            max = Math.max(max, lookup(table, key, lookup(table, "UNKNOWN", 1.0)));
        }
        return max;
    }

    private static double lookup(Map<String, Double> table, String key, double fallback) {
        Double value = table.get(key);
        return value != null ? value : fallback;
    }

    // =========================================================================
    //  Classification
    // =========================================================================

    static RiskLevel categorize(double overall) {
        if (overall >= 80) return RiskLevel.CRITICAL;
        if (overall >= 65) return RiskLevel.HIGH;
        if (overall >= 40) return RiskLevel.MEDIUM;
        return RiskLevel.LOW;
    }

    boolean requiresHumanReview(double overall, List<Finding> findings) {
        if (overall >= settings.getHighRiskThreshold()) return true;
        long critical = findings.stream().filter(f -> f.riskLevel() == RiskLevel.CRITICAL).count();
        if (critical > 0) return true;
        long high = findings.stream().filter(f -> f.riskLevel() == RiskLevel.HIGH).count();
        if (high >= HIGH_FINDINGS_FOR_REVIEW) return true;
        long uncertainButImportant = findings.stream()
                .filter(f -> f.confidence() < 0.6 && f.impact() >= 7)
                .count();
        return uncertainButImportant >= UNCERTAIN_FINDINGS_FOR_REVIEW;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(100.0, value));
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
