package com.eainde.vendorrisk.scoring;

import com.eainde.vendorrisk.model.Finding;
import com.eainde.vendorrisk.model.FindingCategory;
import com.eainde.vendorrisk.model.FindingType;
import com.eainde.vendorrisk.model.RiskCriteria;
import com.eainde.vendorrisk.model.RiskLevel;
import com.eainde.vendorrisk.model.ScoreBreakdown;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives the human readable part of an assessment: key risk factors and recommendations.
 */
class RiskFactorAnalyzer {

    private static final double COMPONENT_CONCERN = 60.0;

    List<String> keyRiskFactors(List<Finding> findings, RiskCriteria criteria) {
        List<String> factors = new ArrayList<>();

        long critical = findings.stream().filter(f -> f.riskLevel() == RiskLevel.CRITICAL).count();
        if (critical > 0) {
            factors.add(critical + " critical security finding(s)");
        }
        long high = findings.stream().filter(f -> f.riskLevel() == RiskLevel.HIGH).count();
        if (high > 0) {
            factors.add(high + " high-risk finding(s)");
        }
        if (any(findings, FindingCategory.ENCRYPTION, FindingType.MISSING)
                || any(findings, FindingCategory.ACCESS_CONTROL, FindingType.MISSING)) {
            factors.add("Missing critical security controls");
        }
        if (criteria.hasExposure("GDPR") && hasPrivacyGap(findings)) {
            factors.add("GDPR compliance gaps identified");
        }
        if (criteria.dataSensitivity().isElevated() && hasWeakEncryption(findings)) {
            factors.add("Inadequate encryption for sensitive data");
        }
        return factors;
    }

    List<String> recommendations(List<Finding> findings, RiskCriteria criteria, ScoreBreakdown components) {
        List<String> recs = new ArrayList<>();
        if (components.dataSecurity() > COMPONENT_CONCERN) {
            recs.add("Strengthen data security requirements: request evidence of encryption and access management");
        }
        if (components.privacy() > COMPONENT_CONCERN) {
            recs.add("Review the vendor's privacy practices and data handling procedures");
        }
        if (components.compliance() > COMPONENT_CONCERN) {
            recs.add("Request current compliance certifications and audit reports");
        }
        if (components.operational() > COMPONENT_CONCERN) {
            recs.add("Assess incident response and business continuity capabilities");
        }
        if (any(findings, FindingCategory.SOC2_COMPLIANCE, FindingType.MISSING)
                || any(findings, FindingCategory.COMPLIANCE_FRAMEWORKS, FindingType.MISSING)) {
            recs.add("Request current SOC 2 Type II report");
        }
        if (any(findings, FindingCategory.ENCRYPTION, FindingType.MISSING)) {
            recs.add("Clarify data encryption practices and key management procedures");
        }
        if (criteria.dataSensitivity().isElevated()) {
            recs.add("Conduct enhanced due diligence given the sensitivity of the shared data");
        }
        if (criteria.hasExposure("GDPR")) {
            recs.add("Verify GDPR compliance and DPA execution");
        }
        if (recs.isEmpty()) {
            recs.add("Proceed with standard vendor onboarding and annual review");
        }
        return recs;
    }

    private static boolean any(List<Finding> findings, String category, FindingType type) {
        return findings.stream().anyMatch(f -> f.is(category, type));
    }

    private static boolean hasPrivacyGap(List<Finding> findings) {
        return findings.stream().anyMatch(f -> f.type() == FindingType.MISSING
                && (FindingCategory.PRIVACY_GROUP.contains(f.category())
                || FindingCategory.DATA_PROTECTION.equals(f.category())));
    }

    private static boolean hasWeakEncryption(List<Finding> findings) {
        return findings.stream().anyMatch(f -> FindingCategory.ENCRYPTION.equals(f.category())
                && f.type() != FindingType.COMPLIANT);
    }
}
