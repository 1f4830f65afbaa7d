package com.eainde.vendorrisk.followup;

import com.eainde.vendorrisk.model.ActionPriority;
import com.eainde.vendorrisk.model.ActionType;
import com.eainde.vendorrisk.model.Finding;
import com.eainde.vendorrisk.model.FindingCategory;
import com.eainde.vendorrisk.model.FindingType;
import com.eainde.vendorrisk.model.RiskLevel;

import java.util.List;

import static com.eainde.vendorrisk.followup.FollowUpContext.atLeast;
import static com.eainde.vendorrisk.followup.FollowUpContext.matching;
import static com.eainde.vendorrisk.followup.FollowUpRule.whenFindings;

/**
 * The default rule table. Predicates are independent; every rule that fires yields one action.
 */
public final class FollowUpRules {

    public static final List<FollowUpRule> DEFAULT = List.of(
            whenFindings("missing_attestation_report", FindingCategory.SOC2_COMPLIANCE,
                    matching(FindingCategory.SOC2_COMPLIANCE, FindingType.MISSING), 1,
                    ActionType.DOCUMENT_REQUEST, ActionPriority.HIGH, 5,
                    MessageTemplate.DOCUMENT_REQUEST, "SOC 2 Type II Report Request - {vendor}"),
            whenFindings("missing_compliance_framework", FindingCategory.COMPLIANCE_FRAMEWORKS,
                    matching(FindingCategory.COMPLIANCE_FRAMEWORKS, FindingType.MISSING), 1,
                    ActionType.DOCUMENT_REQUEST, ActionPriority.HIGH, 5,
                    MessageTemplate.DOCUMENT_REQUEST, "Compliance Certification Request - {vendor}"),
            whenFindings("missing_privacy_documentation", FindingCategory.PRIVACY_COMPLIANCE,
                    matching(FindingCategory.PRIVACY_COMPLIANCE, FindingType.MISSING), 1,
                    ActionType.DOCUMENT_REQUEST, ActionPriority.MEDIUM, 7,
                    MessageTemplate.DOCUMENT_REQUEST, "Privacy Documentation Request - {vendor}"),
            whenFindings("unclear_encryption", FindingCategory.ENCRYPTION,
                    matching(FindingCategory.ENCRYPTION, FindingType.UNCLEAR), 1,
                    ActionType.CLARIFICATION, ActionPriority.HIGH, 3,
                    MessageTemplate.CLARIFICATION, "Encryption Practices Clarification - {vendor}"),
            whenFindings("critical_compliance_gaps", null,
                    (Finding f) -> f.riskLevel() == RiskLevel.CRITICAL, 1,
                    ActionType.URGENT_CLARIFICATION, ActionPriority.URGENT, 2,
                    MessageTemplate.COMPLIANCE_GAPS, "URGENT: Critical Compliance Gaps - {vendor}"),
            whenFindings("high_risk_vendor", null,
                    atLeast(RiskLevel.HIGH), 3,
                    ActionType.RISK_REVIEW, ActionPriority.HIGH, 5,
                    MessageTemplate.COMPLIANCE_GAPS, "Risk Review Required - {vendor}"),
            new FollowUpRule("human_review_required", null,
                    ctx -> ctx.assessment() != null && ctx.assessment().requiresHumanReview(),
                    ctx -> List.of(),
                    ActionType.INTERNAL_REVIEW, ActionPriority.HIGH, 3,
                    MessageTemplate.INTERNAL_REVIEW, "Internal Review: {vendor} vendor assessment"));

    private FollowUpRules() {
    }
}
