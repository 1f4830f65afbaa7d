package com.eainde.vendorrisk.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Everything one vendor run produced. Always structurally complete, even for degraded runs.
 *
 * @param runId               identifier of the run, also used as MDC {@code runId}
 * @param vendor              the assessed vendor
 * @param overallScore        0-100 inclusive
 * @param componentScores     data security / privacy / compliance / operational
 * @param riskCategory        low / medium / high / critical
 * @param keyRiskFactors      ordered
 * @param recommendations     ordered
 * @param requiresHumanReview analyst review flag
 * @param followUpActions     generated actions
 * @param candidates          discovered candidates in discovery order
 * @param documents           documents that were retrieved and analyzed
 * @param findings            every finding, unordered
 * @param findingSummary      counts of {@code findings}
 * @param auditTrail          audit entries for the run
 * @param cancelled           whether the run was cancelled before completing all stages
 * @param startedAt           run start
 * @param completedAt         run end
 */
public record AssessmentResult(
        String runId,
        VendorProfile vendor,
        double overallScore,
        ScoreBreakdown componentScores,
        RiskLevel riskCategory,
        List<String> keyRiskFactors,
        List<String> recommendations,
        boolean requiresHumanReview,
        List<FollowUpAction> followUpActions,
        List<DocumentCandidate> candidates,
        List<DocumentSummary> documents,
        List<Finding> findings,
        FindingSummary findingSummary,
        List<AuditLogEntry> auditTrail,
        boolean cancelled,
        Instant startedAt,
        Instant completedAt
) implements Serializable {

    public AssessmentResult {
        keyRiskFactors = copy(keyRiskFactors);
        recommendations = copy(recommendations);
        followUpActions = copy(followUpActions);
        candidates = copy(candidates);
        documents = copy(documents);
        findings = copy(findings);
        auditTrail = copy(auditTrail);
    }

    private static <T> List<T> copy(List<T> list) {
        return list == null ? List.of() : List.copyOf(list);
    }
}
