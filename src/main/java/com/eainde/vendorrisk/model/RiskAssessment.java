package com.eainde.vendorrisk.model;

import java.io.Serializable;
import java.util.List;

/**
 * Output of the scoring stage.
 *
 * @param overallScore        0-100 inclusive
 * @param components          the four component scores
 * @param riskCategory        derived from {@code overallScore}
 * @param keyRiskFactors      ordered, most severe first
 * @param recommendations     ordered
 * @param requiresHumanReview whether an analyst must look at this vendor
 * @param summary             finding counts
 */
public record RiskAssessment(
        double overallScore,
        ScoreBreakdown components,
        RiskLevel riskCategory,
        List<String> keyRiskFactors,
        List<String> recommendations,
        boolean requiresHumanReview,
        FindingSummary summary
) implements Serializable {

    public RiskAssessment {
        keyRiskFactors = keyRiskFactors == null ? List.of() : List.copyOf(keyRiskFactors);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }
}
