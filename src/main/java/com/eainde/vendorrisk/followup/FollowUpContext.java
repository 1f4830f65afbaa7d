package com.eainde.vendorrisk.followup;

import com.eainde.vendorrisk.model.Finding;
import com.eainde.vendorrisk.model.FindingType;
import com.eainde.vendorrisk.model.RiskAssessment;
import com.eainde.vendorrisk.model.RiskLevel;

import java.util.List;
import java.util.function.Predicate;

/**
 * What the rule predicates see.
 */
public record FollowUpContext(List<Finding> findings, RiskAssessment assessment) {

    public List<Finding> select(Predicate<Finding> selector) {
        return findings.stream().filter(selector).toList();
    }

    public static Predicate<Finding> matching(String category, FindingType type) {
        return f -> f.is(category, type);
    }

    public static Predicate<Finding> atLeast(RiskLevel level) {
        return f -> f.riskLevel().atLeast(level);
    }
}
