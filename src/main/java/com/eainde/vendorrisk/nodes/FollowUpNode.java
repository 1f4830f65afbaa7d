package com.eainde.vendorrisk.nodes;

import com.eainde.vendorrisk.followup.FollowUpEngine;
import com.eainde.vendorrisk.followup.FollowUpPlan;
import com.eainde.vendorrisk.model.RiskAssessment;
import com.eainde.vendorrisk.state.AssessmentState;
import lombok.RequiredArgsConstructor;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Component
@RequiredArgsConstructor
public class FollowUpNode implements AsyncNodeAction<AssessmentState> {

    private final FollowUpEngine followUpEngine;

    @Override
    public CompletableFuture<Map<String, Object>> apply(AssessmentState state) {
        RiskAssessment assessment = state.getAssessment()
                .orElseThrow(() -> new IllegalStateException("Follow-up requires a scored assessment"));
        FollowUpPlan plan = followUpEngine.generateActions(
                state.getVendor(), state.getFindings(), assessment, state.getRunId());
        return CompletableFuture.completedFuture(Map.of(
                AssessmentState.FOLLOW_UP_ACTIONS, plan.actions(),
                AssessmentState.AUDIT_TRAIL, plan.auditEntries()));
    }
}
