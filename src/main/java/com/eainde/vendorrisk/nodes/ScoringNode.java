package com.eainde.vendorrisk.nodes;

import com.eainde.vendorrisk.model.RiskAssessment;
import com.eainde.vendorrisk.scoring.RiskScoringEngine;
import com.eainde.vendorrisk.state.AssessmentState;
import lombok.RequiredArgsConstructor;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Component
@RequiredArgsConstructor
public class ScoringNode implements AsyncNodeAction<AssessmentState> {

    private final RiskScoringEngine scoringEngine;

    @Override
    public CompletableFuture<Map<String, Object>> apply(AssessmentState state) {
        RiskAssessment assessment = scoringEngine.score(state.getFindings(), state.getCriteria());
        return CompletableFuture.completedFuture(Map.of(AssessmentState.ASSESSMENT, assessment));
    }
}
