package com.eainde.vendorrisk.edges;

import com.eainde.vendorrisk.state.AssessmentState;
import org.bsc.langgraph4j.action.AsyncEdgeAction;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * After discovery: retrieve when there is something to retrieve, otherwise go straight to scoring.
 */
@Component
public class CandidateRoutingEdge implements AsyncEdgeAction<AssessmentState> {

    public static final String RETRIEVE = "retrieve";
    public static final String SCORE = "score";

    @Override
    public CompletableFuture<String> apply(AssessmentState state) {
        String next = state.isCancelled() || state.getCandidates().isEmpty() ? SCORE : RETRIEVE;
        return CompletableFuture.completedFuture(next);
    }
}
